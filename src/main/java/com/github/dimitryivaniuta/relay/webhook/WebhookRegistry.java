package com.github.dimitryivaniuta.relay.webhook;

import com.github.dimitryivaniuta.relay.signature.WebhookSignatureService;
import com.github.dimitryivaniuta.relay.webhook.store.DeliveryHistoryStore;
import com.github.dimitryivaniuta.relay.webhook.store.WebhookEndpointStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Owns endpoint subscriptions. Ownership checks belong to the caller; the registry only records the owner.
 * URL syntax is validated by the HTTP layer before {@link #register} is called.
 */
@Slf4j
public class WebhookRegistry {

    private final WebhookEndpointStore endpoints;
    private final DeliveryHistoryStore history;
    private final RetryScheduler retries;
    private final WebhookSignatureService signatures;
    private final WebhookProperties properties;
    private final Clock clock;

    public WebhookRegistry(WebhookEndpointStore endpoints,
                           DeliveryHistoryStore history,
                           RetryScheduler retries,
                           WebhookSignatureService signatures,
                           WebhookProperties properties,
                           Clock clock) {
        this.endpoints = endpoints;
        this.history = history;
        this.retries = retries;
        this.signatures = signatures;
        this.properties = properties;
        this.clock = clock;
    }

    public WebhookEndpoint register(long ownerId, String url, Set<String> eventTypes, String secret) {
        return register(ownerId, url, eventTypes, secret, null);
    }

    public WebhookEndpoint register(long ownerId, String url, Set<String> eventTypes, String secret, Integer maxRetries) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Webhook URL is required");
        }
        if (eventTypes == null || eventTypes.isEmpty()) {
            throw new IllegalArgumentException("At least one event type is required");
        }
        if (secret != null && !signatures.isValidSecret(secret)) {
            throw new IllegalArgumentException("Secret must be at least 64 hex characters");
        }
        int retriesAllowed = maxRetries != null ? maxRetries : properties.getDefaultMaxRetries();
        if (retriesAllowed < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1");
        }

        WebhookEndpoint endpoint = new WebhookEndpoint(
                WebhookIds.endpoint(), ownerId, url, eventTypes, secret, retriesAllowed, clock.instant());
        endpoints.save(endpoint);
        history.open(endpoint.getId());

        log.info("Registered webhook {} for owner {} on events {}", endpoint.getId(), ownerId, eventTypes);
        return endpoint;
    }

    public Optional<WebhookEndpoint> get(String id) {
        return endpoints.findById(id);
    }

    public List<WebhookEndpoint> listByOwner(long ownerId) {
        return endpoints.findByOwner(ownerId);
    }

    public List<WebhookEndpoint> listAll() {
        return endpoints.findAll();
    }

    /**
     * Applies non-null fields. Re-activating an endpoint resets its failure count, deactivating it
     * cancels its pending retries.
     */
    public Optional<WebhookEndpoint> update(String id, WebhookUpdate update) {
        Optional<WebhookEndpoint> found = endpoints.findById(id);
        found.ifPresent(endpoint -> {
            if (update.url() != null) {
                if (update.url().isBlank()) throw new IllegalArgumentException("Webhook URL is required");
                endpoint.setUrl(update.url());
            }
            if (update.events() != null) {
                if (update.events().isEmpty()) throw new IllegalArgumentException("At least one event type is required");
                endpoint.setEventTypes(update.events());
            }
            if (update.active() != null) {
                if (update.active()) {
                    endpoint.activate();
                } else {
                    endpoint.deactivate();
                    retries.cancelForEndpoint(id);
                }
            }
            endpoints.save(endpoint);
            log.info("Updated webhook {}", id);
        });
        return found;
    }

    /** Generates and stores a new secret; the value is only ever returned here. */
    public Optional<String> rotateSecret(String id) {
        return endpoints.findById(id).map(endpoint -> {
            String secret = signatures.generateSecret();
            endpoint.setSecret(secret);
            endpoints.save(endpoint);
            log.info("Rotated secret of webhook {}", id);
            return secret;
        });
    }

    public boolean delete(String id) {
        boolean removed = endpoints.delete(id);
        if (removed) {
            retries.cancelForEndpoint(id);
            history.remove(id);
            log.info("Deleted webhook {}", id);
        }
        return removed;
    }

    public void clear() {
        endpoints.clear();
        history.clear();
        retries.cancelAll();
    }
}
