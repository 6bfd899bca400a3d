package com.github.dimitryivaniuta.relay.webhook.store;

import com.github.dimitryivaniuta.relay.webhook.WebhookEndpoint;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryWebhookEndpointStore implements WebhookEndpointStore {

    private static final Comparator<WebhookEndpoint> BY_CREATION =
            Comparator.comparing(WebhookEndpoint::getCreatedAt).thenComparing(WebhookEndpoint::getId);

    private final ConcurrentMap<String, WebhookEndpoint> endpoints = new ConcurrentHashMap<>();

    @Override
    public WebhookEndpoint save(WebhookEndpoint endpoint) {
        endpoints.put(endpoint.getId(), endpoint);
        return endpoint;
    }

    @Override
    public Optional<WebhookEndpoint> findById(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(endpoints.get(id));
    }

    @Override
    public List<WebhookEndpoint> findByOwner(long ownerId) {
        return endpoints.values().stream()
                .filter(e -> e.getOwnerId() == ownerId)
                .sorted(BY_CREATION)
                .toList();
    }

    @Override
    public List<WebhookEndpoint> findAll() {
        return endpoints.values().stream().sorted(BY_CREATION).toList();
    }

    @Override
    public boolean delete(String id) {
        return endpoints.remove(id) != null;
    }

    @Override
    public void clear() {
        endpoints.clear();
    }
}
