package com.github.dimitryivaniuta.relay.webhook.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.dimitryivaniuta.relay.ratelimit.RateLimited;
import com.github.dimitryivaniuta.relay.signature.SignatureAlgorithm;
import com.github.dimitryivaniuta.relay.signature.SignatureVerification;
import com.github.dimitryivaniuta.relay.signature.WebhookSignatureService;
import com.github.dimitryivaniuta.relay.webhook.*;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static com.github.dimitryivaniuta.relay.web.RequestContextKeys.TENANT_ID_ATTRIBUTE;

/**
 * Webhook management for the calling tenant. Endpoints owned by another tenant answer 404.
 */
@Validated
@RestController
@RateLimited
@RequiredArgsConstructor
@RequestMapping("/api/webhooks")
public class WebhookController {

    static final int MAX_HISTORY_LIMIT = 1000;

    private final WebhookRegistry registry;
    private final WebhookDeliveryEngine engine;
    private final WebhookSignatureService signatures;

    // ---------- DTOs ----------
    public record CreateWebhookRequest(
            @NotBlank(message = "Webhook URL is required") String url,
            @NotEmpty(message = "At least one event type is required") Set<String> events,
            String secret,
            @Min(1) @Max(10) Integer maxRetries
    ) {}

    public record UpdateWebhookRequest(
            String url,
            Set<String> events,
            @JsonProperty("isActive") Boolean active
    ) {}

    public record WebhookResponse(
            String id,
            String url,
            Set<String> events,
            @JsonProperty("isActive") boolean active,
            boolean hasSecret,
            int failureCount,
            int maxRetries,
            Instant createdAt,
            Instant lastTriggeredAt
    ) {}

    public record SecretResponse(String id, String secret) {}

    /** Omit {@code payload} to resend the recorded data unchanged. */
    public record ReplayRequest(Map<String, Object> payload) {}

    public record ReplayResponse(String eventId, String webhookId, String replayOf, String eventType) {}

    public record VerifySignatureRequest(
            Object payload,
            String body,
            @NotEmpty Map<String, String> headers,
            @NotBlank String secret,
            String algorithm,
            Long toleranceSeconds
    ) {}

    // ---------- endpoints ----------

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public WebhookResponse create(@RequestAttribute(TENANT_ID_ATTRIBUTE) Long tenantId,
                                  @Valid @RequestBody CreateWebhookRequest req) {
        requireValidUrl(req.url());
        Set<String> events = requireKnownEvents(req.events());
        try {
            return toResponse(registry.register(tenantId, req.url(), events, req.secret(), req.maxRetries()));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    @GetMapping
    public List<WebhookResponse> list(@RequestAttribute(TENANT_ID_ATTRIBUTE) Long tenantId) {
        return registry.listByOwner(tenantId).stream().map(WebhookController::toResponse).toList();
    }

    @GetMapping("/{id}")
    public WebhookResponse get(@RequestAttribute(TENANT_ID_ATTRIBUTE) Long tenantId, @PathVariable String id) {
        return toResponse(requireOwned(tenantId, id));
    }

    @PatchMapping("/{id}")
    public WebhookResponse update(@RequestAttribute(TENANT_ID_ATTRIBUTE) Long tenantId,
                                  @PathVariable String id,
                                  @RequestBody UpdateWebhookRequest req) {
        requireOwned(tenantId, id);
        if (req.url() != null) requireValidUrl(req.url());
        Set<String> events = req.events() == null ? null : requireKnownEvents(req.events());
        try {
            return registry.update(id, new WebhookUpdate(req.url(), events, req.active()))
                    .map(WebhookController::toResponse)
                    .orElseThrow(WebhookController::notFound);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
    }

    @DeleteMapping("/{id}")
    public Map<String, Boolean> delete(@RequestAttribute(TENANT_ID_ATTRIBUTE) Long tenantId, @PathVariable String id) {
        requireOwned(tenantId, id);
        return Map.of("deleted", registry.delete(id));
    }

    @GetMapping("/{id}/deliveries")
    public List<WebhookDelivery> deliveries(@RequestAttribute(TENANT_ID_ATTRIBUTE) Long tenantId,
                                            @PathVariable String id,
                                            @RequestParam(defaultValue = "100") int limit) {
        requireOwned(tenantId, id);
        int clamped = Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT));
        return engine.getDeliveryHistory(id, clamped);
    }

    @GetMapping("/{id}/stats")
    public WebhookStats stats(@RequestAttribute(TENANT_ID_ATTRIBUTE) Long tenantId, @PathVariable String id) {
        requireOwned(tenantId, id);
        return engine.getWebhookStats(id);
    }

    @PostMapping("/{id}/test")
    @RateLimited(limit = 10, windowMs = 60_000)
    public WebhookTestResult test(@RequestAttribute(TENANT_ID_ATTRIBUTE) Long tenantId, @PathVariable String id) {
        requireOwned(tenantId, id);
        return engine.testWebhook(id);
    }

    @PostMapping("/{id}/deliveries/{deliveryId}/replay")
    @ResponseStatus(HttpStatus.ACCEPTED)
    @RateLimited(limit = 30, windowMs = 60_000)
    public ReplayResponse replay(@RequestAttribute(TENANT_ID_ATTRIBUTE) Long tenantId,
                                 @PathVariable String id,
                                 @PathVariable String deliveryId,
                                 @RequestBody(required = false) ReplayRequest req) {
        requireOwned(tenantId, id);
        Map<String, Object> edited = req == null ? null : req.payload();
        if (edited != null && edited.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Payload cannot be empty");
        }
        try {
            WebhookEvent event = engine.replayDelivery(id, deliveryId, edited)
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Delivery not found"));
            return new ReplayResponse(event.id(), id, deliveryId, event.type());
        } catch (IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, ex.getMessage(), ex);
        }
    }

    @GetMapping("/{id}/replays")
    public List<WebhookDelivery> replays(@RequestAttribute(TENANT_ID_ATTRIBUTE) Long tenantId,
                                         @PathVariable String id,
                                         @RequestParam(defaultValue = "50") int limit) {
        requireOwned(tenantId, id);
        return engine.getReplayHistory(id, Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT)));
    }

    @PostMapping("/{id}/secret")
    public SecretResponse rotateSecret(@RequestAttribute(TENANT_ID_ATTRIBUTE) Long tenantId, @PathVariable String id) {
        requireOwned(tenantId, id);
        String secret = registry.rotateSecret(id).orElseThrow(WebhookController::notFound);
        return new SecretResponse(id, secret);
    }

    /** Checks a sample delivery against its headers; handy when wiring up a receiver. */
    @PostMapping("/signatures/verify")
    public SignatureVerification verifySignature(@Valid @RequestBody VerifySignatureRequest req) {
        SignatureAlgorithm algorithm = req.algorithm() == null
                ? SignatureAlgorithm.SHA256
                : SignatureAlgorithm.fromTag(req.algorithm()).orElseThrow(() ->
                        new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unsupported algorithm: " + req.algorithm()));
        long tolerance = req.toleranceSeconds() != null
                ? req.toleranceSeconds()
                : WebhookSignatureService.DEFAULT_TOLERANCE_SECONDS;

        if (req.body() != null) {
            return signatures.verifyRawFromHeaders(req.body(), req.headers(), req.secret(), algorithm, tolerance);
        }
        if (req.payload() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Either body or payload is required");
        }
        return signatures.verifyFromHeaders(req.payload(), req.headers(), req.secret(), algorithm, tolerance);
    }

    // ---------- helpers ----------

    private WebhookEndpoint requireOwned(Long tenantId, String id) {
        return registry.get(id)
                .filter(e -> e.getOwnerId() == tenantId)
                .orElseThrow(WebhookController::notFound);
    }

    private static ResponseStatusException notFound() {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Webhook not found");
    }

    static void requireValidUrl(String url) {
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!uri.isAbsolute() || uri.getHost() == null || !(scheme.equals("http") || scheme.equals("https"))) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid webhook URL format");
            }
        } catch (URISyntaxException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid webhook URL format", ex);
        }
    }

    static Set<String> requireKnownEvents(Set<String> events) {
        if (events == null || events.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "At least one event type is required");
        }
        Set<String> unknown = new TreeSet<>();
        for (String e : events) {
            if (!WebhookEventType.isKnown(e)) unknown.add(e);
        }
        if (!unknown.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown event types: " + unknown);
        }
        return new TreeSet<>(events);
    }

    static WebhookResponse toResponse(WebhookEndpoint e) {
        return new WebhookResponse(
                e.getId(),
                e.getUrl(),
                new TreeSet<>(e.getEventTypes()),
                e.isActive(),
                e.hasSecret(),
                e.getFailureCount(),
                e.getMaxRetries(),
                e.getCreatedAt(),
                e.getLastTriggeredAt()
        );
    }
}
