package com.github.dimitryivaniuta.relay.webhook;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A triggered event. {@code targetWebhookId} pins a replay to one endpoint; {@code replayOf} names the
 * delivery it redelivers. Both are null for ordinary fan-out events.
 */
public record WebhookEvent(String id,
                           String type,
                           long ownerId,
                           Map<String, Object> payload,
                           Instant createdAt,
                           String targetWebhookId,
                           String replayOf) {

    public WebhookEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public WebhookEvent(String id, String type, long ownerId, Map<String, Object> payload, Instant createdAt) {
        this(id, type, ownerId, payload, createdAt, null, null);
    }

    public boolean isReplay() {
        return replayOf != null;
    }
}
