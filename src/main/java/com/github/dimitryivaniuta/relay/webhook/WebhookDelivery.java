package com.github.dimitryivaniuta.relay.webhook;

import java.time.Instant;
import java.util.Map;

/**
 * One delivery attempt of one event to one endpoint.
 *
 * @param payload     the event data that was sent, kept so the delivery can be replayed
 * @param statusCode  HTTP status, null on transport errors
 * @param response    response body (truncated), null on transport errors
 * @param error       transport error text, null when a response arrived
 * @param nextRetryAt set when another attempt has been scheduled
 * @param replayOf    id of the delivery this attempt replays, null otherwise
 */
public record WebhookDelivery(
        String id,
        String webhookId,
        String eventId,
        String eventType,
        Map<String, Object> payload,
        int attempt,
        Integer statusCode,
        String response,
        String error,
        Instant timestamp,
        Instant nextRetryAt,
        String replayOf
) {

    public WebhookDelivery {
        payload = payload == null ? Map.of() : payload;
    }

    public boolean successful() {
        return statusCode != null && statusCode >= 200 && statusCode < 300;
    }
}
