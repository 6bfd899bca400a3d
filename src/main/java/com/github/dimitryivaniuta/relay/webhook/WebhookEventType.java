package com.github.dimitryivaniuta.relay.webhook;

import java.util.Optional;

/** Event tags a tenant can subscribe to through the HTTP API. */
public enum WebhookEventType {
    RATE_LIMIT_EXCEEDED("rate_limit.exceeded"),
    API_KEY_CREATED("api_key.created"),
    API_KEY_ROTATED("api_key.rotated"),
    API_KEY_REVOKED("api_key.revoked"),
    API_KEY_DELETED("api_key.deleted"),
    USAGE_THRESHOLD_EXCEEDED("usage.threshold_exceeded"),
    ERROR_CRITICAL("error.critical"),
    HEALTH_DEGRADED("health.degraded");

    private final String tag;

    WebhookEventType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<WebhookEventType> fromTag(String tag) {
        for (WebhookEventType t : values()) {
            if (t.tag.equals(tag)) return Optional.of(t);
        }
        return Optional.empty();
    }

    public static boolean isKnown(String tag) {
        return fromTag(tag).isPresent();
    }
}
