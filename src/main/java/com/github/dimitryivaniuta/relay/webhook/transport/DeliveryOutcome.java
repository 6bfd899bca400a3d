package com.github.dimitryivaniuta.relay.webhook.transport;

/**
 * Result of one POST. Either a status code (with optional body) or a transport error.
 */
public record DeliveryOutcome(Integer statusCode, String body, String error) {

    public static DeliveryOutcome response(int statusCode, String body) {
        return new DeliveryOutcome(statusCode, body, null);
    }

    public static DeliveryOutcome failure(String error) {
        return new DeliveryOutcome(null, null, error);
    }

    public boolean isSuccess() {
        return statusCode != null && statusCode >= 200 && statusCode < 300;
    }

    /** 4xx that retrying cannot fix; 408 and 429 are considered transient. */
    public boolean isPermanentClientError() {
        return statusCode != null && statusCode >= 400 && statusCode < 500
                && statusCode != 408 && statusCode != 429;
    }

    /** Short text for logs and test results. */
    public String describe() {
        return statusCode != null ? "HTTP " + statusCode : error;
    }
}
