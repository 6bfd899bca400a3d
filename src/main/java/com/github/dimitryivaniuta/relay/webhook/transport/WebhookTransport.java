package com.github.dimitryivaniuta.relay.webhook.transport;

import java.util.Map;

/**
 * Sends one webhook body. Implementations report non-2xx responses and I/O problems through
 * {@link DeliveryOutcome} instead of throwing.
 */
public interface WebhookTransport {

    DeliveryOutcome post(String url, String body, Map<String, String> headers);
}
