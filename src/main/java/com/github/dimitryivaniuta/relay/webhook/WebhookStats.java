package com.github.dimitryivaniuta.relay.webhook;

/**
 * Computed over the retained history only.
 *
 * @param successRate percentage 0..100, 0 when there is no history
 */
public record WebhookStats(long totalDeliveries, long successfulDeliveries, long failedDeliveries, double successRate) {}
