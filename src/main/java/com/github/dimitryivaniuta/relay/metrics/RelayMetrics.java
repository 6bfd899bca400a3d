package com.github.dimitryivaniuta.relay.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class RelayMetrics {

    private final MeterRegistry registry;

    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Rate limiting ----
    public void rateLimitAllowed(String backend) {
        Counter.builder("relay_ratelimit_allowed_total")
                .tag("backend", backend) // redis | memory
                .register(registry)
                .increment();
    }

    public void rateLimitRejected(String backend) {
        Counter.builder("relay_ratelimit_rejected_total")
                .tag("backend", backend)
                .register(registry)
                .increment();
    }

    public void rateLimitFallback(String reason) {
        Counter.builder("relay_ratelimit_fallback_total")
                .tag("reason", reason) // connection | operation
                .register(registry)
                .increment();
    }

    // ---- Webhooks ----
    public void eventTriggered(String eventType) {
        Counter.builder("relay_webhook_events_total")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    public void deliveryAttempt(String outcome) {
        Counter.builder("relay_webhook_delivery_attempts_total")
                .tag("outcome", outcome) // success | failure
                .register(registry)
                .increment();
    }

    public void retryScheduled() {
        Counter.builder("relay_webhook_retries_scheduled_total")
                .register(registry)
                .increment();
    }

    public void endpointDisabled() {
        Counter.builder("relay_webhook_endpoints_disabled_total")
                .register(registry)
                .increment();
    }

    public void deliveryRejected() {
        Counter.builder("relay_webhook_delivery_rejected_total")
                .register(registry)
                .increment();
    }

    public void deliveryReplayed() {
        Counter.builder("relay_webhook_delivery_replayed_total")
                .register(registry)
                .increment();
    }

    // ---- Duration ----
    public void recordDeliveryDuration(String outcome, long nanos) {
        Timer.builder("relay_webhook_delivery_duration_seconds")
                .tag("outcome", outcome)
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }
}
