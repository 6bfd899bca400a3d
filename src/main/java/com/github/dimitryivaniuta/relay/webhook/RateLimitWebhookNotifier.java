package com.github.dimitryivaniuta.relay.webhook;

import com.github.dimitryivaniuta.relay.ratelimit.RateLimitRejectedEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/** Turns throttled tenant requests into {@code rate_limit.exceeded} webhooks. */
@Component
@RequiredArgsConstructor
public class RateLimitWebhookNotifier {

    private final WebhookDeliveryEngine engine;

    @EventListener
    public void onRateLimitRejected(RateLimitRejectedEvent e) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("route", e.route());
        data.put("limit", e.limit());
        data.put("windowMs", e.windowMs());
        data.put("retryAfter", e.retryAfterSeconds());
        data.put("resetTime", e.resetTime().toString());
        engine.triggerEvent(WebhookEventType.RATE_LIMIT_EXCEEDED, e.tenantId(), data);
    }
}
