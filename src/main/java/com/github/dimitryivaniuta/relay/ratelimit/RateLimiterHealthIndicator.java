package com.github.dimitryivaniuta.relay.ratelimit;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the active limiter backend. Running on the memory fallback while Redis is configured is
 * reported as UP with {@code degraded=true}, as is a failed last Redis call. Callers still get decisions.
 */
@Component("rateLimiter")
@RequiredArgsConstructor
public class RateLimiterHealthIndicator implements HealthIndicator {

    private final RateLimiterService limiter;

    @Override
    public Health health() {
        RateLimiterStatus s = limiter.getServiceStatus();
        boolean degraded = (s.redisConfigured() && s.backend() == RateLimitBackend.MEMORY) || !s.healthy();
        return Health.up()
                .withDetail("backend", s.backend().tag())
                .withDetail("healthy", s.healthy())
                .withDetail("redisConfigured", s.redisConfigured())
                .withDetail("degraded", degraded)
                .withDetail("entryCount", s.entryCount())
                .build();
    }
}
