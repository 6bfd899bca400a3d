package com.github.dimitryivaniuta.relay.ratelimit;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.FixedDelayTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Sweeps expired in-memory counters every {@code relay.rate-limit.cleanup-interval} and, while running on the
 * fallback, tries to get back to Redis every {@code relay.rate-limit.reconnect-interval}.
 */
@Component
@RequiredArgsConstructor
public class RateLimitMaintenanceJob implements SchedulingConfigurer {

    private static final Logger log = LoggerFactory.getLogger(RateLimitMaintenanceJob.class);

    private final RateLimiterService limiter;
    private final RateLimitProperties properties;

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        Duration cleanup = properties.getCleanupInterval();
        if (cleanup == null || cleanup.isZero() || cleanup.isNegative()) {
            throw new IllegalStateException("relay.rate-limit.cleanup-interval must be positive");
        }
        registrar.addFixedDelayTask(new FixedDelayTask(this::cleanup, cleanup, cleanup));

        if (properties.isReconnectEnabled()) {
            Duration reconnect = properties.getReconnectInterval();
            registrar.addFixedDelayTask(new FixedDelayTask(this::reconnect, reconnect, reconnect));
        } else {
            log.info("Redis reconnect probe disabled (relay.rate-limit.reconnect-interval=0)");
        }
    }

    public void cleanup() {
        int removed = limiter.cleanupExpired();
        if (removed > 0) {
            log.debug("Rate limit cleanup removed {} expired entries", removed);
        }
    }

    public void reconnect() {
        limiter.tryReconnect();
    }
}
