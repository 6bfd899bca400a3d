package com.github.dimitryivaniuta.relay.ratelimit;

import com.github.dimitryivaniuta.relay.metrics.RelayMetrics;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-key admission control over a time window.
 * <p>
 * Prefers Redis; a connection-level failure switches the whole service to the local store, any other Redis
 * error answers that single call locally. {@link #checkRateLimit} never throws for store problems.
 * {@link #tryReconnect()} moves back to Redis after a successful PING.
 */
@Slf4j
public class RateLimiterService {

    private final RedisRateLimitStore redis;        // null when Redis is not configured
    private final LocalRateLimitStore local;
    private final RateLimitProperties properties;
    private final RelayMetrics metrics;
    private final Clock clock;

    private final AtomicReference<RateLimitBackend> backend = new AtomicReference<>(RateLimitBackend.MEMORY);
    // outcome of the most recent Redis call or PING
    private final AtomicBoolean redisHealthy = new AtomicBoolean(false);

    public RateLimiterService(RedisRateLimitStore redis,
                              LocalRateLimitStore local,
                              RateLimitProperties properties,
                              RelayMetrics metrics,
                              Clock clock) {
        this.redis = redis;
        this.local = local;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /** Probes Redis with a bounded retry budget and picks the starting backend. */
    public void start() {
        if (redis == null) {
            log.info("Rate limiter using in-memory counters (Redis not configured)");
            return;
        }
        try {
            Retry.decorateRunnable(probeRetry(), redis::ping).run();
            redisHealthy.set(true);
            backend.set(RateLimitBackend.REDIS);
            log.info("Rate limiter connected to Redis");
        } catch (RuntimeException ex) {
            backend.set(RateLimitBackend.MEMORY);
            log.warn("Redis unavailable after {} attempts, rate limiter falls back to memory: {}",
                    properties.getConnectAttempts(), ex.getMessage());
        }
    }

    public RateLimitResult checkRateLimit(String key, int limit, long windowMs) {
        if (limit < 1) throw new IllegalArgumentException("limit must be >= 1");
        if (windowMs < 1) throw new IllegalArgumentException("windowMs must be >= 1");

        long now = clock.millis();
        if (backend.get() == RateLimitBackend.REDIS) {
            try {
                RateLimitResult r = redis.check(key, limit, windowMs, now);
                redisHealthy.set(true);
                record(r, RateLimitBackend.REDIS);
                return r;
            } catch (RuntimeException ex) {
                onRedisFailure("checkRateLimit", key, ex);
            }
        }
        RateLimitResult r = local.check(key, limit, windowMs, now);
        record(r, RateLimitBackend.MEMORY);
        return r;
    }

    public RateLimitStatus getStatus(String key) {
        long now = clock.millis();
        if (backend.get() == RateLimitBackend.REDIS) {
            try {
                RateLimitStatus status = redis.status(key, now)
                        .orElseGet(() -> new RateLimitStatus(key, 0, null, RateLimitBackend.REDIS));
                redisHealthy.set(true);
                return status;
            } catch (RuntimeException ex) {
                onRedisFailure("getStatus", key, ex);
            }
        }
        return local.status(key, now)
                .orElseGet(() -> new RateLimitStatus(key, 0, null, RateLimitBackend.MEMORY));
    }

    public void reset(String key) {
        local.reset(key);
        if (backend.get() == RateLimitBackend.REDIS) {
            try {
                redis.reset(key);
                redisHealthy.set(true);
            } catch (RuntimeException ex) {
                onRedisFailure("reset", key, ex);
            }
        }
    }

    public void clearAll() {
        local.clear();
        if (backend.get() == RateLimitBackend.REDIS) {
            try {
                long deleted = redis.clearAll(properties.getScanBatchSize());
                redisHealthy.set(true);
                log.info("Cleared {} rate limit keys from Redis", deleted);
            } catch (RuntimeException ex) {
                onRedisFailure("clearAll", "*", ex);
            }
        }
    }

    /** Sweeps expired local entries. Redis keys expire on their own TTL. */
    public int cleanupExpired() {
        return local.cleanupExpired(clock.millis());
    }

    /**
     * {@code healthy} follows the last Redis call while Redis is the backend. The memory store cannot fail,
     * so it always reports healthy.
     */
    public RateLimiterStatus getServiceStatus() {
        RateLimitBackend b = backend.get();
        boolean redisConfigured = redis != null;
        boolean healthy = b == RateLimitBackend.MEMORY || redisHealthy.get();
        long entries = (b == RateLimitBackend.REDIS) ? -1 : local.size();
        return new RateLimiterStatus(b, healthy, redisConfigured, entries);
    }

    public RateLimitBackend backend() {
        return backend.get();
    }

    /**
     * Switches back to Redis after a successful PING. No-op when Redis is active, not configured
     * or {@code reconnect-interval} is zero.
     */
    public boolean tryReconnect() {
        if (redis == null || !properties.isReconnectEnabled() || backend.get() == RateLimitBackend.REDIS) {
            return false;
        }
        try {
            redis.ping();
            redisHealthy.set(true);
        } catch (RuntimeException ex) {
            redisHealthy.set(false);
            log.debug("Redis still unavailable: {}", ex.getMessage());
            return false;
        }
        if (backend.compareAndSet(RateLimitBackend.MEMORY, RateLimitBackend.REDIS)) {
            log.info("Redis reachable again, rate limiter switched back to Redis");
            return true;
        }
        return false;
    }

    private void onRedisFailure(String op, String key, RuntimeException ex) {
        redisHealthy.set(false);
        if (isConnectionFailure(ex)) {
            if (backend.compareAndSet(RateLimitBackend.REDIS, RateLimitBackend.MEMORY)) {
                log.warn("Redis connection lost during {} ({}), rate limiter switched to memory: {}",
                        op, key, ex.getMessage());
            }
            metrics.rateLimitFallback("connection");
        } else {
            log.warn("Redis {} failed for key={}, answering from memory: {}", op, key, ex.getMessage());
            metrics.rateLimitFallback("operation");
        }
    }

    private void record(RateLimitResult r, RateLimitBackend b) {
        if (r.allowed()) metrics.rateLimitAllowed(b.tag());
        else metrics.rateLimitRejected(b.tag());
    }

    private Retry probeRetry() {
        // min(n * 50ms, 2s) between PING attempts
        IntervalFunction interval = attempt -> Math.min(attempt * 50L, 2_000L);
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, properties.getConnectAttempts()))
                .intervalFunction(interval)
                .retryExceptions(RuntimeException.class)
                .build();
        return Retry.of("redis-rate-limit-probe", config);
    }

    static boolean isConnectionFailure(Throwable ex) {
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof RedisConnectionFailureException) return true;
            if (t.getCause() == t) break;
        }
        return false;
    }
}
