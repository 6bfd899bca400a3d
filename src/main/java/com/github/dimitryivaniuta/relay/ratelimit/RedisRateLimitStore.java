package com.github.dimitryivaniuta.relay.ratelimit;

import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis counters: one Lua call increments the key and refreshes its expiry, so the reset point
 * slides with the most recent call. Exceptions are left to {@link RateLimiterService}.
 */
public class RedisRateLimitStore {

    private static final String INCREMENT_SCRIPT = """
            redis.call('GET', KEYS[1])
            local current = redis.call('INCR', KEYS[1])
            redis.call('PEXPIRE', KEYS[1], ARGV[1])
            return current
            """;

    private final StringRedisTemplate redis;
    private final String keyPrefix;
    private final DefaultRedisScript<Long> incrementScript;

    public RedisRateLimitStore(StringRedisTemplate redis, String keyPrefix) {
        this.redis = redis;
        this.keyPrefix = keyPrefix;
        this.incrementScript = new DefaultRedisScript<>(INCREMENT_SCRIPT, Long.class);
    }

    public RateLimitResult check(String key, int limit, long windowMs, long nowMs) {
        Long count = redis.execute(incrementScript, List.of(redisKey(key)), Long.toString(windowMs));
        if (count == null) {
            throw new IllegalStateException("Rate limit script returned no value for " + key);
        }
        long retryAfter = (long) Math.ceil(windowMs / 1000.0);
        return RateLimitResult.of(count, limit, Instant.ofEpochMilli(nowMs + windowMs), retryAfter);
    }

    public Optional<RateLimitStatus> status(String key, long nowMs) {
        String rk = redisKey(key);
        String value = redis.opsForValue().get(rk);
        if (value == null) return Optional.empty();
        Long ttlMs = redis.getExpire(rk, TimeUnit.MILLISECONDS);
        Instant reset = (ttlMs != null && ttlMs > 0) ? Instant.ofEpochMilli(nowMs + ttlMs) : null;
        return Optional.of(new RateLimitStatus(key, Long.parseLong(value), reset, RateLimitBackend.REDIS));
    }

    public void reset(String key) {
        redis.delete(redisKey(key));
    }

    /** SCAN + batched DEL over the prefix; KEYS is never used. */
    public long clearAll(int batchSize) {
        ScanOptions options = ScanOptions.scanOptions().match(keyPrefix + "*").count(batchSize).build();
        long deleted = 0;
        List<String> batch = new ArrayList<>(batchSize);
        try (Cursor<String> cursor = redis.scan(options)) {
            while (cursor.hasNext()) {
                batch.add(cursor.next());
                if (batch.size() >= batchSize) {
                    deleted += delete(batch);
                    batch.clear();
                }
            }
        }
        return deleted + delete(batch);
    }

    public String ping() {
        return redis.execute((RedisCallback<String>) RedisConnection::ping);
    }

    private long delete(List<String> keys) {
        if (keys.isEmpty()) return 0;
        Long n = redis.delete(keys);
        return n == null ? 0 : n;
    }

    private String redisKey(String key) {
        return keyPrefix + key;
    }
}
