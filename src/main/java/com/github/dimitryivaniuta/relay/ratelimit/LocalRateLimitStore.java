package com.github.dimitryivaniuta.relay.ratelimit;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-process fixed-window counters. Correct within one JVM only.
 * An entry starts a new window once {@code now >= resetTime}; otherwise every check increments it.
 */
public class LocalRateLimitStore {

    private record Entry(long count, long resetTimeMs) {}

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();

    public RateLimitResult check(String key, int limit, long windowMs, long nowMs) {
        Entry e = entries.compute(key, (k, cur) ->
                (cur == null || cur.resetTimeMs() <= nowMs)
                        ? new Entry(1, nowMs + windowMs)
                        : new Entry(cur.count() + 1, cur.resetTimeMs()));

        long retryAfter = (long) Math.ceil((e.resetTimeMs() - nowMs) / 1000.0);
        return RateLimitResult.of(e.count(), limit, Instant.ofEpochMilli(e.resetTimeMs()), retryAfter);
    }

    public Optional<RateLimitStatus> status(String key, long nowMs) {
        Entry e = entries.get(key);
        if (e == null || e.resetTimeMs() <= nowMs) return Optional.empty();
        return Optional.of(new RateLimitStatus(key, e.count(), Instant.ofEpochMilli(e.resetTimeMs()), RateLimitBackend.MEMORY));
    }

    public void reset(String key) {
        entries.remove(key);
    }

    public void clear() {
        entries.clear();
    }

    /** Removes entries whose window has passed. */
    public int cleanupExpired(long nowMs) {
        int before = entries.size();
        entries.values().removeIf(e -> e.resetTimeMs() <= nowMs);
        return Math.max(0, before - entries.size());
    }

    public int size() {
        return entries.size();
    }
}
