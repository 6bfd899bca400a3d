package com.github.dimitryivaniuta.relay.ratelimit;

import java.time.Instant;

/**
 * @param retryAfter seconds until the window resets; only set when {@code allowed} is false
 */
public record RateLimitResult(boolean allowed, long remaining, Instant resetTime, Long retryAfter) {

    static RateLimitResult of(long count, int limit, Instant resetTime, long retryAfterSeconds) {
        boolean allowed = count <= limit;
        return new RateLimitResult(
                allowed,
                Math.max(0, limit - count),
                resetTime,
                allowed ? null : Math.max(1, retryAfterSeconds)
        );
    }
}
