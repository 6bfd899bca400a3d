package com.github.dimitryivaniuta.relay.ratelimit;

/**
 * @param entryCount live local entries, or -1 under Redis where keys are not enumerated
 */
public record RateLimiterStatus(RateLimitBackend backend, boolean healthy, boolean redisConfigured, long entryCount) {}
