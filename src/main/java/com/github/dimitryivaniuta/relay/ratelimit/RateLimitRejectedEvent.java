package com.github.dimitryivaniuta.relay.ratelimit;

import java.time.Instant;

/** Published when a tenant's request is throttled; turned into a {@code rate_limit.exceeded} webhook. */
public record RateLimitRejectedEvent(
        long tenantId,
        String route,
        int limit,
        long windowMs,
        long retryAfterSeconds,
        Instant resetTime
) {}
