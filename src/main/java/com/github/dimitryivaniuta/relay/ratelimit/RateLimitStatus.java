package com.github.dimitryivaniuta.relay.ratelimit;

import java.time.Instant;

/** Current counter for one key; {@code resetTime} is null when the key has no live window. */
public record RateLimitStatus(String key, long count, Instant resetTime, RateLimitBackend backend) {}
