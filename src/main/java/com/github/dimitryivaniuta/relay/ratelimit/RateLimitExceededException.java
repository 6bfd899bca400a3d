package com.github.dimitryivaniuta.relay.ratelimit;

import java.time.Instant;

public class RateLimitExceededException extends RuntimeException {

    private final long retryAfterSeconds;
    private final Instant resetTime;

    public RateLimitExceededException(String message, long retryAfterSeconds, Instant resetTime) {
        super(message);
        this.retryAfterSeconds = retryAfterSeconds;
        this.resetTime = resetTime;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    public Instant getResetTime() {
        return resetTime;
    }
}
