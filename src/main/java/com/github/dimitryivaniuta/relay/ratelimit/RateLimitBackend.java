package com.github.dimitryivaniuta.relay.ratelimit;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RateLimitBackend {
    REDIS("redis"),
    MEMORY("memory");

    private final String tag;

    RateLimitBackend(String tag) { this.tag = tag; }

    @JsonValue
    public String tag() { return tag; }
}
