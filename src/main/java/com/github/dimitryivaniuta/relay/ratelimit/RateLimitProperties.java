package com.github.dimitryivaniuta.relay.ratelimit;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "relay.rate-limit")
public class RateLimitProperties {

    /** Use Redis when a connection is available; otherwise counters stay in process memory. */
    private boolean redisEnabled = true;

    private String keyPrefix = "ratelimit:";

    // applied by @RateLimited when the annotation leaves limit/window unset
    private int defaultLimit = 1000;
    private Duration defaultWindow = Duration.ofHours(1);

    // startup PING attempts before falling back to memory
    private int connectAttempts = 3;

    // sweep of expired in-memory counters
    private Duration cleanupInterval = Duration.ofSeconds(60);

    // after a fallback, PING Redis this often and switch back on success; zero disables it
    private Duration reconnectInterval = Duration.ofSeconds(30);

    private int scanBatchSize = 500;

    public boolean isReconnectEnabled() {
        return reconnectInterval != null && !reconnectInterval.isZero() && !reconnectInterval.isNegative();
    }
}
