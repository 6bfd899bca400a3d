package com.github.dimitryivaniuta.relay.config;

import com.github.dimitryivaniuta.relay.metrics.RelayMetrics;
import com.github.dimitryivaniuta.relay.ratelimit.LocalRateLimitStore;
import com.github.dimitryivaniuta.relay.ratelimit.RateLimitProperties;
import com.github.dimitryivaniuta.relay.ratelimit.RateLimiterService;
import com.github.dimitryivaniuta.relay.ratelimit.RedisRateLimitStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Limiter wiring: the Redis store is only created when enabled and a template is available,
 * the memory store is always present as fallback.
 */
@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
public class RateLimitConfig {

    @Bean(initMethod = "start")
    public RateLimiterService rateLimiterService(RateLimitProperties properties,
                                                 ObjectProvider<StringRedisTemplate> redisTemplate,
                                                 RelayMetrics metrics,
                                                 Clock clock) {
        RedisRateLimitStore redisStore = null;
        if (properties.isRedisEnabled()) {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template != null) {
                redisStore = new RedisRateLimitStore(template, properties.getKeyPrefix());
            }
        }
        return new RateLimiterService(redisStore, new LocalRateLimitStore(), properties, metrics, clock);
    }
}
