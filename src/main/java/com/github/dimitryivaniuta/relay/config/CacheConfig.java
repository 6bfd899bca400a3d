package com.github.dimitryivaniuta.relay.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.dimitryivaniuta.relay.tenant.TenantKeyLookupService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Local Caffeine caches. Only the API key lookup is cached; hits and misses share the TTL.
 */
@Configuration
public class CacheConfig {

    @Bean
    public CacheManager cacheManager(@Value("${relay.api-key.lookup-cache-ttl:60s}") Duration lookupTtl) {
        CaffeineCacheManager manager = new CaffeineCacheManager(TenantKeyLookupService.CACHE);
        manager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(50_000)
                .expireAfterWrite(lookupTtl)
                .recordStats());
        manager.setAllowNullValues(false);
        return manager;
    }
}
