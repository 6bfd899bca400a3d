package com.github.dimitryivaniuta.relay.tenant;

import lombok.RequiredArgsConstructor;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Resolves an API key hash to its tenant. Hits and misses are cached briefly; revocations evict explicitly.
 */
@Service
@RequiredArgsConstructor
public class TenantKeyLookupService {

    public static final String CACHE = "tenantKeyLookup";

    private final TenantApiKeyRepository repo;
    private final CacheManager cacheManager;

    @SuppressWarnings("unchecked")
    public Optional<Long> findTenantIdByHash(String apiKeyHash) {
        Cache cache = cacheManager.getCache(CACHE);
        if (cache != null) {
            Optional<Long> cached = cache.get(apiKeyHash, Optional.class);
            if (cached != null) return cached;
        }

        Optional<Long> loaded = repo.findActiveTenantIdByHash(apiKeyHash);

        if (cache != null) cache.put(apiKeyHash, loaded);
        return loaded;
    }

    public void evict(String apiKeyHash) {
        Cache cache = cacheManager.getCache(CACHE);
        if (cache != null) cache.evict(apiKeyHash);
    }
}
