package com.github.dimitryivaniuta.relay.tenant;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface TenantApiKeyRepository extends JpaRepository<TenantApiKey, Long> {

    @Query("""
        select k.tenant.id
        from TenantApiKey k
        where k.apiKeyHash = :hash
          and k.enabled = true
          and k.tenant.enabled = true
        """)
    Optional<Long> findActiveTenantIdByHash(@Param("hash") String hash);

    List<TenantApiKey> findByTenantIdOrderByIdAsc(Long tenantId);
}
