package com.github.dimitryivaniuta.relay.tenant;

import com.github.dimitryivaniuta.relay.webhook.WebhookDeliveryEngine;
import com.github.dimitryivaniuta.relay.webhook.WebhookEventType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tenant and API key administration. Key lifecycle changes are announced to the tenant's webhooks
 * as {@code api_key.*} events.
 */
@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/admin/tenants")
public class TenantAdminController {

    private final TenantRepository tenantRepo;
    private final TenantApiKeyRepository keyRepo;
    private final ApiKeyHashService hashService;
    private final TenantKeyLookupService keyLookup;
    private final WebhookDeliveryEngine webhooks;

    // ---------- DTOs ----------
    public record CreateTenantRequest(
            @NotBlank @Size(max = 255) String name,
            @NotBlank @Size(max = 64) String code
    ) {}

    public record TenantResponse(
            Long id,
            String name,
            String code,
            boolean enabled,
            Instant createdAt,
            Instant updatedAt
    ) {}

    public record CreateKeyRequest(
            @NotBlank @Size(max = 255) String keyName
    ) {}

    public record IssuedKeyResponse(
            Long keyId,
            Long tenantId,
            String keyName,
            String apiKey      // returned once
    ) {}

    public record KeyResponse(
            Long id,
            String keyName,
            boolean enabled,
            Instant createdAt,
            Instant updatedAt
    ) {}

    // ---------- tenants ----------

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Transactional
    public TenantResponse createTenant(@Valid @RequestBody CreateTenantRequest req) {
        tenantRepo.findByCode(req.code()).ifPresent(x -> {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Tenant code already exists");
        });

        Tenant saved = tenantRepo.save(Tenant.builder()
                .name(req.name())
                .code(req.code())
                .enabled(true)
                .build());
        return toTenantResponse(saved);
    }

    @GetMapping
    public List<TenantResponse> listTenants() {
        return tenantRepo.findAll().stream().map(this::toTenantResponse).toList();
    }

    @GetMapping("/{tenantId}")
    public TenantResponse getTenant(@PathVariable Long tenantId) {
        return toTenantResponse(requireTenant(tenantId));
    }

    // ---------- keys ----------

    @PostMapping("/{tenantId}/keys")
    @ResponseStatus(HttpStatus.CREATED)
    @Transactional
    public IssuedKeyResponse createKey(@PathVariable Long tenantId, @Valid @RequestBody CreateKeyRequest req) {
        Tenant tenant = requireTenant(tenantId);

        String raw = hashService.generateRawApiKey();
        TenantApiKey saved = keyRepo.save(TenantApiKey.builder()
                .tenant(tenant)
                .keyName(req.keyName())
                .apiKeyHash(hashService.hash(raw))
                .enabled(true)
                .build());

        webhooks.triggerEvent(WebhookEventType.API_KEY_CREATED, tenantId, keyEvent(saved, tenantId));
        return new IssuedKeyResponse(saved.getId(), tenantId, saved.getKeyName(), raw);
    }

    @GetMapping("/{tenantId}/keys")
    public List<KeyResponse> listKeys(@PathVariable Long tenantId) {
        requireTenant(tenantId);
        return keyRepo.findByTenantIdOrderByIdAsc(tenantId).stream().map(this::toKeyResponse).toList();
    }

    /** Issues a new raw key for the same record; the old key stops working at once. */
    @PostMapping("/keys/{keyId}/rotate")
    @Transactional
    public IssuedKeyResponse rotateKey(@PathVariable Long keyId) {
        TenantApiKey key = requireKey(keyId);
        String oldHash = key.getApiKeyHash();

        String raw = hashService.generateRawApiKey();
        key.setApiKeyHash(hashService.hash(raw));
        keyRepo.save(key);
        keyLookup.evict(oldHash);

        Long tenantId = key.getTenant().getId();
        webhooks.triggerEvent(WebhookEventType.API_KEY_ROTATED, tenantId, keyEvent(key, tenantId));
        return new IssuedKeyResponse(key.getId(), tenantId, key.getKeyName(), raw);
    }

    @PostMapping("/keys/{keyId}/revoke")
    @Transactional
    public KeyResponse revokeKey(@PathVariable Long keyId) {
        TenantApiKey key = requireKey(keyId);
        key.setEnabled(false);
        keyRepo.save(key);
        keyLookup.evict(key.getApiKeyHash());

        Long tenantId = key.getTenant().getId();
        webhooks.triggerEvent(WebhookEventType.API_KEY_REVOKED, tenantId, keyEvent(key, tenantId));
        return toKeyResponse(key);
    }

    @DeleteMapping("/keys/{keyId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Transactional
    public void deleteKey(@PathVariable Long keyId) {
        TenantApiKey key = requireKey(keyId);
        Long tenantId = key.getTenant().getId();
        Map<String, Object> event = keyEvent(key, tenantId);

        keyRepo.delete(key);
        keyLookup.evict(key.getApiKeyHash());
        webhooks.triggerEvent(WebhookEventType.API_KEY_DELETED, tenantId, event);
    }

    // ---------- helpers ----------

    private Tenant requireTenant(Long tenantId) {
        return tenantRepo.findById(tenantId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Tenant not found"));
    }

    private TenantApiKey requireKey(Long keyId) {
        return keyRepo.findById(keyId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "API key not found"));
    }

    private static Map<String, Object> keyEvent(TenantApiKey key, Long tenantId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("keyId", key.getId());
        data.put("keyName", key.getKeyName());
        data.put("tenantId", tenantId);
        return data;
    }

    private TenantResponse toTenantResponse(Tenant t) {
        return new TenantResponse(t.getId(), t.getName(), t.getCode(), t.isEnabled(), t.getCreatedAt(), t.getUpdatedAt());
    }

    private KeyResponse toKeyResponse(TenantApiKey k) {
        return new KeyResponse(k.getId(), k.getKeyName(), k.isEnabled(), k.getCreatedAt(), k.getUpdatedAt());
    }
}
