package com.github.dimitryivaniuta.relay.tenant;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.server.ResponseStatusException;

import static com.github.dimitryivaniuta.relay.web.RequestContextKeys.*;

/**
 * Resolves {@code X-Api-Key} to a tenant id and stores it as a request attribute; the tenant id is the owner
 * of every webhook the request touches. Missing or unknown keys are rejected with 401.
 */
@Component
@RequiredArgsConstructor
public class ApiKeyAuthInterceptor implements HandlerInterceptor {

    private final ApiKeyHashService hashService;
    private final TenantKeyLookupService lookup;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) return true;

        String raw = request.getHeader(API_KEY_HEADER);
        if (raw == null || raw.isBlank()) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "API key required");
        }

        Long tenantId = lookup.findTenantIdByHash(hashService.hash(raw.trim()))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid API key"));

        request.setAttribute(TENANT_ID_ATTRIBUTE, tenantId);
        MDC.put(TENANT_ID_MDC_KEY, tenantId.toString());
        return true;
    }
}
