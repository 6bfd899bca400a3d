package com.github.dimitryivaniuta.relay.ratelimit;

import com.github.dimitryivaniuta.relay.web.RequestContextKeys;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

import java.security.Principal;

@Component
public final class RateLimitKeyResolver {

    public enum SubjectType {
        TENANT("tenant"),
        USER("user"),
        IP("ip"),
        UNKNOWN("unknown");

        private final String tag;
        SubjectType(String tag) { this.tag = tag; }
        public String tag() { return tag; }
    }

    /**
     * subjectKey is the caller part of a limiter key:
     * - tenant:<id>
     * - user:<username>
     * - ip:<address>
     */
    public record ResolvedSubject(SubjectType subjectType, String subjectKey, Long tenantId) {}

    public ResolvedSubject resolve(HttpServletRequest req) {
        // 1) tenant authenticated by API key
        if (req.getAttribute(RequestContextKeys.TENANT_ID_ATTRIBUTE) instanceof Long tenantId) {
            return new ResolvedSubject(SubjectType.TENANT, "tenant:" + tenantId, tenantId);
        }

        // 2) container principal, if any
        Principal p = req.getUserPrincipal();
        if (p != null && p.getName() != null && !p.getName().isBlank()) {
            return new ResolvedSubject(SubjectType.USER, "user:" + p.getName(), null);
        }

        // 3) IP fallback
        String ip = resolveClientIp(req);
        if (ip != null && !ip.isBlank()) {
            return new ResolvedSubject(SubjectType.IP, "ip:" + ip, null);
        }

        return new ResolvedSubject(SubjectType.UNKNOWN, "unknown", null);
    }

    private static String header(HttpServletRequest req, String name) {
        String v = req.getHeader(name);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String resolveClientIp(HttpServletRequest req) {
        // X-Forwarded-For may contain "client, proxy1, proxy2"
        String xff = header(req, "X-Forwarded-For");
        if (xff != null) {
            int comma = xff.indexOf(',');
            String first = (comma >= 0 ? xff.substring(0, comma) : xff).trim();
            if (!first.isBlank()) return first;
        }
        String realIp = header(req, "X-Real-IP");
        if (realIp != null) return realIp;

        String ra = req.getRemoteAddr();
        return (ra == null || ra.isBlank()) ? null : ra;
    }
}
