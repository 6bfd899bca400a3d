package com.github.dimitryivaniuta.relay.web;


public final class RequestContextKeys {
    private RequestContextKeys() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    public static final String API_KEY_HEADER = "X-Api-Key";

    /** Request attribute holding the authenticated tenant id (Long). */
    public static final String TENANT_ID_ATTRIBUTE = "relay.tenantId";
    public static final String TENANT_ID_MDC_KEY = "tenantId";

    public static final String RATE_LIMIT_LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String RATE_LIMIT_REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String RATE_LIMIT_RESET_HEADER = "X-RateLimit-Reset";
}
