package com.github.dimitryivaniuta.metergateway.web;

public final class RequestContextKeys {
    private RequestContextKeys() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    public static final String PRINCIPAL_ATTRIBUTE = "com.github.dimitryivaniuta.metergateway.web.RequestContextKeys.principal";
    public static final String PRINCIPAL_MDC_KEY = "principalId";

    public static final String RATE_LIMIT_LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String RATE_LIMIT_REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String RATE_LIMIT_RESET_HEADER = "X-RateLimit-Reset";
}
