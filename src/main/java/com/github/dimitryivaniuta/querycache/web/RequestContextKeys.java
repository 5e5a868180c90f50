package com.github.dimitryivaniuta.querycache.web;


public final class RequestContextKeys {
    private RequestContextKeys() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CORRELATION_ID_ATTRIBUTE = RequestContextKeys.class.getName() + ".correlationId";

    public static final String CACHE_KEY_HEADER = "X-Cache-Key";
    public static final String CACHE_DURATION_HEADER = "X-Cache-Duration-Ms";
}
