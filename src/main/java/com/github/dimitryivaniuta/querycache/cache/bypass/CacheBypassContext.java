package com.github.dimitryivaniuta.querycache.cache.bypass;

/**
 * Per-request switch that makes every cache operation behave as if caching were disabled.
 * Never shared between requests.
 */
public interface CacheBypassContext {

    boolean shouldBypass();

    String reason();

    void enable(String reason);

    void reset();
}
