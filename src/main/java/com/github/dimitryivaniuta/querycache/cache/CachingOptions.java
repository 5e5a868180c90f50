package com.github.dimitryivaniuta.querycache.cache;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable snapshot of the caching configuration, taken once per cache operation.
 *
 * <p>Per-endpoint lookups are case-insensitive.
 */
public record CachingOptions(
        boolean enabled,
        boolean disableCache,
        int defaultCacheDurationSeconds,
        CacheProviderType provider,
        String keyPrefix,
        int indexKeyTtlSeconds,
        Map<String, EndpointTtl> perEndpoint,
        boolean emitCacheStatusHeader,
        String headerName,
        KeyDisplayMode keyDisplayMode
) {

    public static final int FALLBACK_TTL_SECONDS = 60;

    public CachingOptions {
        keyPrefix = keyPrefix == null ? "" : keyPrefix;
        provider = provider == null ? CacheProviderType.MEMORY : provider;
        keyDisplayMode = keyDisplayMode == null ? KeyDisplayMode.RAW : keyDisplayMode;

        Map<String, EndpointTtl> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (perEndpoint != null) copy.putAll(perEndpoint);
        perEndpoint = Collections.unmodifiableMap(copy);
    }

    public record EndpointTtl(Integer absoluteTtlSeconds, Integer slidingTtlSeconds) {}

    /** True when reads and writes should reach the store (ignores per-request bypass). */
    public boolean cacheActive() {
        return enabled && !disableCache;
    }

    public int effectiveDefaultTtlSeconds() {
        return defaultCacheDurationSeconds > 0 ? defaultCacheDurationSeconds : FALLBACK_TTL_SECONDS;
    }

    public int effectiveIndexTtlSeconds() {
        return indexKeyTtlSeconds > 0 ? indexKeyTtlSeconds : effectiveDefaultTtlSeconds();
    }

    public Optional<EndpointTtl> endpoint(String name) {
        return Optional.ofNullable(perEndpoint.get(name == null ? "" : name));
    }

    public boolean hashKeys() {
        return keyDisplayMode == KeyDisplayMode.HASH;
    }
}
