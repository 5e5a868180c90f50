package com.github.dimitryivaniuta.querycache.cache;

public interface CacheEntryOptionsFactory {

    /**
     * Resolves TTLs for a write made on behalf of {@code endpointName}.
     * Returns {@link CacheEntryOptions#disabled()} when caching is switched off.
     */
    CacheEntryOptions create(String endpointName);
}
