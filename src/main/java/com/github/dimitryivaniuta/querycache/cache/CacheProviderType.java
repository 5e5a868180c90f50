package com.github.dimitryivaniuta.querycache.cache;

/**
 * Backing store of the query cache. Chosen once at startup.
 */
public enum CacheProviderType {
    /** In-process Caffeine store. */
    MEMORY,
    /** Remote Redis store. */
    DISTRIBUTED
}
