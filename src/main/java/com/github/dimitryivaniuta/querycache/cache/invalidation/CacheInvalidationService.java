package com.github.dimitryivaniuta.querycache.cache.invalidation;

/**
 * The only entry point for invalidation. Every operation is idempotent:
 * invalidating something absent succeeds and changes nothing.
 */
public interface CacheInvalidationService {

    /** Accepts a logical key, or its hash when keys are displayed hashed. */
    void invalidateKey(String keyOrHash);

    void invalidatePrefix(String prefix);

    void invalidateAll();
}
