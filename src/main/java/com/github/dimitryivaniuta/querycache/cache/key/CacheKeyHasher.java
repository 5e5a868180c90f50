package com.github.dimitryivaniuta.querycache.cache.key;

/**
 * One-way, deterministic digest of a logical key.
 */
public interface CacheKeyHasher {

    /** Returns "" for blank input. */
    String hash(String logicalKey);
}
