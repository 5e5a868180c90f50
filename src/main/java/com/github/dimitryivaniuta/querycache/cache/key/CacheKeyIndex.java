package com.github.dimitryivaniuta.querycache.cache.key;

import com.github.dimitryivaniuta.querycache.cache.CacheEntryOptions;
import com.github.dimitryivaniuta.querycache.cache.CachingOptions;

import java.util.Optional;

/**
 * Reverse lookup from a key hash to the logical key it was computed from.
 *
 * <p>Mappings live at least as long as the entry they describe:
 * TTL = max(entry TTL, index TTL).
 */
public interface CacheKeyIndex {

    void track(String logicalKey, CacheEntryOptions entryOptions);

    Optional<String> tryResolve(String hash);

    void remove(String hash);

    static long indexTtlSeconds(CachingOptions options, CacheEntryOptions entryOptions) {
        long entrySeconds = entryOptions.absoluteTtlSeconds();
        if (entrySeconds <= 0) {
            entrySeconds = options.effectiveDefaultTtlSeconds();
        }
        return Math.max(entrySeconds, options.effectiveIndexTtlSeconds());
    }
}
