package com.github.dimitryivaniuta.querycache.cache.key;

import com.github.dimitryivaniuta.querycache.cache.CachingOptions;

/**
 * Physical key layout. Everything sent to a store goes through here.
 *
 * <pre>
 *   entry          {keyPrefix}:{logicalKey}
 *   prefix index   {keyPrefix}:{prefix}:__index
 *   prefix catalog {keyPrefix}:__prefix_catalog
 *   hash index     {keyPrefix}:__hash:{sha256}
 * </pre>
 */
public final class CacheKeyFormatter {
    private CacheKeyFormatter() {}

    private static final String INDEX_SUFFIX = ":__index";
    private static final String CATALOG_SUFFIX = ":__prefix_catalog";
    private static final String HASH_SEGMENT = "__hash:";

    public static String buildCacheKey(CachingOptions options, String logicalKey) {
        return options.keyPrefix() + ":" + logicalKey;
    }

    public static String buildPrefixKey(CachingOptions options, String prefix) {
        return options.keyPrefix() + ":" + prefix;
    }

    public static String buildIndexKey(String prefixKey) {
        return prefixKey + INDEX_SUFFIX;
    }

    public static String buildCatalogKey(CachingOptions options) {
        return options.keyPrefix() + CATALOG_SUFFIX;
    }

    public static String buildHashKey(CachingOptions options, String hash) {
        return buildCacheKey(options, HASH_SEGMENT + hash);
    }
}
