package com.github.dimitryivaniuta.querycache.cache.provider;

import com.github.dimitryivaniuta.querycache.cache.CacheEntryOptions;
import com.github.dimitryivaniuta.querycache.cache.CachingOptions;
import com.github.dimitryivaniuta.querycache.cache.CachingOptionsProvider;
import com.github.dimitryivaniuta.querycache.cache.bypass.CacheBypassContext;
import com.github.dimitryivaniuta.querycache.cache.key.CacheKeyIndex;

import java.util.Objects;

/**
 * Switches shared by both stores: enablement, per-request bypass and hash-index tracking.
 */
public abstract class AbstractCacheProvider implements CacheProvider {

    protected final CachingOptionsProvider optionsProvider;
    protected final CacheBypassContext bypassContext;
    protected final CacheKeyIndex keyIndex;

    protected AbstractCacheProvider(CachingOptionsProvider optionsProvider,
                                    CacheBypassContext bypassContext,
                                    CacheKeyIndex keyIndex) {
        this.optionsProvider = Objects.requireNonNull(optionsProvider, "optionsProvider must not be null");
        this.bypassContext = Objects.requireNonNull(bypassContext, "bypassContext must not be null");
        this.keyIndex = Objects.requireNonNull(keyIndex, "keyIndex must not be null");
    }

    protected boolean isCacheEnabled(CachingOptions options) {
        return options.cacheActive() && !bypassContext.shouldBypass();
    }

    protected boolean isWritable(CachingOptions options, Object value, CacheEntryOptions entryOptions) {
        return value != null
                && entryOptions != null
                && entryOptions.writable()
                && isCacheEnabled(options);
    }

    protected void trackHash(CachingOptions options, String logicalKey, CacheEntryOptions entryOptions) {
        if (options.hashKeys()) {
            keyIndex.track(logicalKey, entryOptions);
        }
    }

    protected static boolean interrupted() {
        return Thread.currentThread().isInterrupted();
    }
}
