package com.github.dimitryivaniuta.querycache.cache.provider.memory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.dimitryivaniuta.querycache.cache.CacheEntryOptions;
import com.github.dimitryivaniuta.querycache.cache.CachingOptions;
import com.github.dimitryivaniuta.querycache.cache.CachingOptionsProvider;
import com.github.dimitryivaniuta.querycache.cache.key.CacheKeyFormatter;
import com.github.dimitryivaniuta.querycache.cache.key.CacheKeyHasher;
import com.github.dimitryivaniuta.querycache.cache.key.CacheKeyIndex;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Hash index held in its own Caffeine cache; each mapping expires on its own TTL.
 */
public class MemoryCacheKeyIndex implements CacheKeyIndex {

    private final Ticker ticker;
    private final Cache<String, MemoryCacheEntry> cache;
    private final CacheKeyHasher hasher;
    private final CachingOptionsProvider optionsProvider;

    public MemoryCacheKeyIndex(Supplier<Caffeine<Object, Object>> builderFactory,
                               Ticker ticker,
                               CacheKeyHasher hasher,
                               CachingOptionsProvider optionsProvider) {
        this.ticker = ticker;
        this.hasher = hasher;
        this.optionsProvider = optionsProvider;
        this.cache = builderFactory.get()
                .ticker(ticker)
                .expireAfter(new MemoryCacheEntry.EntryExpiry())
                .build();
    }

    @Override
    public void track(String logicalKey, CacheEntryOptions entryOptions) {
        String hashed = hasher.hash(logicalKey);
        if (hashed.isBlank()) return;

        CachingOptions options = optionsProvider.current();
        long ttlSeconds = CacheKeyIndex.indexTtlSeconds(options, entryOptions);
        cache.put(CacheKeyFormatter.buildHashKey(options, hashed),
                MemoryCacheEntry.of(logicalKey, CacheEntryOptions.ofSeconds(ttlSeconds), ticker.read()));
    }

    @Override
    public Optional<String> tryResolve(String hash) {
        if (hash == null || hash.isBlank()) return Optional.empty();

        CachingOptions options = optionsProvider.current();
        MemoryCacheEntry entry = cache.getIfPresent(CacheKeyFormatter.buildHashKey(options, hash));
        return entry == null ? Optional.empty() : Optional.of((String) entry.value());
    }

    @Override
    public void remove(String hash) {
        if (hash == null || hash.isBlank()) return;

        CachingOptions options = optionsProvider.current();
        cache.invalidate(CacheKeyFormatter.buildHashKey(options, hash));
    }
}
