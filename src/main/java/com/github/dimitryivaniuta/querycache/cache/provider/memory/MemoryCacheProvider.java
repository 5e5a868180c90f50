package com.github.dimitryivaniuta.querycache.cache.provider.memory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.dimitryivaniuta.querycache.cache.CacheEntryOptions;
import com.github.dimitryivaniuta.querycache.cache.CachingOptions;
import com.github.dimitryivaniuta.querycache.cache.CachingOptionsProvider;
import com.github.dimitryivaniuta.querycache.cache.bypass.CacheBypassContext;
import com.github.dimitryivaniuta.querycache.cache.key.CacheKeyFormatter;
import com.github.dimitryivaniuta.querycache.cache.key.CacheKeyIndex;
import com.github.dimitryivaniuta.querycache.cache.key.CacheKeyPrefixes;
import com.github.dimitryivaniuta.querycache.cache.provider.AbstractCacheProvider;
import com.github.dimitryivaniuta.querycache.cache.provider.CachedValue;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Type;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * In-process store on a Caffeine cache with per-entry absolute + sliding expiry.
 *
 * <p>Prefix index: prefix key -> physical keys. The prefix catalog is the key set of that map.
 * Index updates go through {@link ConcurrentHashMap#compute} so an index is created, extended
 * and dropped atomically; an empty index never stays in the catalog.
 * Entries that Caffeine expires or evicts are dropped from the index by a removal listener,
 * but only while the index still tracks that very entry: a newer write to the same key wins.
 *
 * <p>IMPORTANT: pass a builder factory, not a builder. Caffeine builders are mutable.
 */
@Slf4j
public class MemoryCacheProvider extends AbstractCacheProvider {

    private final Ticker ticker;
    private final Cache<String, MemoryCacheEntry> cache;

    private final Map<String, Set<String>> prefixIndex = new ConcurrentHashMap<>();
    private final Map<String, Tracked> keyToPrefix = new ConcurrentHashMap<>();

    /** Prefix key a physical key is indexed under, and the entry that put it there. */
    private record Tracked(String prefixKey, MemoryCacheEntry entry) {
    }

    public MemoryCacheProvider(Supplier<Caffeine<Object, Object>> builderFactory,
                               Ticker ticker,
                               CachingOptionsProvider optionsProvider,
                               CacheBypassContext bypassContext,
                               CacheKeyIndex keyIndex) {
        super(optionsProvider, bypassContext, keyIndex);
        this.ticker = ticker;
        this.cache = builderFactory.get()
                .ticker(ticker)
                .expireAfter(new MemoryCacheEntry.EntryExpiry())
                .removalListener((String key, MemoryCacheEntry entry, RemovalCause cause) -> onRemoval(key, entry, cause))
                .build();
    }

    /** Weight, in kilobytes, of a value stored by this provider (for {@code maximumWeight}). */
    public static int estimateWeightKb(Object key, Object value) {
        int chars = key instanceof String s ? s.length() : 0;
        if (value instanceof MemoryCacheEntry e && e.value() instanceof CharSequence cs) {
            chars += cs.length();
        }
        return 1 + (chars * 2) / 1024;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Optional<CachedValue<T>> lookup(String key, Type type) {
        CachingOptions options = optionsProvider.current();
        if (!isCacheEnabled(options)) {
            return Optional.empty();
        }

        String cacheKey = CacheKeyFormatter.buildCacheKey(options, key);
        MemoryCacheEntry entry = cache.getIfPresent(cacheKey);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isInstanceOf(type)) {
            log.debug("Cached value for key={} is not a {}; treating as miss", cacheKey, type.getTypeName());
            return Optional.empty();
        }

        Duration remaining = cache.policy().expireVariably()
                .flatMap(p -> p.getExpiresAfter(cacheKey))
                .orElse(null);
        return Optional.of(new CachedValue<>((T) entry.value(), remaining));
    }

    @Override
    public <T> void set(String key, T value, CacheEntryOptions entryOptions) {
        CachingOptions options = optionsProvider.current();
        if (!isWritable(options, value, entryOptions)) {
            return;
        }

        String cacheKey = CacheKeyFormatter.buildCacheKey(options, key);
        MemoryCacheEntry entry = MemoryCacheEntry.of(value, entryOptions, ticker.read());
        cache.put(cacheKey, entry);
        trackKey(options, key, cacheKey, entry);
        trackHash(options, key, entryOptions);
    }

    @Override
    public void remove(String key) {
        CachingOptions options = optionsProvider.current();
        String cacheKey = CacheKeyFormatter.buildCacheKey(options, key);
        removeAndUntrack(cacheKey);
    }

    @Override
    public void removeByPrefix(String prefix) {
        CachingOptions options = optionsProvider.current();
        if (prefix == null || prefix.isBlank()) {
            for (String prefixKey : List.copyOf(prefixIndex.keySet())) {
                if (!removeByPrefixKey(prefixKey)) return;
            }
            return;
        }
        removeByPrefixKey(CacheKeyFormatter.buildPrefixKey(options, prefix));
    }

    /** Tracked prefix keys (the catalog). */
    Set<String> catalog() {
        return Set.copyOf(prefixIndex.keySet());
    }

    /** Physical keys tracked under a prefix key. */
    Set<String> trackedKeys(String prefixKey) {
        Set<String> keys = prefixIndex.get(prefixKey);
        return keys == null ? Set.of() : Set.copyOf(keys);
    }

    private boolean removeByPrefixKey(String prefixKey) {
        Set<String> keys = prefixIndex.get(prefixKey);
        if (keys == null) return true;

        for (String cacheKey : List.copyOf(keys)) {
            if (interrupted()) {
                log.info("Prefix sweep of {} interrupted; remaining keys stay indexed", prefixKey);
                return false;
            }
            removeAndUntrack(cacheKey);
        }

        // keys added by a concurrent set keep the index alive
        prefixIndex.computeIfPresent(prefixKey, (k, set) -> set.isEmpty() ? null : set);
        return true;
    }

    private void trackKey(CachingOptions options, String logicalKey, String cacheKey, MemoryCacheEntry entry) {
        String prefix = CacheKeyPrefixes.extractPrefix(logicalKey);
        if (prefix.isBlank()) return;

        String prefixKey = CacheKeyFormatter.buildPrefixKey(options, prefix);
        keyToPrefix.compute(cacheKey, (k, tracked) -> {
            prefixIndex.compute(prefixKey, (pk, set) -> {
                Set<String> keys = set != null ? set : ConcurrentHashMap.newKeySet();
                keys.add(cacheKey);
                return keys;
            });
            return new Tracked(prefixKey, entry);
        });
    }

    private void removeAndUntrack(String cacheKey) {
        // read first: an expired entry is gone from the map but may still be tracked
        Tracked before = keyToPrefix.get(cacheKey);
        MemoryCacheEntry removed = cache.asMap().remove(cacheKey);
        untrackKey(cacheKey, removed != null ? removed : before != null ? before.entry() : null);
    }

    /**
     * Drops {@code cacheKey} from its prefix index if the index still tracks {@code removed}.
     * Runs under the key's bin lock, the same one {@link #trackKey} takes, so a newer write is never untracked.
     */
    private void untrackKey(String cacheKey, MemoryCacheEntry removed) {
        if (removed == null) return;
        keyToPrefix.computeIfPresent(cacheKey, (k, tracked) -> {
            if (tracked.entry() != removed) return tracked;

            prefixIndex.computeIfPresent(tracked.prefixKey(), (pk, set) -> {
                set.remove(cacheKey);
                return set.isEmpty() ? null : set;
            });
            return null;
        });
    }

    void onRemoval(String cacheKey, MemoryCacheEntry entry, RemovalCause cause) {
        if (cacheKey == null || entry == null || !cause.wasEvicted()) return;
        untrackKey(cacheKey, entry);
    }
}
