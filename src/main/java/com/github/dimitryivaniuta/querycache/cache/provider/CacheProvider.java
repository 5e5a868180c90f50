package com.github.dimitryivaniuta.querycache.cache.provider;

import com.github.dimitryivaniuta.querycache.cache.CacheEntryOptions;

import java.lang.reflect.Type;
import java.util.Optional;

/**
 * Get-or-compute cache store with prefix invalidation.
 *
 * <p>Keys are logical keys; implementations namespace them with the configured key prefix.
 * {@link #lookup} and {@link #set} never fail because of the store: a disabled, bypassed,
 * unreachable or corrupt cache reads as a miss and ignores writes.
 * {@link #remove} and {@link #removeByPrefix} are idempotent and may throw
 * {@link CacheStoreUnavailableException} so callers can retry.
 *
 * <p>Multi-key operations stop early when the calling thread is interrupted; what was
 * already deleted stays deleted and the index keeps the rest for the next attempt.
 */
public interface CacheProvider {

    <T> Optional<CachedValue<T>> lookup(String key, Type type);

    default <T> Optional<T> get(String key, Class<T> type) {
        return this.<T>lookup(key, type).map(CachedValue::value);
    }

    /** No-op when caching is off or {@code entryOptions} is not writable. Last writer wins. */
    <T> void set(String key, T value, CacheEntryOptions entryOptions);

    void remove(String key);

    /** Blank {@code prefix} removes every tracked prefix and clears the catalog. */
    void removeByPrefix(String prefix);
}
