package com.github.dimitryivaniuta.querycache.cache.provider.distributed;

import com.github.dimitryivaniuta.querycache.cache.CacheEntryOptions;
import com.github.dimitryivaniuta.querycache.cache.CachingOptions;
import com.github.dimitryivaniuta.querycache.cache.CachingOptionsProvider;
import com.github.dimitryivaniuta.querycache.cache.key.CacheKeyFormatter;
import com.github.dimitryivaniuta.querycache.cache.key.CacheKeyHasher;
import com.github.dimitryivaniuta.querycache.cache.key.CacheKeyIndex;
import com.github.dimitryivaniuta.querycache.cache.provider.CacheStoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Hash index as plain Redis strings: {@code {keyPrefix}:__hash:{sha256} -> logical key}.
 */
@Slf4j
@RequiredArgsConstructor
public class DistributedCacheKeyIndex implements CacheKeyIndex {

    private final StringRedisTemplate redis;
    private final CacheKeyHasher hasher;
    private final CachingOptionsProvider optionsProvider;

    @Override
    public void track(String logicalKey, CacheEntryOptions entryOptions) {
        String hashed = hasher.hash(logicalKey);
        if (hashed.isBlank()) return;

        CachingOptions options = optionsProvider.current();
        String hashKey = CacheKeyFormatter.buildHashKey(options, hashed);
        try {
            redis.opsForValue().set(hashKey, logicalKey,
                    Duration.ofSeconds(CacheKeyIndex.indexTtlSeconds(options, entryOptions)));
        } catch (DataAccessException e) {
            log.warn("Unable to track key hash {}: {}", hashed, e.getMessage());
        }
    }

    @Override
    public Optional<String> tryResolve(String hash) {
        if (hash == null || hash.isBlank()) return Optional.empty();

        CachingOptions options = optionsProvider.current();
        try {
            return Optional.ofNullable(redis.opsForValue().get(CacheKeyFormatter.buildHashKey(options, hash)));
        } catch (DataAccessException e) {
            log.warn("Unable to resolve key hash {}: {}", hash, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void remove(String hash) {
        if (hash == null || hash.isBlank()) return;

        CachingOptions options = optionsProvider.current();
        try {
            redis.delete(CacheKeyFormatter.buildHashKey(options, hash));
        } catch (DataAccessException e) {
            throw new CacheStoreUnavailableException("removeHash", e);
        }
    }
}
