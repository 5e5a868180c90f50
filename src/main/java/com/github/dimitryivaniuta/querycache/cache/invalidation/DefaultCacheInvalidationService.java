package com.github.dimitryivaniuta.querycache.cache.invalidation;

import com.github.dimitryivaniuta.querycache.cache.CachingOptionsProvider;
import com.github.dimitryivaniuta.querycache.cache.diagnostics.QueryCacheMetrics;
import com.github.dimitryivaniuta.querycache.cache.key.CacheKeyIndex;
import com.github.dimitryivaniuta.querycache.cache.provider.CacheProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class DefaultCacheInvalidationService implements CacheInvalidationService {

    private final CacheProvider cacheProvider;
    private final CacheKeyIndex keyIndex;
    private final CachingOptionsProvider optionsProvider;
    private final QueryCacheMetrics metrics;

    @Override
    public void invalidateKey(String keyOrHash) {
        if (keyOrHash == null || keyOrHash.isBlank()) return;

        Optional<String> resolved = optionsProvider.current().hashKeys()
                ? keyIndex.tryResolve(keyOrHash)
                : Optional.empty();

        if (resolved.isPresent()) {
            cacheProvider.remove(resolved.get());
            keyIndex.remove(keyOrHash);
            log.info("Cache invalidated by key hash {}", keyOrHash);
        } else {
            cacheProvider.remove(keyOrHash);
            log.info("Cache invalidated by key {}", keyOrHash);
        }
        metrics.invalidation("key");
    }

    @Override
    public void invalidatePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) return;

        cacheProvider.removeByPrefix(prefix);
        metrics.invalidation("prefix");
        log.info("Cache invalidated by prefix {}", prefix);
    }

    @Override
    public void invalidateAll() {
        cacheProvider.removeByPrefix("");
        metrics.invalidation("all");
        log.info("Cache invalidated entirely");
    }
}
