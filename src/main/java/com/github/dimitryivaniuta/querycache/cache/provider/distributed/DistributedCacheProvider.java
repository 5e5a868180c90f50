package com.github.dimitryivaniuta.querycache.cache.provider.distributed;

import com.github.dimitryivaniuta.querycache.cache.CacheEntryOptions;
import com.github.dimitryivaniuta.querycache.cache.CachingOptions;
import com.github.dimitryivaniuta.querycache.cache.CachingOptionsProvider;
import com.github.dimitryivaniuta.querycache.cache.bypass.CacheBypassContext;
import com.github.dimitryivaniuta.querycache.cache.diagnostics.QueryCacheMetrics;
import com.github.dimitryivaniuta.querycache.cache.key.CacheKeyFormatter;
import com.github.dimitryivaniuta.querycache.cache.key.CacheKeyIndex;
import com.github.dimitryivaniuta.querycache.cache.key.CacheKeyPrefixes;
import com.github.dimitryivaniuta.querycache.cache.provider.AbstractCacheProvider;
import com.github.dimitryivaniuta.querycache.cache.provider.CacheStoreUnavailableException;
import com.github.dimitryivaniuta.querycache.cache.provider.CachedValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.lang.reflect.Type;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Redis store. Layout per physical key:
 *
 * <pre>
 *   {key}                  hash {absexp: epoch ms, sldexp: sliding ms, data: payload}, TTL = min(absolute, sliding)
 *   {prefixKey}:__index    set of physical keys under the prefix
 *   {keyPrefix}:__prefix_catalog  set of prefix keys with a non-empty index
 * </pre>
 *
 * Index and catalog TTLs are only ever extended, to max(entry TTL, index TTL), so they
 * outlive every entry they track. Index maintenance is not transactional: concurrent writers
 * may leave stale members behind, which only cost a wasted delete later.
 *
 * <p>Reads and writes swallow store failures (logged, counted) and behave like a cold cache.
 * Removals raise {@link CacheStoreUnavailableException}.
 */
@Slf4j
public class DistributedCacheProvider extends AbstractCacheProvider {

    private static final String FIELD_ABSOLUTE = "absexp";
    private static final String FIELD_SLIDING = "sldexp";
    private static final String FIELD_DATA = "data";
    private static final int DELETE_BATCH = 500;

    private static final RedisScript<Long> WRITE_ENTRY = new DefaultRedisScript<>("""
            redis.call('DEL', KEYS[1])
            redis.call('HSET', KEYS[1], 'absexp', ARGV[1], 'sldexp', ARGV[2], 'data', ARGV[3])
            redis.call('PEXPIRE', KEYS[1], ARGV[4])
            return 1
            """, Long.class);

    private final StringRedisTemplate redis;
    private final CacheValueCodec codec;
    private final QueryCacheMetrics metrics;
    private final Clock clock;

    public DistributedCacheProvider(StringRedisTemplate redis,
                                    CacheValueCodec codec,
                                    CachingOptionsProvider optionsProvider,
                                    CacheBypassContext bypassContext,
                                    CacheKeyIndex keyIndex,
                                    QueryCacheMetrics metrics,
                                    Clock clock) {
        super(optionsProvider, bypassContext, keyIndex);
        this.redis = redis;
        this.codec = codec;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Optional<CachedValue<T>> lookup(String key, Type type) {
        CachingOptions options = optionsProvider.current();
        if (!isCacheEnabled(options)) {
            return Optional.empty();
        }

        String cacheKey = CacheKeyFormatter.buildCacheKey(options, key);
        try {
            HashOperations<String, String, String> hash = redis.opsForHash();
            Map<String, String> fields = hash.entries(cacheKey);
            String payload = fields.get(FIELD_DATA);
            if (payload == null) {
                return Optional.empty();
            }

            long now = clock.millis();
            long absoluteDeadline = parseLong(fields.get(FIELD_ABSOLUTE));
            long slidingMillis = parseLong(fields.get(FIELD_SLIDING));
            if (absoluteDeadline > 0 && absoluteDeadline <= now) {
                return Optional.empty();
            }

            Duration remaining = absoluteDeadline > 0 ? Duration.ofMillis(absoluteDeadline - now) : null;
            if (slidingMillis > 0) {
                Duration window = Duration.ofMillis(slidingMillis);
                remaining = (remaining == null || window.compareTo(remaining) < 0) ? window : remaining;
                redis.expire(cacheKey, remaining);
            }

            return Optional.of(new CachedValue<>((T) codec.deserialize(payload, type), remaining));
        } catch (CacheValueCodec.CacheCodecException e) {
            log.warn("Unreadable cache payload for key={}, treating as miss: {}", cacheKey, e.getMessage());
            return Optional.empty();
        } catch (DataAccessException e) {
            degraded("get", cacheKey, e);
            return Optional.empty();
        }
    }

    @Override
    public <T> void set(String key, T value, CacheEntryOptions entryOptions) {
        CachingOptions options = optionsProvider.current();
        if (!isWritable(options, value, entryOptions)) {
            return;
        }

        String cacheKey = CacheKeyFormatter.buildCacheKey(options, key);
        try {
            String payload = codec.serialize(value);
            long now = clock.millis();
            long slidingMillis = entryOptions.slidingTtl() != null ? entryOptions.slidingTtl().toMillis() : 0L;

            redis.execute(WRITE_ENTRY, List.of(cacheKey),
                    String.valueOf(now + entryOptions.absoluteTtl().toMillis()),
                    String.valueOf(slidingMillis),
                    payload,
                    String.valueOf(Math.max(1L, entryOptions.initialTtl().toMillis())));

            trackKey(options, key, cacheKey, entryOptions);
            trackHash(options, key, entryOptions);
        } catch (CacheValueCodec.CacheCodecException e) {
            log.warn("Value for key={} not cacheable: {}", cacheKey, e.getMessage());
        } catch (DataAccessException e) {
            degraded("set", cacheKey, e);
        }
    }

    @Override
    public void remove(String key) {
        CachingOptions options = optionsProvider.current();
        String cacheKey = CacheKeyFormatter.buildCacheKey(options, key);
        try {
            redis.delete(cacheKey);
            untrackKey(options, key, cacheKey);
        } catch (DataAccessException e) {
            metrics.storeFailure("remove");
            throw new CacheStoreUnavailableException("remove", e);
        }
    }

    @Override
    public void removeByPrefix(String prefix) {
        CachingOptions options = optionsProvider.current();
        try {
            if (prefix == null || prefix.isBlank()) {
                removeAllPrefixes(options);
                return;
            }
            removeByPrefixKey(options, CacheKeyFormatter.buildPrefixKey(options, prefix));
        } catch (DataAccessException e) {
            metrics.storeFailure("removeByPrefix");
            throw new CacheStoreUnavailableException("removeByPrefix", e);
        }
    }

    private void removeAllPrefixes(CachingOptions options) {
        String catalogKey = CacheKeyFormatter.buildCatalogKey(options);
        Set<String> prefixKeys = redis.opsForSet().members(catalogKey);
        if (prefixKeys != null) {
            for (String prefixKey : prefixKeys) {
                if (!removeByPrefixKey(options, prefixKey)) return;
            }
        }
        redis.delete(catalogKey);
    }

    private boolean removeByPrefixKey(CachingOptions options, String prefixKey) {
        SetOperations<String, String> sets = redis.opsForSet();
        String indexKey = CacheKeyFormatter.buildIndexKey(prefixKey);

        Set<String> tracked = sets.members(indexKey);
        if (tracked != null && !tracked.isEmpty()) {
            List<String> keys = new ArrayList<>(tracked);
            for (int from = 0; from < keys.size(); from += DELETE_BATCH) {
                if (interrupted()) {
                    log.info("Prefix sweep of {} interrupted; remaining keys stay indexed", prefixKey);
                    return false;
                }
                List<String> batch = keys.subList(from, Math.min(keys.size(), from + DELETE_BATCH));
                redis.delete(batch);
                sets.remove(indexKey, batch.toArray());
            }
        }

        // a set that empties is dropped by Redis itself; members added meanwhile keep it alive
        Long left = sets.size(indexKey);
        if (left == null || left == 0) {
            sets.remove(CacheKeyFormatter.buildCatalogKey(options), prefixKey);
        }
        return true;
    }

    private void trackKey(CachingOptions options, String logicalKey, String cacheKey, CacheEntryOptions entryOptions) {
        String prefix = CacheKeyPrefixes.extractPrefix(logicalKey);
        if (prefix.isBlank()) return;

        String prefixKey = CacheKeyFormatter.buildPrefixKey(options, prefix);
        String indexKey = CacheKeyFormatter.buildIndexKey(prefixKey);
        String catalogKey = CacheKeyFormatter.buildCatalogKey(options);
        Duration indexTtl = Duration.ofSeconds(
                Math.max(entryOptions.absoluteTtlSeconds(), options.effectiveIndexTtlSeconds()));

        SetOperations<String, String> sets = redis.opsForSet();
        sets.add(indexKey, cacheKey);
        extendTtl(indexKey, indexTtl);
        sets.add(catalogKey, prefixKey);
        extendTtl(catalogKey, indexTtl);
    }

    private void untrackKey(CachingOptions options, String logicalKey, String cacheKey) {
        String prefix = CacheKeyPrefixes.extractPrefix(logicalKey);
        if (prefix.isBlank()) return;

        String prefixKey = CacheKeyFormatter.buildPrefixKey(options, prefix);
        String indexKey = CacheKeyFormatter.buildIndexKey(prefixKey);
        SetOperations<String, String> sets = redis.opsForSet();

        Long removed = sets.remove(indexKey, cacheKey);
        if (removed == null || removed == 0) return;

        Long left = sets.size(indexKey);
        if (left == null || left == 0) {
            sets.remove(CacheKeyFormatter.buildCatalogKey(options), prefixKey);
        }
    }

    private void extendTtl(String key, Duration ttl) {
        Long current = redis.getExpire(key);
        if (current == null || current < 0 || current < ttl.getSeconds()) {
            redis.expire(key, ttl);
        }
    }

    private void degraded(String operation, String cacheKey, DataAccessException e) {
        metrics.storeFailure(operation);
        log.warn("Cache store unavailable during {} for key={}, continuing without cache: {}",
                operation, cacheKey, e.getMessage());
    }

    private static long parseLong(String v) {
        if (v == null || v.isBlank()) return 0L;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException ex) {
            return 0L;
        }
    }
}
