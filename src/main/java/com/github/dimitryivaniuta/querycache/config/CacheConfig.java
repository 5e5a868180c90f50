package com.github.dimitryivaniuta.querycache.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.dimitryivaniuta.querycache.cache.CacheEntryOptionsFactory;
import com.github.dimitryivaniuta.querycache.cache.CacheProviderType;
import com.github.dimitryivaniuta.querycache.cache.CachingOptionsProvider;
import com.github.dimitryivaniuta.querycache.cache.CachingProperties;
import com.github.dimitryivaniuta.querycache.cache.DefaultCacheEntryOptionsFactory;
import com.github.dimitryivaniuta.querycache.cache.bypass.CacheBypassContext;
import com.github.dimitryivaniuta.querycache.cache.diagnostics.CacheDiagnosticsPublisher;
import com.github.dimitryivaniuta.querycache.cache.diagnostics.HttpCacheDiagnosticsPublisher;
import com.github.dimitryivaniuta.querycache.cache.diagnostics.QueryCacheMetrics;
import com.github.dimitryivaniuta.querycache.cache.interceptor.QueryCacheMethodInterceptor;
import com.github.dimitryivaniuta.querycache.cache.invalidation.CacheInvalidationService;
import com.github.dimitryivaniuta.querycache.cache.invalidation.DefaultCacheInvalidationService;
import com.github.dimitryivaniuta.querycache.cache.key.CacheKeyHasher;
import com.github.dimitryivaniuta.querycache.cache.key.CacheKeyIndex;
import com.github.dimitryivaniuta.querycache.cache.key.Sha256CacheKeyHasher;
import com.github.dimitryivaniuta.querycache.cache.provider.CacheProvider;
import com.github.dimitryivaniuta.querycache.cache.provider.distributed.DistributedCacheKeyIndex;
import com.github.dimitryivaniuta.querycache.cache.provider.distributed.DistributedCacheProvider;
import com.github.dimitryivaniuta.querycache.cache.provider.distributed.JacksonCacheValueCodec;
import com.github.dimitryivaniuta.querycache.cache.provider.memory.MemoryCacheKeyIndex;
import com.github.dimitryivaniuta.querycache.cache.provider.memory.MemoryCacheProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.net.URI;
import java.time.Clock;
import java.util.function.Supplier;

/**
 * Query cache wiring.
 *
 * <p>The store is chosen once, here, from {@code caching.provider}:
 * - MEMORY: Caffeine, optionally bounded by {@code provider-settings.memory.size-limit-mb}
 * - DISTRIBUTED: Redis through {@link StringRedisTemplate}; the connection comes from
 *   {@code provider-settings.distributed.connection-string} or Spring Boot's spring.data.redis.*
 *
 * Misconfiguration fails context startup, never a request.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(CachingProperties.class)
public class CacheConfig {

    private static final long HASH_INDEX_MAX_ENTRIES = 100_000;

    @Bean
    public CachingOptionsProvider cachingOptionsProvider(CachingProperties properties) {
        return properties::snapshot;
    }

    @Bean
    public CacheKeyHasher cacheKeyHasher() {
        return new Sha256CacheKeyHasher();
    }

    @Bean
    public CacheEntryOptionsFactory cacheEntryOptionsFactory(CachingOptionsProvider optionsProvider) {
        return new DefaultCacheEntryOptionsFactory(optionsProvider);
    }

    @Bean
    @ConditionalOnProperty(prefix = "caching.provider-settings.distributed", name = "connection-string")
    public LettuceConnectionFactory redisConnectionFactory(CachingProperties properties) {
        return new LettuceConnectionFactory(parseRedisUri(properties.getProviderSettings().getDistributed().getConnectionString()));
    }

    @Bean
    public CacheKeyIndex cacheKeyIndex(CachingProperties properties,
                                       CachingOptionsProvider optionsProvider,
                                       CacheKeyHasher hasher,
                                       ObjectProvider<StringRedisTemplate> redis) {
        if (properties.getProvider() == CacheProviderType.DISTRIBUTED) {
            return new DistributedCacheKeyIndex(requireRedis(redis), hasher, optionsProvider);
        }
        return new MemoryCacheKeyIndex(
                () -> Caffeine.newBuilder().maximumSize(HASH_INDEX_MAX_ENTRIES),
                Ticker.systemTicker(),
                hasher,
                optionsProvider);
    }

    @Bean
    public CacheProvider cacheProvider(CachingProperties properties,
                                       CachingOptionsProvider optionsProvider,
                                       CacheBypassContext bypassContext,
                                       CacheKeyIndex keyIndex,
                                       QueryCacheMetrics metrics,
                                       ObjectMapper objectMapper,
                                       ObjectProvider<StringRedisTemplate> redis) {
        warnOnShortIndexTtl(properties);

        if (properties.getProvider() == CacheProviderType.DISTRIBUTED) {
            log.info("Query cache backend: Redis (keyPrefix={})", properties.getKeyPrefix());
            return new DistributedCacheProvider(
                    requireRedis(redis),
                    new JacksonCacheValueCodec(objectMapper),
                    optionsProvider,
                    bypassContext,
                    keyIndex,
                    metrics,
                    Clock.systemUTC());
        }

        log.info("Query cache backend: in-process Caffeine (keyPrefix={})", properties.getKeyPrefix());
        return new MemoryCacheProvider(memoryBuilders(properties), Ticker.systemTicker(),
                optionsProvider, bypassContext, keyIndex);
    }

    @Bean
    public CacheInvalidationService cacheInvalidationService(CacheProvider cacheProvider,
                                                             CacheKeyIndex keyIndex,
                                                             CachingOptionsProvider optionsProvider,
                                                             QueryCacheMetrics metrics) {
        return new DefaultCacheInvalidationService(cacheProvider, keyIndex, optionsProvider, metrics);
    }

    @Bean
    public CacheDiagnosticsPublisher cacheDiagnosticsPublisher(CachingOptionsProvider optionsProvider,
                                                               CacheKeyHasher hasher,
                                                               QueryCacheMetrics metrics) {
        return new HttpCacheDiagnosticsPublisher(optionsProvider, hasher, metrics);
    }

    @Bean
    public QueryCacheMethodInterceptor queryCacheMethodInterceptor(CacheProvider cacheProvider,
                                                                   CacheEntryOptionsFactory entryOptionsFactory,
                                                                   CacheDiagnosticsPublisher diagnostics,
                                                                   QueryCacheMetrics metrics) {
        return new QueryCacheMethodInterceptor(cacheProvider, entryOptionsFactory, diagnostics, metrics);
    }

    private static Supplier<Caffeine<Object, Object>> memoryBuilders(CachingProperties properties) {
        Integer sizeLimitMb = properties.getProviderSettings().getMemory().getSizeLimitMb();
        return () -> {
            Caffeine<Object, Object> builder = Caffeine.newBuilder().recordStats();
            if (sizeLimitMb != null && sizeLimitMb > 0) {
                builder = builder
                        .maximumWeight(sizeLimitMb * 1024L) // weights are kilobytes
                        .weigher(MemoryCacheProvider::estimateWeightKb);
            }
            return builder;
        };
    }

    private static StringRedisTemplate requireRedis(ObjectProvider<StringRedisTemplate> redis) {
        StringRedisTemplate template = redis.getIfAvailable();
        if (template == null) {
            throw new IllegalStateException(
                    "caching.provider=DISTRIBUTED but no Redis connection is configured "
                            + "(set caching.provider-settings.distributed.connection-string or spring.data.redis.*)");
        }
        return template;
    }

    private static void warnOnShortIndexTtl(CachingProperties properties) {
        int indexTtl = properties.getProviderSettings().getDistributed().getIndexKeyTtlSeconds();
        int defaultTtl = properties.getDefaultCacheDurationSeconds();
        if (indexTtl > 0 && defaultTtl > 0 && indexTtl < defaultTtl) {
            log.warn("caching index-key-ttl-seconds ({}) is below default-cache-duration-seconds ({}); "
                    + "prefix indexes are kept alive for the longer of the two", indexTtl, defaultTtl);
        }
    }

    static RedisStandaloneConfiguration parseRedisUri(String connectionString) {
        URI uri = URI.create(connectionString.trim());
        if (uri.getHost() == null) {
            throw new IllegalStateException("Invalid Redis connection string: " + connectionString);
        }

        RedisStandaloneConfiguration config = new RedisStandaloneConfiguration(
                uri.getHost(), uri.getPort() > 0 ? uri.getPort() : 6379);

        String userInfo = uri.getUserInfo();
        if (userInfo != null && !userInfo.isBlank()) {
            int colon = userInfo.indexOf(':');
            if (colon >= 0) {
                if (colon > 0) config.setUsername(userInfo.substring(0, colon));
                config.setPassword(userInfo.substring(colon + 1));
            } else {
                config.setPassword(userInfo);
            }
        }

        String path = uri.getPath();
        if (path != null && path.length() > 1) {
            config.setDatabase(Integer.parseInt(path.substring(1)));
        }
        return config;
    }
}
