package com.github.dimitryivaniuta.querycache.cache.provider.distributed;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.querycache.cache.CacheEntryOptions;
import com.github.dimitryivaniuta.querycache.cache.CachingOptionsFixtures;
import com.github.dimitryivaniuta.querycache.cache.bypass.StubBypassContext;
import com.github.dimitryivaniuta.querycache.cache.diagnostics.QueryCacheMetrics;
import com.github.dimitryivaniuta.querycache.cache.key.Sha256CacheKeyHasher;
import com.github.dimitryivaniuta.querycache.cache.provider.CacheStoreUnavailableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

/**
 * Every Redis call fails: reads and writes degrade to a cold cache, removals surface the outage.
 */
class DistributedCacheProviderFailureTest {

    private final StringRedisTemplate redis = mock(StringRedisTemplate.class, invocation -> {
        throw new RedisConnectionFailureException("Connection refused");
    });
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    private final DistributedCacheKeyIndex keyIndex =
            new DistributedCacheKeyIndex(redis, new Sha256CacheKeyHasher(), CachingOptionsFixtures::hashed);
    private final DistributedCacheProvider provider = new DistributedCacheProvider(redis,
            new JacksonCacheValueCodec(new ObjectMapper()),
            CachingOptionsFixtures::enabled, new StubBypassContext(), keyIndex,
            new QueryCacheMetrics(registry), Clock.systemUTC());

    @Test
    void lookupShouldDegradeToMiss() {
        assertThat(provider.get("Employees:page=1", String.class)).isEmpty();
        assertThat(registry.counter("query_cache_store_failures_total", "operation", "get").count()).isEqualTo(1.0);
    }

    @Test
    void setShouldDegradeToNoOp() {
        assertThatCode(() -> provider.set("Employees:page=1", "e1", CacheEntryOptions.ofSeconds(60)))
                .doesNotThrowAnyException();
        assertThat(registry.counter("query_cache_store_failures_total", "operation", "set").count()).isEqualTo(1.0);
    }

    @Test
    void removalsShouldReportStoreUnavailable() {
        assertThatThrownBy(() -> provider.remove("Employees:page=1"))
                .isInstanceOf(CacheStoreUnavailableException.class)
                .extracting("operation").isEqualTo("remove");
        assertThatThrownBy(() -> provider.removeByPrefix("Employees"))
                .isInstanceOf(CacheStoreUnavailableException.class);
        assertThatThrownBy(() -> provider.removeByPrefix(""))
                .isInstanceOf(CacheStoreUnavailableException.class);
    }

    @Test
    void hashIndexShouldDegradeOnReadsAndFailOnRemove() {
        assertThatCode(() -> keyIndex.track("Employees:page=1", CacheEntryOptions.ofSeconds(60)))
                .doesNotThrowAnyException();
        assertThat(keyIndex.tryResolve("abc")).isEmpty();
        assertThatThrownBy(() -> keyIndex.remove("abc")).isInstanceOf(CacheStoreUnavailableException.class);
    }
}
