package com.github.dimitryivaniuta.querycache.cache;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultCacheEntryOptionsFactoryTest {

    @Test
    void exactEndpointShouldWinCaseInsensitively() {
        var factory = new DefaultCacheEntryOptionsFactory(() -> CachingOptionsFixtures.withEndpoints(Map.of(
                "Employees", new CachingOptions.EndpointTtl(120, 30),
                "", new CachingOptions.EndpointTtl(90, null))));

        CacheEntryOptions opts = factory.create("employees");

        assertThat(opts.absoluteTtl()).isEqualTo(Duration.ofSeconds(120));
        assertThat(opts.slidingTtl()).isEqualTo(Duration.ofSeconds(30));
        assertThat(opts.initialTtl()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void unknownEndpointShouldFallBackToDefaultEntry() {
        var factory = new DefaultCacheEntryOptionsFactory(() -> CachingOptionsFixtures.withEndpoints(Map.of(
                "", new CachingOptions.EndpointTtl(90, null))));

        CacheEntryOptions opts = factory.create("Orders");

        assertThat(opts.absoluteTtl()).isEqualTo(Duration.ofSeconds(90));
        assertThat(opts.slidingTtl()).isNull();
    }

    @Test
    void missingOrNonPositiveAbsoluteShouldUseGlobalDefault() {
        var factory = new DefaultCacheEntryOptionsFactory(() -> CachingOptionsFixtures.withEndpoints(Map.of(
                "Employees", new CachingOptions.EndpointTtl(0, -5))));

        CacheEntryOptions opts = factory.create("Employees");

        assertThat(opts.absoluteTtl()).isEqualTo(Duration.ofSeconds(60));
        assertThat(opts.slidingTtl()).isNull();
        assertThat(factory.create(null).absoluteTtl()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void disabledCachingShouldYieldUnwritableOptions() {
        var factory = new DefaultCacheEntryOptionsFactory(CachingOptionsFixtures::disabled);

        assertThat(factory.create("Employees").writable()).isFalse();
    }

    @Test
    void slidingLongerThanAbsoluteShouldBeCappedForInitialTtl() {
        var opts = new CacheEntryOptions(Duration.ofSeconds(10), Duration.ofSeconds(30));

        assertThat(opts.initialTtl()).isEqualTo(Duration.ofSeconds(10));
        assertThat(new CacheEntryOptions(Duration.ofMillis(1500), null).absoluteTtlSeconds()).isEqualTo(2);
    }
}
