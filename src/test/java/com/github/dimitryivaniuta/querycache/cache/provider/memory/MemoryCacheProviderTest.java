package com.github.dimitryivaniuta.querycache.cache.provider.memory;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.dimitryivaniuta.querycache.cache.CacheEntryOptions;
import com.github.dimitryivaniuta.querycache.cache.CachingOptions;
import com.github.dimitryivaniuta.querycache.cache.CachingOptionsFixtures;
import com.github.dimitryivaniuta.querycache.cache.bypass.StubBypassContext;
import com.github.dimitryivaniuta.querycache.cache.key.Sha256CacheKeyHasher;
import com.github.dimitryivaniuta.querycache.cache.provider.CachedValue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class MemoryCacheProviderTest {

    private final AtomicLong nanos = new AtomicLong(1_000_000_000L);
    private final Ticker ticker = nanos::get;
    private final AtomicReference<CachingOptions> options = new AtomicReference<>(CachingOptionsFixtures.enabled());
    private final StubBypassContext bypass = new StubBypassContext();

    private MemoryCacheKeyIndex keyIndex;
    private MemoryCacheProvider provider;

    @BeforeEach
    void setUp() {
        keyIndex = new MemoryCacheKeyIndex(this::builder, ticker, new Sha256CacheKeyHasher(), options::get);
        provider = new MemoryCacheProvider(this::builder, ticker, options::get, bypass, keyIndex);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private Caffeine<Object, Object> builder() {
        return Caffeine.newBuilder().executor(Runnable::run);
    }

    private void advance(Duration d) {
        nanos.addAndGet(d.toNanos());
    }

    @Test
    void shouldReturnStoredValueWithRemainingTtl() {
        provider.set("Employees:page=1", "page-1", CacheEntryOptions.ofSeconds(60));
        advance(Duration.ofSeconds(15));

        Optional<CachedValue<String>> hit = provider.lookup("Employees:page=1", String.class);

        assertThat(hit).isPresent();
        assertThat(hit.get().value()).isEqualTo("page-1");
        assertThat(hit.get().remainingTtl()).isEqualTo(Duration.ofSeconds(45));
        assertThat(provider.get("Employees:page=1", String.class)).contains("page-1");
    }

    @Test
    void shouldExpireAfterAbsoluteTtl() {
        provider.set("Employees:page=1", "page-1", CacheEntryOptions.ofSeconds(60));

        advance(Duration.ofSeconds(59));
        assertThat(provider.get("Employees:page=1", String.class)).isPresent();

        advance(Duration.ofSeconds(2));
        assertThat(provider.get("Employees:page=1", String.class)).isEmpty();
    }

    @Test
    void slidingTtlShouldBeRefreshedByHitsButCappedByAbsoluteTtl() {
        var opts = new CacheEntryOptions(Duration.ofSeconds(60), Duration.ofSeconds(10));
        provider.set("Employees:page=1", "page-1", opts);

        // touched every 8s the entry survives past its sliding window
        for (int i = 0; i < 7; i++) {
            advance(Duration.ofSeconds(8));
            assertThat(provider.get("Employees:page=1", String.class)).as("hit at %ss", (i + 1) * 8).isPresent();
        }

        // 56s elapsed; the absolute deadline ends it even though it was just read
        advance(Duration.ofSeconds(5));
        assertThat(provider.get("Employees:page=1", String.class)).isEmpty();
    }

    @Test
    void idleEntryShouldExpireAfterSlidingWindow() {
        provider.set("Employees:page=1", "page-1", new CacheEntryOptions(Duration.ofSeconds(60), Duration.ofSeconds(10)));

        advance(Duration.ofSeconds(11));

        assertThat(provider.get("Employees:page=1", String.class)).isEmpty();
    }

    @Test
    void removeShouldDropEntryAndIndexMembership() {
        provider.set("Employees:page=1", "page-1", CacheEntryOptions.ofSeconds(60));

        provider.remove("Employees:page=1");
        provider.remove("Employees:page=1"); // idempotent

        assertThat(provider.get("Employees:page=1", String.class)).isEmpty();
        assertThat(provider.trackedKeys("app:Employees")).isEmpty();
        assertThat(provider.catalog()).doesNotContain("app:Employees");
    }

    @Test
    void removeByPrefixShouldOnlyTouchThatPrefix() {
        provider.set("Employees:page=1", "e1", CacheEntryOptions.ofSeconds(60));
        provider.set("Employees:page=2", "e2", CacheEntryOptions.ofSeconds(60));
        provider.set("Orders:status=open", "o1", CacheEntryOptions.ofSeconds(60));

        assertThat(provider.trackedKeys("app:Employees"))
                .containsExactlyInAnyOrder("app:Employees:page=1", "app:Employees:page=2");

        provider.removeByPrefix("Employees");

        assertThat(provider.get("Employees:page=1", String.class)).isEmpty();
        assertThat(provider.get("Employees:page=2", String.class)).isEmpty();
        assertThat(provider.get("Orders:status=open", String.class)).contains("o1");
        assertThat(provider.catalog()).containsExactly("app:Orders");
    }

    @Test
    void blankPrefixShouldRemoveEverythingTracked() {
        provider.set("Employees:page=1", "e1", CacheEntryOptions.ofSeconds(60));
        provider.set("Orders:status=open", "o1", CacheEntryOptions.ofSeconds(60));
        provider.set("Dashboard", "d", CacheEntryOptions.ofSeconds(60));

        provider.removeByPrefix("");

        assertThat(provider.get("Employees:page=1", String.class)).isEmpty();
        assertThat(provider.get("Orders:status=open", String.class)).isEmpty();
        assertThat(provider.get("Dashboard", String.class)).isEmpty();
        assertThat(provider.catalog()).isEmpty();
    }

    @Test
    void unknownPrefixShouldBeNoOp() {
        provider.set("Employees:page=1", "e1", CacheEntryOptions.ofSeconds(60));

        provider.removeByPrefix("Nope");

        assertThat(provider.get("Employees:page=1", String.class)).contains("e1");
    }

    @Test
    void interruptedSweepShouldKeepRemainingKeysIndexed() {
        provider.set("Employees:page=1", "e1", CacheEntryOptions.ofSeconds(60));
        provider.set("Employees:page=2", "e2", CacheEntryOptions.ofSeconds(60));

        Thread.currentThread().interrupt();
        provider.removeByPrefix("Employees");
        assertThat(Thread.interrupted()).isTrue();

        assertThat(provider.trackedKeys("app:Employees")).hasSize(2);
        assertThat(provider.get("Employees:page=1", String.class)).contains("e1");

        provider.removeByPrefix("Employees");
        assertThat(provider.catalog()).isEmpty();
    }

    @Test
    void lateEvictionOfSupersededEntryShouldKeepNewerWriteIndexed() {
        provider.set("Employees:page=1", "old", CacheEntryOptions.ofSeconds(60));
        MemoryCacheEntry superseded = MemoryCacheEntry.of("old", CacheEntryOptions.ofSeconds(60), nanos.get());
        provider.set("Employees:page=1", "new", CacheEntryOptions.ofSeconds(60));

        // eviction notice for an earlier entry arrives after the rewrite
        provider.onRemoval("app:Employees:page=1", superseded, RemovalCause.EXPIRED);

        assertThat(provider.trackedKeys("app:Employees")).containsExactly("app:Employees:page=1");
        provider.removeByPrefix("Employees");
        assertThat(provider.get("Employees:page=1", String.class)).isEmpty();
        assertThat(provider.catalog()).isEmpty();
    }

    @Test
    void removeShouldUntrackEntryThatAlreadyExpired() {
        provider.set("Employees:page=1", "e1", CacheEntryOptions.ofSeconds(60));
        advance(Duration.ofSeconds(61));

        provider.remove("Employees:page=1");

        assertThat(provider.catalog()).doesNotContain("app:Employees");
    }

    @Test
    void disabledCacheShouldMissAndIgnoreWrites() {
        provider.set("Employees:page=1", "e1", CacheEntryOptions.ofSeconds(60));

        options.set(CachingOptionsFixtures.killSwitched());
        assertThat(provider.get("Employees:page=1", String.class)).isEmpty();
        provider.set("Employees:page=2", "e2", CacheEntryOptions.ofSeconds(60));

        options.set(CachingOptionsFixtures.enabled());
        assertThat(provider.get("Employees:page=1", String.class)).contains("e1");
        assertThat(provider.get("Employees:page=2", String.class)).isEmpty();
    }

    @Test
    void bypassShouldHideStoredValuesAndSkipWrites() {
        provider.set("Employees:page=1", "e1", CacheEntryOptions.ofSeconds(60));

        bypass.enable("debug");
        assertThat(provider.get("Employees:page=1", String.class)).isEmpty();
        provider.set("Employees:page=1", "fresh", CacheEntryOptions.ofSeconds(60));

        bypass.reset();
        assertThat(provider.get("Employees:page=1", String.class)).contains("e1");
    }

    @Test
    void nullValuesAndUnwritableOptionsShouldNotBeStored() {
        provider.set("Employees:page=1", null, CacheEntryOptions.ofSeconds(60));
        provider.set("Employees:page=2", "e2", CacheEntryOptions.disabled());

        assertThat(provider.get("Employees:page=1", String.class)).isEmpty();
        assertThat(provider.get("Employees:page=2", String.class)).isEmpty();
        assertThat(provider.catalog()).isEmpty();
    }

    @Test
    void typeMismatchShouldReadAsMiss() {
        provider.set("Employees:count", "42", CacheEntryOptions.ofSeconds(60));

        assertThat(provider.get("Employees:count", Integer.class)).isEmpty();
        assertThat(provider.get("Employees:count", CharSequence.class)).contains("42");
    }

    @Test
    void hashModeShouldRecordKeyHashes() {
        options.set(CachingOptionsFixtures.hashed());
        String hash = new Sha256CacheKeyHasher().hash("Employees:page=1");

        provider.set("Employees:page=1", "e1", CacheEntryOptions.ofSeconds(60));

        assertThat(keyIndex.tryResolve(hash)).contains("Employees:page=1");
    }

    @Test
    void concurrentWritersShouldLeaveExactlyOneValue() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                String value = "v" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    provider.set("Employees:page=1", value, CacheEntryOptions.ofSeconds(60));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(provider.get("Employees:page=1", String.class)).hasValueSatisfying(v -> assertThat(v).startsWith("v"));
        assertThat(provider.trackedKeys("app:Employees")).containsExactly("app:Employees:page=1");
    }
}
