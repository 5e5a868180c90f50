package com.github.dimitryivaniuta.querycache.cache.diagnostics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class QueryCacheMetrics {

    private final MeterRegistry registry;

    public QueryCacheMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Lookups ----
    public void cacheHit(String endpoint) {
        Counter.builder("query_cache_hits_total")
                .tag("endpoint", endpoint)
                .register(registry)
                .increment();
    }

    public void cacheMiss(String endpoint) {
        Counter.builder("query_cache_misses_total")
                .tag("endpoint", endpoint)
                .register(registry)
                .increment();
    }

    // ---- Invalidation ----
    public void invalidation(String scope) {
        Counter.builder("query_cache_invalidations_total")
                .tag("scope", scope) // key | prefix | all
                .register(registry)
                .increment();
    }

    // ---- Store health ----
    public void storeFailure(String operation) {
        Counter.builder("query_cache_store_failures_total")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    // ---- Duration ----
    public void recordCompute(String endpoint, long nanos) {
        Timer.builder("query_cache_compute_duration")
                .tag("endpoint", endpoint)
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }
}
