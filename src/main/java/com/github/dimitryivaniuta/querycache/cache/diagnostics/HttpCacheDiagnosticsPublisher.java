package com.github.dimitryivaniuta.querycache.cache.diagnostics;

import com.github.dimitryivaniuta.querycache.cache.CachingOptions;
import com.github.dimitryivaniuta.querycache.cache.CachingOptionsProvider;
import com.github.dimitryivaniuta.querycache.cache.CachingProperties;
import com.github.dimitryivaniuta.querycache.cache.key.CacheKeyHasher;
import com.github.dimitryivaniuta.querycache.cache.key.CacheKeyPrefixes;
import com.github.dimitryivaniuta.querycache.web.RequestContextKeys;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.Duration;
import java.util.Optional;

/**
 * Publishes cache status as response headers and Micrometer counters.
 *
 * <pre>
 *   X-Cache-Status: HIT|MISS        (name configurable)
 *   X-Cache-Key: raw key or SHA-256 (per key-display-mode)
 *   X-Cache-Duration-Ms: remaining TTL, hits only
 * </pre>
 *
 * Headers are written only when {@code caching.diagnostics.emit-cache-status-header} is on
 * and a servlet response is bound to the current thread. Metrics are tagged by key prefix,
 * never by the full key.
 */
@RequiredArgsConstructor
public class HttpCacheDiagnosticsPublisher implements CacheDiagnosticsPublisher {

    private final CachingOptionsProvider optionsProvider;
    private final CacheKeyHasher hasher;
    private final QueryCacheMetrics metrics;

    @Override
    public void reportHit(String logicalKey, Duration remainingTtl) {
        metrics.cacheHit(CacheKeyPrefixes.extractPrefix(logicalKey));
        writeStatus("HIT", logicalKey, remainingTtl);
    }

    @Override
    public void reportMiss(String logicalKey) {
        metrics.cacheMiss(CacheKeyPrefixes.extractPrefix(logicalKey));
        writeStatus("MISS", logicalKey, null);
    }

    private void writeStatus(String status, String logicalKey, Duration remainingTtl) {
        CachingOptions options = optionsProvider.current();
        if (!options.emitCacheStatusHeader()) return;

        HttpServletResponse response = currentResponse().orElse(null);
        if (response == null || response.isCommitted()) return;

        String headerName = (options.headerName() == null || options.headerName().isBlank())
                ? CachingProperties.Diagnostics.DEFAULT_HEADER_NAME
                : options.headerName();
        response.setHeader(headerName, status);

        String displayKey = displayKey(options, logicalKey);
        if (displayKey != null && !displayKey.isBlank()) {
            response.setHeader(RequestContextKeys.CACHE_KEY_HEADER, displayKey);
        }

        if (remainingTtl != null && !remainingTtl.isNegative() && !remainingTtl.isZero()) {
            response.setHeader(RequestContextKeys.CACHE_DURATION_HEADER, String.valueOf(remainingTtl.toMillis()));
        }
    }

    private String displayKey(CachingOptions options, String logicalKey) {
        return options.hashKeys() ? hasher.hash(logicalKey) : logicalKey;
    }

    private static Optional<HttpServletResponse> currentResponse() {
        if (!(RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes a)) return Optional.empty();
        return Optional.ofNullable(a.getResponse());
    }
}
