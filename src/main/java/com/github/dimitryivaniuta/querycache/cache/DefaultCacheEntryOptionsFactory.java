package com.github.dimitryivaniuta.querycache.cache;

import lombok.RequiredArgsConstructor;

import java.time.Duration;

/**
 * Per-endpoint TTL resolution: exact endpoint entry, then the "" entry, then the global default.
 */
@RequiredArgsConstructor
public class DefaultCacheEntryOptionsFactory implements CacheEntryOptionsFactory {

    private final CachingOptionsProvider optionsProvider;

    @Override
    public CacheEntryOptions create(String endpointName) {
        CachingOptions options = optionsProvider.current();
        if (!options.enabled()) {
            return CacheEntryOptions.disabled();
        }

        String lookupKey = (endpointName == null || endpointName.isBlank()) ? "" : endpointName;
        CachingOptions.EndpointTtl endpoint = options.endpoint(lookupKey)
                .or(() -> options.endpoint(""))
                .orElse(null);

        Integer configured = endpoint != null ? endpoint.absoluteTtlSeconds() : null;
        int absoluteSeconds = (configured != null && configured > 0)
                ? configured
                : options.effectiveDefaultTtlSeconds();

        Integer sliding = endpoint != null ? endpoint.slidingTtlSeconds() : null;
        Duration slidingTtl = (sliding != null && sliding > 0) ? Duration.ofSeconds(sliding) : null;

        return new CacheEntryOptions(Duration.ofSeconds(absoluteSeconds), slidingTtl);
    }
}
