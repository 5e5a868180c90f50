package com.github.dimitryivaniuta.querycache.cache;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bound form of the {@code caching.*} settings.
 *
 * <p>Cache operations never read this bean directly: they ask {@link CachingOptionsProvider}
 * for an immutable {@link CachingOptions} snapshot built by {@link #snapshot()}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "caching")
public class CachingProperties {

    private boolean enabled = false;

    /** Hard kill switch, wins over {@link #enabled}. */
    private boolean disableCache = false;

    private int defaultCacheDurationSeconds = 60;
    private CacheProviderType provider = CacheProviderType.MEMORY;
    private String keyPrefix = "app";

    private ProviderSettings providerSettings = new ProviderSettings();

    // keys are endpoint names, "" is the default entry; use bracket notation for names with ':'
    private Map<String, EndpointCacheOptions> perEndpoint = new LinkedHashMap<>();

    private Diagnostics diagnostics = new Diagnostics();
    private Bypass bypass = new Bypass();

    public CachingOptions snapshot() {
        Map<String, CachingOptions.EndpointTtl> endpoints = new LinkedHashMap<>();
        if (perEndpoint != null) {
            perEndpoint.forEach((name, ttl) -> {
                if (ttl != null) {
                    endpoints.put(name == null ? "" : name,
                            new CachingOptions.EndpointTtl(ttl.getAbsoluteTtlSeconds(), ttl.getSlidingTtlSeconds()));
                }
            });
        }

        Diagnostics d = diagnostics != null ? diagnostics : new Diagnostics();
        ProviderSettings ps = providerSettings != null ? providerSettings : new ProviderSettings();

        return new CachingOptions(
                enabled,
                disableCache,
                defaultCacheDurationSeconds,
                provider,
                keyPrefix,
                ps.getDistributed().getIndexKeyTtlSeconds(),
                endpoints,
                d.isEmitCacheStatusHeader(),
                d.getHeaderName(),
                d.getKeyDisplayMode()
        );
    }

    @Getter
    @Setter
    public static class ProviderSettings {
        private Memory memory = new Memory();
        private Distributed distributed = new Distributed();
    }

    @Getter
    @Setter
    public static class Memory {
        private Integer sizeLimitMb;
    }

    @Getter
    @Setter
    public static class Distributed {
        /** redis://[:password@]host:port[/database]; falls back to spring.data.redis.* when blank. */
        private String connectionString;
        private int indexKeyTtlSeconds = 600;
    }

    @Getter
    @Setter
    public static class EndpointCacheOptions {
        private Integer absoluteTtlSeconds;
        private Integer slidingTtlSeconds;
    }

    @Getter
    @Setter
    public static class Diagnostics {
        public static final String DEFAULT_HEADER_NAME = "X-Cache-Status";

        private boolean emitCacheStatusHeader = false;
        private String headerName = DEFAULT_HEADER_NAME;
        private KeyDisplayMode keyDisplayMode = KeyDisplayMode.RAW;
    }

    @Getter
    @Setter
    public static class Bypass {
        private boolean enabled = false;
        private String headerName = "X-Cache-Bypass";

        /** Value the bypass header must carry; bypass is refused while this is blank. */
        private String token;
    }
}
