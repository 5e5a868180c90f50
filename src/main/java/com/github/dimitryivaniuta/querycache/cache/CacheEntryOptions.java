package com.github.dimitryivaniuta.querycache.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * TTLs of a single cache write. {@code slidingTtl} is null when no sliding expiry applies.
 */
public record CacheEntryOptions(Duration absoluteTtl, Duration slidingTtl) {

    private static final CacheEntryOptions DISABLED = new CacheEntryOptions(Duration.ZERO, null);

    public CacheEntryOptions {
        Objects.requireNonNull(absoluteTtl, "absoluteTtl must not be null");
        if (slidingTtl != null && (slidingTtl.isZero() || slidingTtl.isNegative())) {
            slidingTtl = null;
        }
    }

    public static CacheEntryOptions ofSeconds(long absoluteSeconds) {
        return new CacheEntryOptions(Duration.ofSeconds(absoluteSeconds), null);
    }

    /** Options meaning "do not write". */
    public static CacheEntryOptions disabled() {
        return DISABLED;
    }

    public boolean writable() {
        return !absoluteTtl.isZero() && !absoluteTtl.isNegative();
    }

    /** Absolute TTL rounded up to whole seconds. */
    public long absoluteTtlSeconds() {
        long seconds = absoluteTtl.getSeconds();
        return absoluteTtl.getNano() > 0 ? seconds + 1 : seconds;
    }

    /** Time the store should keep the entry after a write or a hit. */
    public Duration initialTtl() {
        if (slidingTtl == null) return absoluteTtl;
        return slidingTtl.compareTo(absoluteTtl) < 0 ? slidingTtl : absoluteTtl;
    }
}
