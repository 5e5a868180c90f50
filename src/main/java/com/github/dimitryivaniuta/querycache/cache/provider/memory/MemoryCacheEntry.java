package com.github.dimitryivaniuta.querycache.cache.provider.memory;

import com.github.benmanes.caffeine.cache.Expiry;
import com.github.dimitryivaniuta.querycache.cache.CacheEntryOptions;
import org.springframework.core.ResolvableType;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Type;

/**
 * Value held by the in-process store, with the timing needed for absolute + sliding expiry.
 * All times are ticker nanos.
 */
record MemoryCacheEntry(Object value, long absoluteDeadline, long slidingNanos) {

    static MemoryCacheEntry of(Object value, CacheEntryOptions options, long now) {
        long sliding = options.slidingTtl() != null ? options.slidingTtl().toNanos() : 0L;
        return new MemoryCacheEntry(value, now + options.absoluteTtl().toNanos(), sliding);
    }

    boolean isInstanceOf(Type type) {
        Class<?> raw = ResolvableType.forType(type).resolve(Object.class);
        return ClassUtils.resolvePrimitiveIfNecessary(raw).isInstance(value);
    }

    /** Nanos the entry may live from {@code now}: sliding window capped by the absolute deadline. */
    long ttlFrom(long now) {
        long untilDeadline = Math.max(0L, absoluteDeadline - now);
        return slidingNanos > 0 ? Math.min(slidingNanos, untilDeadline) : untilDeadline;
    }

    static final class EntryExpiry implements Expiry<String, MemoryCacheEntry> {

        @Override
        public long expireAfterCreate(String key, MemoryCacheEntry entry, long currentTime) {
            return entry.ttlFrom(currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, MemoryCacheEntry entry, long currentTime, long currentDuration) {
            // a new write fully replaces the old entry, timing included
            return entry.ttlFrom(currentTime);
        }

        @Override
        public long expireAfterRead(String key, MemoryCacheEntry entry, long currentTime, long currentDuration) {
            return entry.slidingNanos() > 0 ? entry.ttlFrom(currentTime) : currentDuration;
        }
    }
}
