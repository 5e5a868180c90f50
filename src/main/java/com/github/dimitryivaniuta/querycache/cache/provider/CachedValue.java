package com.github.dimitryivaniuta.querycache.cache.provider;

import java.time.Duration;

/**
 * A cache hit. {@code remainingTtl} is null when the store cannot tell.
 */
public record CachedValue<T>(T value, Duration remainingTtl) {}
