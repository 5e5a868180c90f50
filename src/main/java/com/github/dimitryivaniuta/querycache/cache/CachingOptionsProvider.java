package com.github.dimitryivaniuta.querycache.cache;

/**
 * Source of the current configuration snapshot.
 * Call once per operation and keep the returned value for the rest of it.
 */
@FunctionalInterface
public interface CachingOptionsProvider {

    CachingOptions current();
}
