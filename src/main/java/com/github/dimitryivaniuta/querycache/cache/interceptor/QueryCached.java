package com.github.dimitryivaniuta.querycache.cache.interceptor;

import java.lang.annotation.*;

/**
 * Caches the result of a read/query method through the configured cache store.
 *
 * <p>The cache key is {@code endpoint} followed by one {@code :name=value} segment per
 * non-null argument, so {@code endpoint} is also the prefix used to invalidate every
 * cached variant of the query at once.
 */
@Documented
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface QueryCached {

    /**
     * Logical endpoint name, e.g. "Employees" or "Employees:GetAll".
     * Also the lookup key for {@code caching.per-endpoint} TTL overrides.
     * Must not contain '='.
     */
    String endpoint();

    /**
     * Allows disabling caching on a method even if enabled on class.
     */
    boolean enabled() default true;
}
