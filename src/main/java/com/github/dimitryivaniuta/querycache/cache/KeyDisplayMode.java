package com.github.dimitryivaniuta.querycache.cache;

/**
 * How a cache key is exposed in diagnostics.
 */
public enum KeyDisplayMode {
    /** Logical key as-is. */
    RAW,
    /** SHA-256 of the logical key; filter values never leave the process. */
    HASH
}
