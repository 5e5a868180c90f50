package com.github.dimitryivaniuta.querycache.cache.provider;

import lombok.Getter;

/**
 * Raised by invalidation paths when the backing store cannot be reached.
 */
@Getter
public class CacheStoreUnavailableException extends RuntimeException {

    private final String operation;

    public CacheStoreUnavailableException(String operation, Throwable cause) {
        super("Cache store unavailable during " + operation, cause);
        this.operation = operation;
    }
}
