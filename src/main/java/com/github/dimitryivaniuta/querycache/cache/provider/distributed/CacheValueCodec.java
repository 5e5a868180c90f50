package com.github.dimitryivaniuta.querycache.cache.provider.distributed;

import java.lang.reflect.Type;

/**
 * Wire format of values in the remote store.
 * Implementations throw {@link CacheCodecException} for anything they cannot handle.
 */
public interface CacheValueCodec {

    String serialize(Object value);

    Object deserialize(String payload, Type type);

    class CacheCodecException extends RuntimeException {
        public CacheCodecException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
