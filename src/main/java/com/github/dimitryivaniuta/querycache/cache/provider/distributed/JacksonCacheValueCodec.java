package com.github.dimitryivaniuta.querycache.cache.provider.distributed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;

import java.lang.reflect.Type;

/**
 * JSON payloads through the application {@link ObjectMapper}; generic types are honoured.
 */
@RequiredArgsConstructor
public class JacksonCacheValueCodec implements CacheValueCodec {

    private final ObjectMapper mapper;

    @Override
    public String serialize(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CacheCodecException("Unable to serialize " + value.getClass().getName(), e);
        }
    }

    @Override
    public Object deserialize(String payload, Type type) {
        try {
            return mapper.readValue(payload, mapper.constructType(type));
        } catch (JsonProcessingException e) {
            throw new CacheCodecException("Unable to deserialize cached payload as " + type.getTypeName(), e);
        }
    }
}
