package com.shopstream.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopstream.serde.ObjectMapperFactory;
import com.shopstream.state.FactEvent;

import java.io.IOException;

/**
 * Generic JSON record decoder backed by Jackson.
 * Converts raw record bytes into a typed Java object.
 *
 * <p>Facts carry their own event time; any other record (dimension updates) is stamped
 * with the transport timestamp.</p>
 *
 * @param <T> target type
 */
public class JsonRecordDecoder<T> implements RecordDecoder<T> {

    private final Class<T> targetClass;
    private final ObjectMapper objectMapper;

    public JsonRecordDecoder(Class<T> targetClass) {
        this(targetClass, ObjectMapperFactory.create());
    }

    public JsonRecordDecoder(Class<T> targetClass, ObjectMapper objectMapper) {
        this.targetClass = targetClass;
        this.objectMapper = objectMapper;
    }

    @Override
    public T decode(byte[] payload) throws IOException {
        if (payload == null) {
            throw new IOException("Empty payload for " + targetClass.getSimpleName());
        }
        T value = objectMapper.readValue(payload, targetClass);
        if (value == null) {
            throw new IOException("JSON null payload for " + targetClass.getSimpleName());
        }
        return value;
    }

    @Override
    public long extractEventTime(T value, long transportTimestamp) {
        if (value instanceof FactEvent) {
            return ((FactEvent) value).getEventTime();
        }
        return transportTimestamp;
    }

    public Class<T> getTargetClass() {
        return targetClass;
    }
}
