package io.caliban4j.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;
import java.util.Objects;

/**
 * Converts history records to and from their dictionary form.
 *
 * <p>Instants are stored as epoch milliseconds so range queries compare numerically in
 * every backend.
 */
public class EntityCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public EntityCodec() {
        this(new ObjectMapper());
    }

    public EntityCodec(ObjectMapper objectMapper) {
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, true)
                .configure(SerializationFeature.WRITE_DATE_TIMESTAMPS_AS_NANOSECONDS, false)
                .configure(DeserializationFeature.READ_DATE_TIMESTAMPS_AS_NANOSECONDS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Map<String, Object> encode(Object entity) {
        Objects.requireNonNull(entity, "entity must not be null");
        return objectMapper.convertValue(entity, MAP_TYPE);
    }

    public <T> T decode(Map<String, Object> document, Class<T> type) {
        Objects.requireNonNull(document, "document must not be null");
        return objectMapper.convertValue(document, type);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }
}
