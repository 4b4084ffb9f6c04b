package io.jobs4j.core;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * Converts typed payloads to the plain values a queue stores (maps, lists, strings, numbers,
 * booleans) and back.
 */
public class PayloadCodec {

    private final ObjectMapper objectMapper;

    public PayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * @throws InvalidPayloadException if Jackson cannot serialize the payload
     */
    public Object toStored(Object payload) {
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.convertValue(payload, Object.class);
        } catch (IllegalArgumentException e) {
            throw new InvalidPayloadException("Payload of type " + payload.getClass().getName()
                    + " cannot be serialized: " + e.getMessage(), e);
        }
    }

    /**
     * Binds a stored value to {@code type}. The result never shares mutable state with
     * {@code stored}, including when {@code type} is {@code Object}.
     *
     * @throws InvalidPayloadException if the stored value does not fit {@code type}
     */
    public <T> T fromStored(Object stored, Class<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        if (stored == null) {
            return null;
        }
        try {
            return objectMapper.convertValue(stored, type);
        } catch (IllegalArgumentException e) {
            throw new InvalidPayloadException("Payload does not match " + type.getName() + ": " + e.getMessage(), e);
        }
    }
}
