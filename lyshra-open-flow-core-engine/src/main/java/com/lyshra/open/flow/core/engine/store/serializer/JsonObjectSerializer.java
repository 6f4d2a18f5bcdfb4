package com.lyshra.open.flow.core.engine.store.serializer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lyshra.open.flow.integration.contract.store.IObjectSerializer;
import com.lyshra.open.flow.integration.exception.ObjectSerializationException;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding for plain data values: strings, booleans, {@code Integer}, {@code Double},
 * and lists or string-keyed maps of those. Restricted to types that decode back to an equal
 * value.
 */
public class JsonObjectSerializer implements IObjectSerializer {

    public static final String ID = "json";

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public boolean supports(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean || value instanceof Integer) {
            return true;
        }
        if (value instanceof Double d) {
            return !d.isNaN() && !d.isInfinite();
        }
        if (value instanceof List<?> list) {
            return list.stream().allMatch(this::supports);
        }
        if (value instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                    .allMatch(entry -> entry.getKey() instanceof String && supports(entry.getValue()));
        }
        return false;
    }

    @Override
    public byte[] serialize(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new ObjectSerializationException(typeOf(value), e.getMessage(), e);
        }
    }

    @Override
    public Object deserialize(byte[] bytes) {
        try {
            return objectMapper.readValue(bytes, Object.class);
        } catch (IOException e) {
            throw new ObjectSerializationException("json", e.getMessage(), e);
        }
    }

    private static String typeOf(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
