package com.lyshra.open.flow.core.engine.store.serializer;

public record SerializedValue(String serializerId, String valueType, byte[] bytes) {
}
