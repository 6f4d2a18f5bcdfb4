package com.lyshra.open.flow.core.engine.store.serializer;

import com.lyshra.open.flow.integration.contract.store.IObjectSerializer;
import com.lyshra.open.flow.integration.exception.ObjectSerializationException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered list of serializers. A value is encoded by the first serializer that accepts it
 * and succeeds; the chosen serializer's id travels with the bytes.
 */
@Slf4j
public class ObjectSerializerRegistry {

    private final List<IObjectSerializer> serializers = new CopyOnWriteArrayList<>();

    public ObjectSerializerRegistry(List<IObjectSerializer> serializers) {
        this.serializers.addAll(serializers);
    }

    /** JSON first, Java serialization second. */
    public static ObjectSerializerRegistry defaultRegistry() {
        return new ObjectSerializerRegistry(List.of(new JsonObjectSerializer(), new JavaObjectSerializer()));
    }

    public void register(IObjectSerializer serializer) {
        serializers.removeIf(existing -> existing.getId().equals(serializer.getId()));
        serializers.add(0, serializer);
    }

    public SerializedValue serialize(Object value) {
        if (value == null) {
            throw new ObjectSerializationException("null", "null values cannot be stored");
        }
        String valueType = value.getClass().getName();
        ObjectSerializationException lastFailure = null;
        for (IObjectSerializer serializer : serializers) {
            if (!serializer.supports(value)) {
                continue;
            }
            try {
                return new SerializedValue(serializer.getId(), valueType, serializer.serialize(value));
            } catch (ObjectSerializationException e) {
                log.debug("Serializer [{}] rejected value of type [{}]: {}", serializer.getId(), valueType, e.getMessage());
                lastFailure = e;
            }
        }
        if (lastFailure != null) {
            throw new ObjectSerializationException(valueType, "every supporting serializer failed", lastFailure);
        }
        throw new ObjectSerializationException(valueType, "no registered serializer supports this type");
    }

    public Object deserialize(String serializerId, byte[] bytes) {
        return find(serializerId)
                .orElseThrow(() -> new ObjectSerializationException(serializerId, "unknown serializer id"))
                .deserialize(bytes);
    }

    public Optional<IObjectSerializer> find(String serializerId) {
        return serializers.stream()
                .filter(serializer -> serializer.getId().equals(serializerId))
                .findFirst();
    }
}
