package com.lyshra.open.flow.core.engine.store.serializer;

import com.lyshra.open.flow.integration.contract.store.IObjectSerializer;
import com.lyshra.open.flow.integration.exception.ObjectSerializationException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;

/**
 * Java serialization for any {@link Serializable} value.
 */
public class JavaObjectSerializer implements IObjectSerializer {

    public static final String ID = "java";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public boolean supports(Object value) {
        return value instanceof Serializable;
    }

    @Override
    public byte[] serialize(Object value) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream oos = new ObjectOutputStream(bytes)) {
            oos.writeObject(value);
        } catch (IOException e) {
            throw new ObjectSerializationException(value.getClass().getName(), e.toString(), e);
        }
        return bytes.toByteArray();
    }

    @Override
    public Object deserialize(byte[] bytes) {
        try (ObjectInputStream ois = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
            return ois.readObject();
        } catch (IOException | ClassNotFoundException e) {
            throw new ObjectSerializationException("java", e.toString(), e);
        }
    }
}
