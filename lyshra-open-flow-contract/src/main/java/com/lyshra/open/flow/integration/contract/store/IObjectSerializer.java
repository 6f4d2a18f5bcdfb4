package com.lyshra.open.flow.integration.contract.store;

import com.lyshra.open.flow.integration.exception.ObjectSerializationException;

public interface IObjectSerializer {

    String getId();

    boolean supports(Object value);

    byte[] serialize(Object value) throws ObjectSerializationException;

    Object deserialize(byte[] bytes) throws ObjectSerializationException;
}
