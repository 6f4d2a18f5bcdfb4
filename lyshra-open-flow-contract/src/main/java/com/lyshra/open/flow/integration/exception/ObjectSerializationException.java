package com.lyshra.open.flow.integration.exception;

import com.lyshra.open.flow.integration.exception.codes.LyshraOpenFlowErrorCodes;
import lombok.Getter;

@Getter
public class ObjectSerializationException extends LyshraOpenFlowRuntimeException {

    private final String valueType;

    public ObjectSerializationException(String valueType, String reason) {
        super(LyshraOpenFlowErrorCodes.OBJECT_SERIALIZATION_FAILED, valueType, reason);
        this.valueType = valueType;
    }

    public ObjectSerializationException(String valueType, String reason, Throwable cause) {
        super(LyshraOpenFlowErrorCodes.OBJECT_SERIALIZATION_FAILED, cause, valueType, reason);
        this.valueType = valueType;
    }
}
