package com.lyshra.open.flow.integration.exception;

import com.lyshra.open.flow.integration.exception.codes.LyshraOpenFlowErrorCodes;
import lombok.Getter;

@Getter
public class ObjectNotFoundException extends LyshraOpenFlowRuntimeException {

    private final String key;
    private final String namespace;

    public ObjectNotFoundException(String key, String namespace) {
        super(LyshraOpenFlowErrorCodes.OBJECT_NOT_FOUND, key, namespace);
        this.key = key;
        this.namespace = namespace;
    }
}
