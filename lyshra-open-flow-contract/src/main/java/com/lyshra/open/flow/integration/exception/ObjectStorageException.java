package com.lyshra.open.flow.integration.exception;

import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStorageTier;
import com.lyshra.open.flow.integration.exception.codes.LyshraOpenFlowErrorCodes;
import lombok.Getter;

/**
 * The storage tier behind an object store operation is unreachable or failed.
 */
@Getter
public class ObjectStorageException extends LyshraOpenFlowRuntimeException {

    private final String key;
    private final String namespace;
    private final LyshraOpenFlowStorageTier tier;

    public ObjectStorageException(String key, String namespace, LyshraOpenFlowStorageTier tier, String reason) {
        super(LyshraOpenFlowErrorCodes.OBJECT_STORAGE_FAILED, key, namespace, tier, reason);
        this.key = key;
        this.namespace = namespace;
        this.tier = tier;
    }

    public ObjectStorageException(String key, String namespace, LyshraOpenFlowStorageTier tier, String reason,
                                  Throwable cause) {
        super(LyshraOpenFlowErrorCodes.OBJECT_STORAGE_FAILED, cause, key, namespace, tier, reason);
        this.key = key;
        this.namespace = namespace;
        this.tier = tier;
    }
}
