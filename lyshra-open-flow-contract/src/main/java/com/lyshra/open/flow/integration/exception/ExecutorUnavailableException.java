package com.lyshra.open.flow.integration.exception;

import com.lyshra.open.flow.integration.exception.codes.LyshraOpenFlowErrorCodes;
import lombok.Getter;

/**
 * The executor backend could not be reached. Transient failures are eligible for
 * reconnection; anything else is reported as fatal.
 */
@Getter
public class ExecutorUnavailableException extends LyshraOpenFlowRuntimeException {

    private final String executorKind;
    private final boolean transientFailure;

    public ExecutorUnavailableException(String executorKind, String reason, boolean transientFailure) {
        super(LyshraOpenFlowErrorCodes.EXECUTOR_UNAVAILABLE, executorKind, reason);
        this.executorKind = executorKind;
        this.transientFailure = transientFailure;
    }

    public ExecutorUnavailableException(String executorKind, String reason, boolean transientFailure, Throwable cause) {
        super(LyshraOpenFlowErrorCodes.EXECUTOR_UNAVAILABLE, cause, executorKind, reason);
        this.executorKind = executorKind;
        this.transientFailure = transientFailure;
    }
}
