package com.lyshra.open.flow.integration.exception;

import com.lyshra.open.flow.integration.exception.codes.LyshraOpenFlowErrorCodes;
import lombok.Getter;

import java.time.Duration;

@Getter
public class WorkflowTimeoutException extends LyshraOpenFlowRuntimeException {

    private final String runUid;
    private final Duration timeout;

    public WorkflowTimeoutException(String runUid, Duration timeout) {
        super(LyshraOpenFlowErrorCodes.WORKFLOW_TIMED_OUT, runUid, timeout);
        this.runUid = runUid;
        this.timeout = timeout;
    }
}
