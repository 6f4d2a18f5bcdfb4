package com.lyshra.open.flow.integration.exception;

import com.lyshra.open.flow.integration.exception.codes.LyshraOpenFlowErrorCodes;
import lombok.Getter;

@Getter
public class WorkflowRunNotFoundException extends LyshraOpenFlowRuntimeException {

    private final String runUid;

    public WorkflowRunNotFoundException(String runUid) {
        super(LyshraOpenFlowErrorCodes.WORKFLOW_RUN_NOT_FOUND, runUid);
        this.runUid = runUid;
    }
}
