package com.lyshra.open.flow.integration.exception;

import com.lyshra.open.flow.integration.exception.codes.LyshraOpenFlowErrorCodes;
import lombok.Getter;

@Getter
public class WorkflowNotFoundException extends LyshraOpenFlowRuntimeException {

    private final String workflowName;

    public WorkflowNotFoundException(String workflowName) {
        super(LyshraOpenFlowErrorCodes.WORKFLOW_NOT_FOUND, workflowName);
        this.workflowName = workflowName;
    }
}
