package com.lyshra.open.flow.integration.exception;

import com.lyshra.open.flow.integration.exception.codes.LyshraOpenFlowErrorCodes;
import lombok.Getter;

import java.util.List;
import java.util.Set;

/**
 * A workflow definition is malformed: duplicate stage names, dangling dependencies,
 * dependency cycles or constraint violations. Raised before any stage runs.
 */
@Getter
public class WorkflowValidationException extends LyshraOpenFlowRuntimeException {

    private final String workflowName;
    private final List<String> violations;
    private final Set<String> offendingStages;

    public WorkflowValidationException(String workflowName, List<String> violations, Set<String> offendingStages) {
        super(LyshraOpenFlowErrorCodes.WORKFLOW_VALIDATION_FAILED, workflowName, String.join("; ", violations));
        this.workflowName = workflowName;
        this.violations = List.copyOf(violations);
        this.offendingStages = Set.copyOf(offendingStages);
    }
}
