package com.lyshra.open.flow.core.engine.graph;

import com.lyshra.open.flow.integration.contract.workflow.IWorkflowDefinition;
import com.lyshra.open.flow.integration.exception.WorkflowValidationException;

public interface ILyshraOpenFlowDagCompiler {

    /**
     * Validates {@code definition} and builds its execution graph. Pure: the same definition
     * always compiles to an equivalent graph.
     *
     * @throws WorkflowValidationException on constraint violations, duplicate stage names,
     *                                     dangling dependencies or dependency cycles
     */
    CompiledGraph compile(IWorkflowDefinition definition) throws WorkflowValidationException;
}
