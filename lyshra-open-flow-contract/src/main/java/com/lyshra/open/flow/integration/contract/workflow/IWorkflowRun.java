package com.lyshra.open.flow.integration.contract.workflow;

import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowRunSource;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowRunState;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * One execution instance of a workflow. State only moves forward:
 * {@code RUNNING -> COMPLETED | FAILED | CANCELLED}.
 */
public interface IWorkflowRun {

    String getUid();

    String getWorkflow();

    String getNamespace();

    Map<String, Object> getInput();

    LyshraOpenFlowRunState getState();

    Instant getStartedAt();

    Instant getFinishedAt();

    /**
     * The collector or terminal stage's value for a completed run, a failure description
     * for a failed run.
     */
    Object getResult();

    LyshraOpenFlowRunSource getSource();

    Optional<Throwable> getFailureCause();

    default boolean isTerminal() {
        return getState().isTerminal();
    }
}
