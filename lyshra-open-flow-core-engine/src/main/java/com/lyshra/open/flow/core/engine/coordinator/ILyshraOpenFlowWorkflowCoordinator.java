package com.lyshra.open.flow.core.engine.coordinator;

import com.lyshra.open.flow.integration.contract.coordinator.IWorkflowRunSubmitter;
import com.lyshra.open.flow.integration.contract.executor.IStageExecutor;
import com.lyshra.open.flow.integration.contract.workflow.IWorkflowDefinition;
import com.lyshra.open.flow.integration.contract.workflow.IWorkflowRun;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowRunSource;
import com.lyshra.open.flow.integration.exception.TargetResolutionException;
import com.lyshra.open.flow.integration.exception.WorkflowNotFoundException;
import com.lyshra.open.flow.integration.exception.WorkflowRunNotFoundException;
import com.lyshra.open.flow.integration.exception.WorkflowValidationException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives workflow runs over their compiled graphs.
 *
 * <p>Submission compiles the definition and resolves every stage target before the run is
 * created, so a malformed workflow never starts. The run itself proceeds asynchronously.</p>
 */
public interface ILyshraOpenFlowWorkflowCoordinator extends IWorkflowRunSubmitter {

    /**
     * Starts a run on the default executor.
     *
     * @throws WorkflowValidationException when the graph does not compile
     * @throws TargetResolutionException when a stage target cannot be resolved
     */
    RunHandle submit(IWorkflowDefinition definition, Map<String, Object> input, String namespace);

    RunHandle submit(IWorkflowDefinition definition, Map<String, Object> input, String namespace,
                     IStageExecutor executor);

    RunHandle submit(IWorkflowDefinition definition, Map<String, Object> input, String namespace,
                     IStageExecutor executor, LyshraOpenFlowRunSource source);

    /**
     * Fetches the definition from the definition store and starts a run on the default executor.
     * Errors with {@link WorkflowNotFoundException} when no such workflow is stored.
     */
    Mono<RunHandle> submitByName(String workflowName, Map<String, Object> input, String namespace,
                                 LyshraOpenFlowRunSource source);

    /**
     * @throws WorkflowRunNotFoundException when the run is unknown or was purged
     */
    IWorkflowRun getRun(String runUid);

    Optional<RunHandle> findHandle(String runUid);

    /** Most recent first; a {@code null} workflow name lists every workflow. */
    List<IWorkflowRun> listRuns(String workflowName, int limit);

    /**
     * Flips the run to cancelled and halts further scheduling. Invocations already handed to
     * the executor keep running; their results are discarded.
     *
     * @return {@code false} when the run had already finished
     * @throws WorkflowRunNotFoundException when the run is unknown
     */
    boolean cancel(String runUid);

    /** Forgets finished runs older than the configured retention. Returns how many were dropped. */
    int purgeFinishedRuns();
}
