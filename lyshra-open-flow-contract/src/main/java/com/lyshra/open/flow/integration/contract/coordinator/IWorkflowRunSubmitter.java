package com.lyshra.open.flow.integration.contract.coordinator;

import com.lyshra.open.flow.integration.contract.workflow.IWorkflowRun;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowRunSource;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Submission entry point used by triggers. The emitted run is the snapshot taken at
 * submission; the run itself proceeds asynchronously.
 */
public interface IWorkflowRunSubmitter {

    Mono<IWorkflowRun> submit(String workflowName, Map<String, Object> input, String namespace,
                              LyshraOpenFlowRunSource source);
}
