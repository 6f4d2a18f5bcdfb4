package com.lyshra.open.flow.integration.contract.workflow;

import com.lyshra.open.flow.integration.contract.store.IObjectStore;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the run a stage invocation belongs to. Instances are immutable;
 * every stage invocation and every fan-out element receives its own view.
 */
public interface IRunContext {

    Map<String, Object> getInput();

    String getNamespace();

    String getExecutorKind();

    IWorkflowDefinition getDefinition();

    /** Snapshot of the run taken when this view was created. */
    IWorkflowRun getRun();

    /** Merged config documents selected for the workflow. */
    Map<String, Object> getConfig();

    /** Stage being invoked, {@code null} for the run-level context. */
    String getStageName();

    /** Position of the fan-out element, empty outside parameterized stages. */
    Optional<Integer> getElementIndex();

    IObjectStore getObjectStore();

    IRunContext forStage(String stageName, IWorkflowRun runSnapshot);

    IRunContext forElement(int elementIndex);

    default Mono<Void> putObject(String key, Object value) {
        return getObjectStore().put(key, value, null, getNamespace());
    }

    default Mono<Object> getObject(String key) {
        return getObjectStore().get(key, null, getNamespace());
    }
}
