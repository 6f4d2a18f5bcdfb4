package com.lyshra.open.flow.integration.models.context;

import com.lyshra.open.flow.integration.contract.store.IObjectStore;
import com.lyshra.open.flow.integration.contract.workflow.IRunContext;
import com.lyshra.open.flow.integration.contract.workflow.IWorkflowDefinition;
import com.lyshra.open.flow.integration.contract.workflow.IWorkflowRun;
import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable run context. {@link #forStage} and {@link #forElement} derive new views and
 * never touch the receiver, so concurrently running stages and fan-out elements cannot
 * observe each other's position.
 */
@Data
@Builder(toBuilder = true)
public class RunContext implements IRunContext {

    @Builder.Default
    private final Map<String, Object> input = Collections.emptyMap();
    private final String namespace;
    private final String executorKind;
    @ToString.Exclude
    private final IWorkflowDefinition definition;
    private final IWorkflowRun run;
    @Builder.Default
    @ToString.Exclude
    private final Map<String, Object> config = Collections.emptyMap();
    private final String stageName;
    private final Integer elementIndex;
    @ToString.Exclude
    private final IObjectStore objectStore;

    @Override
    public Optional<Integer> getElementIndex() {
        return Optional.ofNullable(elementIndex);
    }

    @Override
    public RunContext forStage(String stageName, IWorkflowRun runSnapshot) {
        return toBuilder()
                .stageName(stageName)
                .run(runSnapshot)
                .elementIndex(null)
                .build();
    }

    @Override
    public RunContext forElement(int elementIndex) {
        return toBuilder()
                .elementIndex(elementIndex)
                .build();
    }
}
