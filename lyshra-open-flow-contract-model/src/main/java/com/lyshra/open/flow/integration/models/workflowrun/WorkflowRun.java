package com.lyshra.open.flow.integration.models.workflowrun;

import com.lyshra.open.flow.integration.contract.workflow.IWorkflowRun;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowRunSource;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowRunState;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable run record owned by a single coordinator execution. Transitions out of
 * {@code RUNNING} happen at most once; later attempts are ignored and reported as
 * {@code false}.
 */
@Getter
@ToString
public class WorkflowRun implements IWorkflowRun {

    private final String uid;
    private final String workflow;
    private final String namespace;
    @ToString.Exclude
    private final Map<String, Object> input;
    private final LyshraOpenFlowRunSource source;
    private final Instant startedAt;

    private volatile LyshraOpenFlowRunState state;
    private volatile Instant finishedAt;
    @ToString.Exclude
    private volatile Object result;
    @Getter(AccessLevel.NONE)
    @ToString.Exclude
    private volatile Throwable failure;

    private WorkflowRun(String uid, String workflow, String namespace, Map<String, Object> input,
                        LyshraOpenFlowRunSource source, Instant startedAt, LyshraOpenFlowRunState state,
                        Instant finishedAt, Object result, Throwable failure) {
        this.uid = Objects.requireNonNull(uid, "uid");
        this.workflow = Objects.requireNonNull(workflow, "workflow");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.input = input;
        this.source = source;
        this.startedAt = startedAt;
        this.state = state;
        this.finishedAt = finishedAt;
        this.result = result;
        this.failure = failure;
    }

    public static WorkflowRun start(String uid, String workflow, String namespace, Map<String, Object> input,
                                    LyshraOpenFlowRunSource source, Instant startedAt) {
        Map<String, Object> inputCopy = input == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(input));
        return new WorkflowRun(uid, workflow, namespace, inputCopy, source, startedAt,
                LyshraOpenFlowRunState.RUNNING, null, null, null);
    }

    public synchronized boolean complete(Object result, Instant finishedAt) {
        if (state.isTerminal()) {
            return false;
        }
        this.result = result;
        this.finishedAt = finishedAt;
        this.state = LyshraOpenFlowRunState.COMPLETED;
        return true;
    }

    public synchronized boolean fail(Throwable cause, Instant finishedAt) {
        if (state.isTerminal()) {
            return false;
        }
        this.failure = cause;
        this.result = RunFailure.of(cause);
        this.finishedAt = finishedAt;
        this.state = LyshraOpenFlowRunState.FAILED;
        return true;
    }

    public synchronized boolean cancel(Instant finishedAt) {
        if (state.isTerminal()) {
            return false;
        }
        this.finishedAt = finishedAt;
        this.state = LyshraOpenFlowRunState.CANCELLED;
        return true;
    }

    /** Detached copy; later transitions of this run are not visible through it. */
    public synchronized WorkflowRun snapshot() {
        return new WorkflowRun(uid, workflow, namespace, input, source, startedAt, state, finishedAt, result, failure);
    }

    @Override
    public Optional<Throwable> getFailureCause() {
        return Optional.ofNullable(failure);
    }
}
