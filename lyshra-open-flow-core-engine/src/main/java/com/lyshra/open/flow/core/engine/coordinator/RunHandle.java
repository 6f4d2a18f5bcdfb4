package com.lyshra.open.flow.core.engine.coordinator;

import com.lyshra.open.flow.integration.contract.workflow.IWorkflowRun;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Handle on a submitted run. {@link #snapshot()} polls, {@link #await()} completes once the
 * run is terminal and its {@code workflow_finished} event has been published.
 */
public final class RunHandle {

    private final String runUid;
    private final String workflowName;
    private final Supplier<IWorkflowRun> snapshots;
    private final Mono<IWorkflowRun> completion;
    private final BooleanSupplier canceller;

    public RunHandle(String runUid, String workflowName, Supplier<IWorkflowRun> snapshots,
                     Mono<IWorkflowRun> completion, BooleanSupplier canceller) {
        this.runUid = runUid;
        this.workflowName = workflowName;
        this.snapshots = snapshots;
        this.completion = completion;
        this.canceller = canceller;
    }

    public String getRunUid() {
        return runUid;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public IWorkflowRun snapshot() {
        return snapshots.get();
    }

    public boolean isDone() {
        return snapshot().isTerminal();
    }

    public Mono<IWorkflowRun> await() {
        return completion;
    }

    /** Blocks the calling thread; not for use on a non-blocking scheduler. */
    public IWorkflowRun block(Duration timeout) {
        return completion.block(timeout);
    }

    /** {@code false} when the run had already finished. */
    public boolean cancel() {
        return canceller.getAsBoolean();
    }

    @Override
    public String toString() {
        return "RunHandle(runUid=" + runUid + ", workflowName=" + workflowName + ")";
    }
}
