package com.lyshra.open.flow.integration.contract.executor;

import com.lyshra.open.flow.integration.contract.store.IClusterMemory;
import com.lyshra.open.flow.integration.contract.workflow.IRunContext;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Backend that actually runs stage invocations in parallel.
 *
 * <p>Results are published as the target's return value; a {@code null} return completes
 * the {@link Mono} empty.</p>
 */
public interface IStageExecutor {

    /** Short name of the backend, for example {@code local}. */
    String getKind();

    Mono<Void> start();

    Mono<Void> close();

    boolean isRunning();

    Mono<Object> invoke(IStageTarget target, IRunContext context, List<Object> args, Map<String, Double> resources);

    /**
     * Invokes {@code target} once per argument list. The i-th element of the emitted list is
     * the result for the i-th argument list, whatever the completion order was. Element
     * invocations receive {@code context.forElement(i)}.
     */
    Mono<List<Object>> invokeMany(IStageTarget target, IRunContext context, List<List<Object>> argsList,
                                  Map<String, Double> resources);

    /** Keyed memory shared by all workers of the current session, when the backend has one. */
    Optional<IClusterMemory> getClusterMemory();

    Map<String, Object> environmentInfo();
}
