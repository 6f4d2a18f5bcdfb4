package com.lyshra.open.flow.core.engine.coordinator.impl;

import com.lyshra.open.flow.core.engine.coordinator.RunHandle;
import com.lyshra.open.flow.core.engine.coordinator.WorkflowRunEvents;
import com.lyshra.open.flow.core.engine.graph.CompiledGraph;
import com.lyshra.open.flow.core.engine.store.NamespaceBoundObjectStore;
import com.lyshra.open.flow.integration.contract.event.IEvent;
import com.lyshra.open.flow.integration.contract.event.IEventBus;
import com.lyshra.open.flow.integration.contract.executor.IStageExecutor;
import com.lyshra.open.flow.integration.contract.executor.IStageTarget;
import com.lyshra.open.flow.integration.contract.store.IObjectStore;
import com.lyshra.open.flow.integration.contract.workflow.IRunContext;
import com.lyshra.open.flow.integration.contract.workflow.IStageDefinition;
import com.lyshra.open.flow.integration.contract.workflow.IWorkflowRun;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStageHandoff;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStageKind;
import com.lyshra.open.flow.integration.exception.StageExecutionException;
import com.lyshra.open.flow.integration.exception.StageTimeoutException;
import com.lyshra.open.flow.integration.exception.WorkflowTimeoutException;
import com.lyshra.open.flow.integration.models.context.RunContext;
import com.lyshra.open.flow.integration.models.workflowrun.WorkflowRun;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.reactivestreams.Publisher;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.lang.reflect.Array;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Coordinator of one run. Stage completions arrive as callbacks; every callback takes the
 * execution lock, updates the bookkeeping and collects newly ready stages, which are
 * dispatched after the lock is released.
 *
 * <p>Subscriptions to the executor are never disposed. Cancellation, timeouts and fail-fast
 * only change the run state; results arriving afterwards are dropped.</p>
 *
 * <p>A stage timeout covers the stage's own code. Its timer is disarmed as soon as the value
 * arrives, so an object-store handoff is bounded by the run timeout only.</p>
 */
@Slf4j
class RunExecution {

    @Getter
    private final WorkflowRun run;
    private final CompiledGraph graph;
    private final Map<String, IStageTarget> targets;
    private final IStageExecutor executor;
    private final IObjectStore objectStore;
    private final IEventBus eventBus;
    private final Duration runTimeout;
    private final Duration defaultStageTimeout;
    private final Mono<Map<String, Object>> configSnapshot;

    private final Map<String, Optional<Object>> results = new HashMap<>();
    private final Set<String> storedResults = new HashSet<>();
    private final Map<String, Integer> pendingPredecessors = new HashMap<>();
    private final Set<String> dispatched = new HashSet<>();
    private final Map<String, Disposable> stageTimers = new HashMap<>();
    private final Disposable.Composite timers = Disposables.composite();
    private final Sinks.One<IWorkflowRun> completion = Sinks.one();

    private RunContext runContext;

    RunExecution(WorkflowRun run, CompiledGraph graph, Map<String, IStageTarget> targets, IStageExecutor executor,
                 IObjectStore objectStore, IEventBus eventBus, Duration runTimeout, Duration defaultStageTimeout,
                 Mono<Map<String, Object>> configSnapshot) {
        this.run = run;
        this.graph = graph;
        this.targets = targets;
        this.executor = executor;
        this.objectStore = objectStore;
        this.eventBus = eventBus;
        this.runTimeout = runTimeout;
        this.defaultStageTimeout = defaultStageTimeout;
        this.configSnapshot = configSnapshot;
        for (String stageName : graph.getTopologicalOrder()) {
            pendingPredecessors.put(stageName, graph.predecessorsOf(stageName).size());
        }
    }

    RunHandle handle() {
        return new RunHandle(run.getUid(), run.getWorkflow(), run::snapshot, completion.asMono(), this::cancel);
    }

    void start() {
        log.info("Starting run [{}] of workflow [{}] in namespace [{}] on executor [{}]",
                run.getUid(), run.getWorkflow(), run.getNamespace(), executor.getKind());
        publish(WorkflowRunEvents.started(run.snapshot()));
        if (runTimeout != null) {
            timers.add(Mono.delay(runTimeout)
                    .subscribe(ignored -> fail(new WorkflowTimeoutException(run.getUid(), runTimeout))));
        }
        Mono<Void> executorReady = executor.isRunning() ? Mono.empty() : executor.start();
        executorReady
                .then(configSnapshot.defaultIfEmpty(Map.of()))
                .subscribe(this::dispatchRoots, this::fail);
    }

    synchronized boolean cancel() {
        if (!run.cancel(Instant.now())) {
            return false;
        }
        log.info("Cancelled run [{}] of workflow [{}]", run.getUid(), run.getWorkflow());
        finish();
        return true;
    }

    // ------------------------------------------------------------------ scheduling

    private void dispatchRoots(Map<String, Object> config) {
        List<String> ready;
        synchronized (this) {
            runContext = RunContext.builder()
                    .input(run.getInput())
                    .namespace(run.getNamespace())
                    .executorKind(executor.getKind())
                    .definition(graph.getDefinition())
                    .run(run.snapshot())
                    .config(config)
                    .objectStore(new NamespaceBoundObjectStore(objectStore, run.getNamespace()))
                    .build();
            ready = claim(graph.roots());
        }
        ready.forEach(this::dispatch);
    }

    /** Marks the given stages dispatched unless the run already ended. Caller holds the lock. */
    private List<String> claim(List<String> stageNames) {
        if (run.isTerminal()) {
            return List.of();
        }
        List<String> claimed = new ArrayList<>();
        for (String stageName : stageNames) {
            if (dispatched.add(stageName)) {
                claimed.add(stageName);
            }
        }
        return claimed;
    }

    private void dispatch(String stageName) {
        IStageDefinition stage = graph.stage(stageName);
        IRunContext stageContext;
        Map<String, Optional<Object>> predecessorResults = new HashMap<>();
        Set<String> storedPredecessors = new HashSet<>();
        synchronized (this) {
            if (run.isTerminal()) {
                return;
            }
            stageContext = runContext.forStage(stageName, run.snapshot());
            for (String predecessor : graph.predecessorsOf(stageName)) {
                predecessorResults.put(predecessor, results.get(predecessor));
                if (storedResults.contains(predecessor)) {
                    storedPredecessors.add(predecessor);
                }
            }
            Duration timeout = stage.getTimeout() != null ? stage.getTimeout() : defaultStageTimeout;
            if (timeout != null) {
                Disposable timer = Mono.delay(timeout)
                        .subscribe(ignored -> fail(new StageTimeoutException(stageName, null, timeout)));
                stageTimers.put(stageName, timer);
                timers.add(timer);
            }
        }
        log.debug("Dispatching stage [{}] of run [{}]", stageName, run.getUid());

        Mono.defer(() -> arguments(stage, predecessorResults, storedPredecessors))
                .flatMap(arguments -> invoke(stage, stageContext, arguments))
                .subscribe(result -> onStageCompleted(stage, result),
                        error -> fail(wrap(stageName, error)));
    }

    private Mono<Optional<Object>> invoke(IStageDefinition stage, IRunContext stageContext, List<Object> arguments) {
        IStageTarget target = targets.get(stage.getName());
        if (stage.getKind() == LyshraOpenFlowStageKind.PARAMETERIZED) {
            List<Object> elements = iterate(stage, arguments.get(0));
            if (elements.isEmpty()) {
                return Mono.just(Optional.of(List.of()));
            }
            List<List<Object>> argsList = new ArrayList<>(elements.size());
            for (Object element : elements) {
                List<Object> elementArgs = new ArrayList<>(1);
                elementArgs.add(element);
                argsList.add(elementArgs);
            }
            return executor.invokeMany(elementTarget(stage.getName(), target), stageContext, argsList, stage.getResources())
                    .map(values -> Optional.of((Object) values));
        }
        return executor.invoke(target, stageContext, arguments, stage.getResources())
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    private void onStageCompleted(IStageDefinition stage, Optional<Object> result) {
        String stageName = stage.getName();
        disarmStageTimer(stageName);
        if (stage.getHandoff() == LyshraOpenFlowStageHandoff.OBJECT_STORE && result.isPresent() && !run.isTerminal()) {
            objectStore.put(handoffKey(stageName), result.get(), null, run.getNamespace())
                    .subscribe(null,
                            error -> fail(wrap(stageName, error)),
                            () -> recordCompletion(stage, result, true));
            return;
        }
        recordCompletion(stage, result, false);
    }

    private void recordCompletion(IStageDefinition stage, Optional<Object> result, boolean stored) {
        String stageName = stage.getName();
        List<String> ready;
        synchronized (this) {
            if (run.isTerminal()) {
                log.debug("Discarding result of stage [{}], run [{}] is already {}", stageName, run.getUid(), run.getState());
                return;
            }
            results.put(stageName, result);
            if (stored) {
                storedResults.add(stageName);
            }
            log.debug("Stage [{}] of run [{}] completed", stageName, run.getUid());

            if (results.size() == graph.size()) {
                Object runResult = results.get(graph.resultStage()).orElse(null);
                if (run.complete(runResult, Instant.now())) {
                    log.info("Run [{}] of workflow [{}] completed", run.getUid(), run.getWorkflow());
                    finish();
                }
                return;
            }
            List<String> unblocked = new ArrayList<>();
            for (String successor : graph.successorsOf(stageName)) {
                if (pendingPredecessors.merge(successor, -1, Integer::sum) == 0) {
                    unblocked.add(successor);
                }
            }
            ready = claim(unblocked);
        }
        ready.forEach(this::dispatch);
    }

    private synchronized void disarmStageTimer(String stageName) {
        Disposable timer = stageTimers.remove(stageName);
        if (timer != null) {
            timer.dispose();
            timers.remove(timer);
        }
    }

    private synchronized void fail(Throwable error) {
        if (!run.fail(error, Instant.now())) {
            log.debug("Ignoring failure for finished run [{}]: {}", run.getUid(), error.getMessage());
            return;
        }
        log.error("Run [{}] of workflow [{}] failed: {}", run.getUid(), run.getWorkflow(), error.getMessage(), error);
        finish();
    }

    /** Caller holds the lock and has just moved the run to a terminal state. */
    private void finish() {
        timers.dispose();
        stageTimers.clear();
        IWorkflowRun snapshot = run.snapshot();
        eventBus.publish(WorkflowRunEvents.finished(snapshot))
                .onErrorResume(error -> {
                    log.error("Could not publish the finished event of run [{}]", run.getUid(), error);
                    return Mono.empty();
                })
                .subscribe(null, null, () -> completion.tryEmitValue(snapshot));
    }

    // ------------------------------------------------------------------ arguments

    private Mono<List<Object>> arguments(IStageDefinition stage, Map<String, Optional<Object>> predecessorResults,
                                         Set<String> storedPredecessors) {
        List<String> predecessors = graph.predecessorsOf(stage.getName());
        if (stage.getKind() == LyshraOpenFlowStageKind.PARAMETERIZED && stage.getMapOn() != null) {
            return Mono.just(single(run.getInput().get(stage.getMapOn())));
        }
        if (predecessors.isEmpty()) {
            return Mono.just(single(run.getInput()));
        }
        return Flux.fromIterable(predecessors)
                .concatMap(predecessor -> predecessorValue(predecessor, predecessorResults.get(predecessor),
                        storedPredecessors.contains(predecessor)))
                .collectList()
                .map(values -> {
                    List<Object> unwrapped = new ArrayList<>(values.size());
                    values.forEach(value -> unwrapped.add(value.orElse(null)));
                    return predecessors.size() == 1 ? single(unwrapped.get(0)) : single(unwrapped);
                });
    }

    private Mono<Optional<Object>> predecessorValue(String predecessor, Optional<Object> result, boolean stored) {
        if (!stored) {
            return Mono.just(result);
        }
        return objectStore.get(handoffKey(predecessor), null, run.getNamespace())
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    private static List<Object> iterate(IStageDefinition stage, Object source) {
        if (source instanceof Iterable<?> iterable) {
            List<Object> elements = new ArrayList<>();
            iterable.forEach(elements::add);
            return elements;
        }
        if (source != null && source.getClass().isArray()) {
            int length = Array.getLength(source);
            List<Object> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(source, i));
            }
            return elements;
        }
        String origin = stage.getMapOn() != null ? "input [" + stage.getMapOn() + "]" : "the predecessor result";
        throw new StageExecutionException(stage.getName(), null, new IllegalArgumentException(
                origin + " is not iterable: " + (source == null ? "null" : source.getClass().getSimpleName())));
    }

    // ------------------------------------------------------------------ helpers

    String handoffKey(String stageName) {
        return run.getUid() + "-" + stageName;
    }

    private static IStageTarget elementTarget(String stageName, IStageTarget target) {
        return (context, args) -> {
            Integer elementIndex = context.getElementIndex().orElse(null);
            Object result;
            try {
                result = target.invoke(context, args);
            } catch (Exception e) {
                throw new StageExecutionException(stageName, elementIndex, e);
            }
            if (result instanceof Publisher<?> publisher) {
                return Mono.from(publisher)
                        .onErrorMap(error -> !(error instanceof StageExecutionException),
                                error -> new StageExecutionException(stageName, elementIndex, error));
            }
            return result;
        };
    }

    private static Throwable wrap(String stageName, Throwable error) {
        if (error instanceof StageExecutionException) {
            return error;
        }
        return new StageExecutionException(stageName, null, error);
    }

    private static List<Object> single(Object value) {
        List<Object> list = new ArrayList<>(1);
        list.add(value);
        return list;
    }

    private void publish(IEvent event) {
        eventBus.publish(event)
                .subscribe(null, error -> log.error("Could not publish event [{}] of run [{}]",
                        event.getType(), run.getUid(), error));
    }
}
