package com.lyshra.open.flow.core.engine.executor;

import com.lyshra.open.flow.core.engine.context.RunContextHolder;
import com.lyshra.open.flow.core.engine.store.memory.InMemoryClusterMemory;
import com.lyshra.open.flow.integration.contract.executor.IStageExecutor;
import com.lyshra.open.flow.integration.contract.executor.IStageTarget;
import com.lyshra.open.flow.integration.contract.store.IClusterMemory;
import com.lyshra.open.flow.integration.contract.workflow.IRunContext;
import com.lyshra.open.flow.integration.exception.ExecutorUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor backed by a bounded pool of local threads. Invocations may block; each one runs on
 * its own pool worker with its run context bound in the Reactor context.
 */
@Slf4j
public class LocalStageExecutor implements IStageExecutor {

    public static final String KIND = "local";
    private static final int QUEUED_TASK_CAP = 100_000;

    private final int parallelism;
    private final InMemoryClusterMemory clusterMemory = new InMemoryClusterMemory(false);
    private volatile Scheduler scheduler;

    public LocalStageExecutor(int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
        this.parallelism = parallelism;
    }

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public Mono<Void> start() {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                if (scheduler != null) {
                    return;
                }
                scheduler = Schedulers.newBoundedElastic(parallelism, QUEUED_TASK_CAP, "lyshra-flow-stage");
                clusterMemory.open();
                log.info("Local stage executor started with parallelism {}", parallelism);
            }
        });
    }

    @Override
    public Mono<Void> close() {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                if (scheduler == null) {
                    return;
                }
                scheduler.dispose();
                scheduler = null;
                clusterMemory.shutdown();
                log.info("Local stage executor closed");
            }
        });
    }

    @Override
    public boolean isRunning() {
        return scheduler != null;
    }

    @Override
    public Mono<Object> invoke(IStageTarget target, IRunContext context, List<Object> args,
                               Map<String, Double> resources) {
        return Mono.defer(() -> {
            Scheduler current = scheduler;
            if (current == null) {
                return Mono.error(new ExecutorUnavailableException(KIND, "executor is not running", false));
            }
            log.debug("Invoking stage [{}] element [{}] with resources {}",
                    context.getStageName(), context.getElementIndex().orElse(null), resources);
            return Mono.fromCallable(() -> target.invoke(context, args))
                    .flatMap(LocalStageExecutor::flatten)
                    .subscribeOn(current)
                    .contextWrite(RunContextHolder.withRunContext(context));
        });
    }

    /**
     * Element invocations are subscribed independently: the first failure fails the returned
     * {@link Mono} at once while the remaining elements keep running and their results are
     * dropped.
     */
    @Override
    public Mono<List<Object>> invokeMany(IStageTarget target, IRunContext context, List<List<Object>> argsList,
                                         Map<String, Double> resources) {
        if (argsList.isEmpty()) {
            return Mono.just(List.of());
        }
        return Mono.create(sink -> {
            int size = argsList.size();
            Object[] results = new Object[size];
            AtomicInteger remaining = new AtomicInteger(size);
            AtomicBoolean failed = new AtomicBoolean();
            for (int index = 0; index < size; index++) {
                int elementIndex = index;
                invoke(target, context.forElement(elementIndex), argsList.get(elementIndex), resources)
                        .subscribe(
                                result -> results[elementIndex] = result,
                                error -> {
                                    if (failed.compareAndSet(false, true)) {
                                        sink.error(error);
                                    } else {
                                        log.debug("Dropping failure of element [{}] of stage [{}]: {}",
                                                elementIndex, context.getStageName(), error.getMessage());
                                    }
                                },
                                () -> {
                                    if (remaining.decrementAndGet() == 0 && !failed.get()) {
                                        sink.success(Arrays.asList(results));
                                    }
                                });
            }
        });
    }

    @Override
    public Optional<IClusterMemory> getClusterMemory() {
        return isRunning() ? Optional.of(clusterMemory) : Optional.empty();
    }

    @Override
    public Map<String, Object> environmentInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("kind", KIND);
        info.put("running", isRunning());
        info.put("parallelism", parallelism);
        info.put("available_processors", Runtime.getRuntime().availableProcessors());
        info.put("java_version", System.getProperty("java.version"));
        return info;
    }

    private static Mono<Object> flatten(Object result) {
        if (result instanceof Publisher<?> publisher) {
            return Mono.from(publisher).map(value -> (Object) value);
        }
        return Mono.justOrEmpty(result);
    }
}
