package com.lyshra.open.flow.core.engine.executor;

import com.lyshra.open.flow.integration.contract.executor.IStageExecutor;
import com.lyshra.open.flow.integration.contract.executor.IStageTarget;
import com.lyshra.open.flow.integration.contract.store.IClusterMemory;
import com.lyshra.open.flow.integration.contract.workflow.IRunContext;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowExecutorHealth;
import com.lyshra.open.flow.integration.exception.ExecutorUnavailableException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wraps an executor whose connection may drop. Calls failing with a transient
 * {@link ExecutorUnavailableException} are retried with exponential backoff. Before each retry
 * the delegate is restarted if it is no longer running; a running delegate, and the work other
 * runs have in flight on it, is left alone. Once the retry budget is spent the executor is
 * reported {@link LyshraOpenFlowExecutorHealth#UNHEALTHY} and the caller receives a
 * non-transient {@link ExecutorUnavailableException}. Any other error is passed through untouched.
 */
@Slf4j
public class ReconnectingStageExecutor implements IStageExecutor {

    private final IStageExecutor delegate;
    private final int maxAttempts;
    private final Duration backoff;
    private final Duration reconnectTimeout;

    private final AtomicReference<LyshraOpenFlowExecutorHealth> health =
            new AtomicReference<>(LyshraOpenFlowExecutorHealth.HEALTHY);
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicLong reconnectCount = new AtomicLong();
    private final AtomicReference<Throwable> lastFailure = new AtomicReference<>();
    private volatile Instant lastFailureAt;
    private volatile Instant lastReconnectAt;
    private Mono<Void> inFlightReconnect;
    private long reconnectGeneration;

    public ReconnectingStageExecutor(IStageExecutor delegate, int maxAttempts, Duration backoff,
                                     Duration reconnectTimeout) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative");
        }
        this.delegate = delegate;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.reconnectTimeout = reconnectTimeout;
    }

    @Override
    public String getKind() {
        return delegate.getKind();
    }

    @Override
    public Mono<Void> start() {
        return guarded(Mono.defer(delegate::start));
    }

    @Override
    public Mono<Void> close() {
        return delegate.close();
    }

    @Override
    public boolean isRunning() {
        return delegate.isRunning();
    }

    @Override
    public Mono<Object> invoke(IStageTarget target, IRunContext context, List<Object> args,
                               Map<String, Double> resources) {
        return guarded(Mono.defer(() -> delegate.invoke(target, context, args, resources)));
    }

    @Override
    public Mono<List<Object>> invokeMany(IStageTarget target, IRunContext context, List<List<Object>> argsList,
                                         Map<String, Double> resources) {
        return guarded(Mono.defer(() -> delegate.invokeMany(target, context, argsList, resources)));
    }

    @Override
    public Optional<IClusterMemory> getClusterMemory() {
        return delegate.getClusterMemory();
    }

    @Override
    public Map<String, Object> environmentInfo() {
        Map<String, Object> info = new LinkedHashMap<>(delegate.environmentInfo());
        info.put("health", health.get().name());
        return info;
    }

    public LyshraOpenFlowExecutorHealth getHealth() {
        return health.get();
    }

    public ExecutorHealthReport health() {
        Throwable failure = lastFailure.get();
        return ExecutorHealthReport.builder()
                .status(health.get())
                .executorKind(getKind())
                .running(isRunning())
                .consecutiveFailures(consecutiveFailures.get())
                .reconnectCount(reconnectCount.get())
                .lastFailureMessage(failure == null ? null : failure.getMessage())
                .lastFailureAt(lastFailureAt)
                .lastReconnectAt(lastReconnectAt)
                .environment(delegate.environmentInfo())
                .build();
    }

    private <T> Mono<T> guarded(Mono<T> call) {
        return call
                .doOnError(this::recordFailure)
                .retryWhen(retrySpec())
                .doOnSuccess(ignored -> recordSuccess());
    }

    private RetryBackoffSpec retrySpec() {
        return Retry.backoff(maxAttempts, backoff)
                .filter(ReconnectingStageExecutor::isTransient)
                .doBeforeRetryAsync(signal -> reconnect(signal.totalRetries() + 1))
                .onRetryExhaustedThrow((spec, signal) -> {
                    health.set(LyshraOpenFlowExecutorHealth.UNHEALTHY);
                    log.error("Executor [{}] unreachable after {} reconnection attempts",
                            getKind(), signal.totalRetries(), signal.failure());
                    return new ExecutorUnavailableException(getKind(),
                            "reconnection attempts exhausted: " + signal.failure().getMessage(), false, signal.failure());
                });
    }

    /**
     * Joins the reconnect in flight or starts one. Concurrent failing calls share a single
     * restart of the delegate instead of each cycling it.
     */
    private synchronized Mono<Void> reconnect(long attempt) {
        if (inFlightReconnect == null) {
            long generation = ++reconnectGeneration;
            inFlightReconnect = restart(attempt)
                    .doFinally(signal -> reconnectFinished(generation))
                    .cache();
        }
        return inFlightReconnect;
    }

    private synchronized void reconnectFinished(long generation) {
        if (generation == reconnectGeneration) {
            inFlightReconnect = null;
        }
    }

    private Mono<Void> restart(long attempt) {
        return Mono.defer(() -> {
            if (delegate.isRunning()) {
                log.info("Executor [{}] is still running, retrying without restart (attempt {}/{})",
                        getKind(), attempt, maxAttempts);
                return Mono.<Void>empty();
            }
            log.info("Reconnecting executor [{}], attempt {}/{}", getKind(), attempt, maxAttempts);
            return Mono.defer(delegate::close)
                    .onErrorResume(error -> {
                        log.debug("Closing executor [{}] before reconnect failed: {}", getKind(), error.getMessage());
                        return Mono.empty();
                    })
                    .then(Mono.defer(delegate::start))
                    .timeout(reconnectTimeout)
                    .doOnSuccess(ignored -> {
                        reconnectCount.incrementAndGet();
                        lastReconnectAt = Instant.now();
                        log.info("Executor [{}] reconnected", getKind());
                    });
        }).onErrorResume(error -> {
            // the retried call reports the failure if the executor is still down
            log.warn("Reconnect attempt {} for executor [{}] failed: {}", attempt, getKind(), error.getMessage());
            return Mono.empty();
        });
    }

    private void recordFailure(Throwable error) {
        if (isTransient(error)) {
            consecutiveFailures.incrementAndGet();
            lastFailure.set(error);
            lastFailureAt = Instant.now();
            if (health.compareAndSet(LyshraOpenFlowExecutorHealth.HEALTHY, LyshraOpenFlowExecutorHealth.DEGRADED)) {
                log.warn("Executor [{}] degraded: {}", getKind(), error.getMessage());
            }
        } else if (error instanceof ExecutorUnavailableException) {
            lastFailure.set(error);
            lastFailureAt = Instant.now();
            health.set(LyshraOpenFlowExecutorHealth.UNHEALTHY);
            log.error("Executor [{}] failed fatally", getKind(), error);
        }
    }

    private void recordSuccess() {
        consecutiveFailures.set(0);
        LyshraOpenFlowExecutorHealth previous = health.getAndSet(LyshraOpenFlowExecutorHealth.HEALTHY);
        if (previous != LyshraOpenFlowExecutorHealth.HEALTHY) {
            log.info("Executor [{}] healthy again", getKind());
        }
    }

    private static boolean isTransient(Throwable error) {
        return error instanceof ExecutorUnavailableException unavailable && unavailable.isTransientFailure();
    }
}
