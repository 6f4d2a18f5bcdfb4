package com.lyshra.open.flow.core.engine;

import com.lyshra.open.flow.core.engine.config.LyshraOpenFlowConfig;
import com.lyshra.open.flow.core.engine.coordinator.ILyshraOpenFlowWorkflowCoordinator;
import com.lyshra.open.flow.core.engine.coordinator.impl.LyshraOpenFlowWorkflowCoordinator;
import com.lyshra.open.flow.core.engine.definition.InMemoryDefinitionStore;
import com.lyshra.open.flow.core.engine.event.InMemoryEventBus;
import com.lyshra.open.flow.core.engine.executor.LocalStageExecutor;
import com.lyshra.open.flow.core.engine.executor.ReconnectingStageExecutor;
import com.lyshra.open.flow.core.engine.graph.impl.LyshraOpenFlowDagCompiler;
import com.lyshra.open.flow.core.engine.resolver.RegistryTargetResolver;
import com.lyshra.open.flow.core.engine.store.LyshraOpenFlowObjectStore;
import com.lyshra.open.flow.core.engine.store.artifact.FileSystemArtifactRepository;
import com.lyshra.open.flow.core.engine.trigger.ILyshraOpenFlowTriggerEngine;
import com.lyshra.open.flow.core.engine.trigger.action.LogEventActionHandler;
import com.lyshra.open.flow.core.engine.trigger.action.RunWorkflowActionHandler;
import com.lyshra.open.flow.core.engine.trigger.condition.ConditionEvaluator;
import com.lyshra.open.flow.core.engine.trigger.impl.LyshraOpenFlowTriggerEngine;
import com.lyshra.open.flow.core.engine.trigger.schedule.ScheduleClock;
import com.lyshra.open.flow.integration.contract.event.IEventBus;
import com.lyshra.open.flow.integration.contract.executor.IStageExecutor;
import com.lyshra.open.flow.integration.contract.store.IObjectStore;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wires the orchestration core for one process: a local executor behind a reconnecting
 * wrapper, the tiered object store, an in-memory event bus and definition store, the
 * coordinator and the trigger engine. While started, finished runs older than the configured
 * retention are purged every {@code runPurgeInterval}.
 *
 * <pre>{@code
 * LyshraOpenFlowEngine engine = LyshraOpenFlowEngine.create(LyshraOpenFlowConfig.fromEnvironment());
 * engine.getTargetResolver().register("data.load", (context, args) -> List.of(1, 2, 3));
 * engine.start().block();
 * IWorkflowRun run = engine.getCoordinator().submit(workflow, Map.of(), null).block(Duration.ofMinutes(1));
 * }</pre>
 */
@Slf4j
@Getter
public class LyshraOpenFlowEngine implements ILyshraOpenFlowEngine {

    private final LyshraOpenFlowConfig config;
    private final RegistryTargetResolver targetResolver;
    private final ReconnectingStageExecutor executor;
    private final FileSystemArtifactRepository artifactRepository;
    private final IEventBus eventBus;
    private final InMemoryDefinitionStore definitionStore;
    private final ILyshraOpenFlowWorkflowCoordinator coordinator;
    private final ILyshraOpenFlowTriggerEngine triggerEngine;
    private final IObjectStore objectStore;

    @Getter(AccessLevel.NONE)
    private Disposable runPurging;

    private LyshraOpenFlowEngine(LyshraOpenFlowConfig config, Clock clock) {
        config.validate();
        this.config = config;
        this.targetResolver = new RegistryTargetResolver();
        this.executor = new ReconnectingStageExecutor(
                new LocalStageExecutor(config.getExecutorParallelism()),
                config.getExecutorReconnectAttempts(),
                config.getExecutorReconnectBackoff(),
                config.getExecutorReconnectTimeout());
        this.artifactRepository = new FileSystemArtifactRepository(config.getArtifactBasePath());
        this.eventBus = new InMemoryEventBus();
        this.definitionStore = new InMemoryDefinitionStore();
        this.objectStore = objectStoreFor(executor);
        this.coordinator = new LyshraOpenFlowWorkflowCoordinator(
                config,
                LyshraOpenFlowDagCompiler.getInstance(),
                targetResolver,
                executor,
                stageExecutor -> stageExecutor == executor ? objectStore : objectStoreFor(stageExecutor),
                eventBus,
                definitionStore);
        this.triggerEngine = new LyshraOpenFlowTriggerEngine(
                eventBus,
                new ScheduleClock(clock, config.getMissedTickPolicy(), config.getMaxCatchUpTicks()),
                new ConditionEvaluator(config.getMissingPathPolicy()),
                List.of(new RunWorkflowActionHandler(coordinator), new LogEventActionHandler()));
    }

    public static LyshraOpenFlowEngine create(LyshraOpenFlowConfig config) {
        return new LyshraOpenFlowEngine(config, Clock.systemUTC());
    }

    public static LyshraOpenFlowEngine create(LyshraOpenFlowConfig config, Clock clock) {
        return new LyshraOpenFlowEngine(config, clock);
    }

    @Override
    public Mono<Void> start() {
        return executor.start()
                .then(triggerEngine.start())
                .then(triggerEngine.followDefinitions(definitionStore))
                .then(Mono.fromRunnable(this::startRunPurging))
                .then()
                .doOnSuccess(ignored -> log.info("Lyshra open flow engine started: {}", config));
    }

    @Override
    public Mono<Void> stop() {
        return Mono.fromRunnable(this::stopRunPurging)
                .then(triggerEngine.stop())
                .then(executor.close())
                .doOnSuccess(ignored -> log.info("Lyshra open flow engine stopped"));
    }

    private synchronized void startRunPurging() {
        if (runPurging != null && !runPurging.isDisposed()) {
            return;
        }
        Duration interval = config.getRunPurgeInterval();
        runPurging = Flux.interval(interval, interval, Schedulers.parallel())
                .subscribe(ignored -> purgeFinishedRuns(),
                        error -> log.error("Run purging stopped", error));
        log.debug("Purging finished runs every {} with retention {}", interval, config.getRunRetention());
    }

    private void purgeFinishedRuns() {
        try {
            coordinator.purgeFinishedRuns();
        } catch (RuntimeException e) {
            log.warn("Purging finished runs failed, retrying in {}", config.getRunPurgeInterval(), e);
        }
    }

    private synchronized void stopRunPurging() {
        if (runPurging != null) {
            runPurging.dispose();
            runPurging = null;
        }
    }

    private IObjectStore objectStoreFor(IStageExecutor stageExecutor) {
        return LyshraOpenFlowObjectStore.create(
                stageExecutor::getClusterMemory,
                artifactRepository,
                config.getDefaultStoreStrategy(),
                config.getDefaultNamespace());
    }
}
