package com.lyshra.open.flow.core.engine.coordinator.impl;

import com.lyshra.open.flow.core.engine.config.LyshraOpenFlowConfig;
import com.lyshra.open.flow.core.engine.coordinator.ILyshraOpenFlowWorkflowCoordinator;
import com.lyshra.open.flow.core.engine.coordinator.RunHandle;
import com.lyshra.open.flow.core.engine.graph.CompiledGraph;
import com.lyshra.open.flow.core.engine.graph.ILyshraOpenFlowDagCompiler;
import com.lyshra.open.flow.integration.contract.definition.IConfigDocument;
import com.lyshra.open.flow.integration.contract.definition.IDefinitionStore;
import com.lyshra.open.flow.integration.contract.event.IEventBus;
import com.lyshra.open.flow.integration.contract.executor.IStageExecutor;
import com.lyshra.open.flow.integration.contract.executor.IStageTarget;
import com.lyshra.open.flow.integration.contract.executor.ITargetResolver;
import com.lyshra.open.flow.integration.contract.store.IObjectStore;
import com.lyshra.open.flow.integration.contract.workflow.IStageDefinition;
import com.lyshra.open.flow.integration.contract.workflow.IWorkflowDefinition;
import com.lyshra.open.flow.integration.contract.workflow.IWorkflowRun;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowRunSource;
import com.lyshra.open.flow.integration.exception.WorkflowNotFoundException;
import com.lyshra.open.flow.integration.models.workflowrun.WorkflowRun;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

@Slf4j
public class LyshraOpenFlowWorkflowCoordinator implements ILyshraOpenFlowWorkflowCoordinator {

    private final LyshraOpenFlowConfig config;
    private final ILyshraOpenFlowDagCompiler compiler;
    private final ITargetResolver targetResolver;
    private final IStageExecutor defaultExecutor;
    private final Function<IStageExecutor, IObjectStore> objectStoreFactory;
    private final IEventBus eventBus;
    private final IDefinitionStore definitionStore;
    private final Map<IStageExecutor, IObjectStore> objectStores = new ConcurrentHashMap<>();
    private final WorkflowRunRegistry registry = new WorkflowRunRegistry();

    /**
     * @param objectStoreFactory builds the object store bound to an executor's cluster memory
     * @param definitionStore    source of stored workflows and config documents, may be {@code null}
     */
    public LyshraOpenFlowWorkflowCoordinator(LyshraOpenFlowConfig config,
                                             ILyshraOpenFlowDagCompiler compiler,
                                             ITargetResolver targetResolver,
                                             IStageExecutor defaultExecutor,
                                             Function<IStageExecutor, IObjectStore> objectStoreFactory,
                                             IEventBus eventBus,
                                             IDefinitionStore definitionStore) {
        this.config = config;
        this.compiler = compiler;
        this.targetResolver = targetResolver;
        this.defaultExecutor = defaultExecutor;
        this.objectStoreFactory = objectStoreFactory;
        this.eventBus = eventBus;
        this.definitionStore = definitionStore;
    }

    @Override
    public RunHandle submit(IWorkflowDefinition definition, Map<String, Object> input, String namespace) {
        return submit(definition, input, namespace, defaultExecutor);
    }

    @Override
    public RunHandle submit(IWorkflowDefinition definition, Map<String, Object> input, String namespace,
                            IStageExecutor executor) {
        return submit(definition, input, namespace, executor, LyshraOpenFlowRunSource.API);
    }

    @Override
    public RunHandle submit(IWorkflowDefinition definition, Map<String, Object> input, String namespace,
                            IStageExecutor executor, LyshraOpenFlowRunSource source) {
        CompiledGraph graph = compiler.compile(definition);
        Map<String, IStageTarget> targets = new HashMap<>();
        for (IStageDefinition stage : definition.getStages()) {
            targets.put(stage.getName(), targetResolver.resolve(stage.getTarget()));
        }

        String resolvedNamespace = namespace == null || namespace.isBlank() ? config.getDefaultNamespace() : namespace;
        WorkflowRun run = WorkflowRun.start(UUID.randomUUID().toString(), definition.getName(), resolvedNamespace,
                input, source, Instant.now());
        RunExecution execution = new RunExecution(run, graph, targets, executor, objectStoreFor(executor), eventBus,
                config.getRunTimeout(), config.getDefaultStageTimeout(), configSnapshot(definition));
        registry.register(execution);
        execution.start();
        return execution.handle();
    }

    @Override
    public Mono<RunHandle> submitByName(String workflowName, Map<String, Object> input, String namespace,
                                        LyshraOpenFlowRunSource source) {
        if (definitionStore == null) {
            return Mono.error(new WorkflowNotFoundException(workflowName));
        }
        return definitionStore.getWorkflow(workflowName)
                .switchIfEmpty(Mono.error(() -> new WorkflowNotFoundException(workflowName)))
                .map(definition -> submit(definition, input, namespace, defaultExecutor, source));
    }

    @Override
    public Mono<IWorkflowRun> submit(String workflowName, Map<String, Object> input, String namespace,
                                     LyshraOpenFlowRunSource source) {
        return submitByName(workflowName, input, namespace, source).map(RunHandle::snapshot);
    }

    @Override
    public IWorkflowRun getRun(String runUid) {
        return registry.get(runUid).getRun().snapshot();
    }

    @Override
    public Optional<RunHandle> findHandle(String runUid) {
        return registry.find(runUid).map(RunExecution::handle);
    }

    @Override
    public List<IWorkflowRun> listRuns(String workflowName, int limit) {
        return registry.list(workflowName, limit);
    }

    @Override
    public boolean cancel(String runUid) {
        return registry.get(runUid).cancel();
    }

    @Override
    public int purgeFinishedRuns() {
        int purged = registry.purgeFinishedBefore(Instant.now().minus(config.getRunRetention()));
        if (purged > 0) {
            log.info("Purged {} finished run(s) older than {}", purged, config.getRunRetention());
        }
        return purged;
    }

    private IObjectStore objectStoreFor(IStageExecutor executor) {
        return objectStores.computeIfAbsent(executor, objectStoreFactory);
    }

    /** Global documents, then the workflow's config group, then documents selecting the workflow by name. */
    private Mono<Map<String, Object>> configSnapshot(IWorkflowDefinition definition) {
        if (definitionStore == null) {
            return Mono.just(Map.of());
        }
        return definitionStore.getConfigs(definition.getConfigGroup(), definition.getName())
                .collectList()
                .map(documents -> {
                    Map<String, Object> merged = new LinkedHashMap<>();
                    for (IConfigDocument document : documents) {
                        if (document.getData() != null) {
                            merged.putAll(document.getData());
                        }
                    }
                    return merged;
                });
    }
}
