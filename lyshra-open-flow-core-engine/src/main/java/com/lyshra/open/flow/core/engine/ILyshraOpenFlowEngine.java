package com.lyshra.open.flow.core.engine;

import com.lyshra.open.flow.core.engine.config.LyshraOpenFlowConfig;
import com.lyshra.open.flow.core.engine.coordinator.ILyshraOpenFlowWorkflowCoordinator;
import com.lyshra.open.flow.core.engine.definition.InMemoryDefinitionStore;
import com.lyshra.open.flow.core.engine.executor.ReconnectingStageExecutor;
import com.lyshra.open.flow.core.engine.resolver.RegistryTargetResolver;
import com.lyshra.open.flow.core.engine.trigger.ILyshraOpenFlowTriggerEngine;
import com.lyshra.open.flow.integration.contract.event.IEventBus;
import com.lyshra.open.flow.integration.contract.store.IObjectStore;
import reactor.core.publisher.Mono;

public interface ILyshraOpenFlowEngine {
    LyshraOpenFlowConfig getConfig();
    ILyshraOpenFlowWorkflowCoordinator getCoordinator();
    ILyshraOpenFlowTriggerEngine getTriggerEngine();
    IObjectStore getObjectStore();
    IEventBus getEventBus();
    InMemoryDefinitionStore getDefinitionStore();
    RegistryTargetResolver getTargetResolver();
    ReconnectingStageExecutor getExecutor();

    /**
     * Starts the executor and the trigger engine and registers the stored trigger rules.
     */
    Mono<Void> start();

    Mono<Void> stop();
}
