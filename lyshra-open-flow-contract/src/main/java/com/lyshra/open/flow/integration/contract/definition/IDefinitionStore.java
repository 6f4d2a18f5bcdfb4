package com.lyshra.open.flow.integration.contract.definition;

import com.lyshra.open.flow.integration.contract.trigger.ITriggerRule;
import com.lyshra.open.flow.integration.contract.workflow.IWorkflowDefinition;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read side of the definition persistence collaborator.
 */
public interface IDefinitionStore {

    /** Empty when no workflow with that name exists. */
    Mono<IWorkflowDefinition> getWorkflow(String name);

    Mono<ITriggerRule> getTriggerRule(String name);

    Flux<ITriggerRule> getTriggerRules();

    /** Config documents whose selector is blank or equal to one of {@code selectors}. */
    Flux<IConfigDocument> getConfigs(String... selectors);

    /** Hot stream of applied and deleted definitions. */
    Flux<DefinitionChange> changes();
}
