package com.lyshra.open.flow.core.engine.trigger;

import com.lyshra.open.flow.integration.contract.definition.IDefinitionStore;
import com.lyshra.open.flow.integration.contract.event.IEvent;
import com.lyshra.open.flow.integration.contract.trigger.ITriggerRule;
import com.lyshra.open.flow.integration.exception.TriggerRuleException;
import reactor.core.publisher.Mono;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Owns the active trigger rules. Condition rules are evaluated against every event published
 * on the bus, schedule rules on every minute tick of the schedule clock.
 */
public interface ILyshraOpenFlowTriggerEngine {

    /**
     * Registers a rule, replacing any rule with the same name.
     *
     * @throws TriggerRuleException when the rule is malformed or its action is unknown
     */
    void register(ITriggerRule rule) throws TriggerRuleException;

    boolean unregister(String name);

    Optional<TriggerRuleStatus> getStatus(String name);

    List<TriggerRuleStatus> getStatuses();

    /** Subscribes to the event bus and starts the schedule clock. */
    Mono<Void> start();

    Mono<Void> stop();

    boolean isRunning();

    /** Registers the stored rules and keeps following the store's change stream until stopped. */
    Mono<Void> followDefinitions(IDefinitionStore definitionStore);

    /** Evaluates condition rules against one event. Returns the number of rules fired. */
    int onEvent(IEvent event);

    /** Evaluates schedule rules for one minute tick. Returns the number of rules fired. */
    int onTick(ZonedDateTime tick);
}
