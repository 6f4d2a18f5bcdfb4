package com.lyshra.open.flow.core.engine.trigger.action;

import com.lyshra.open.flow.integration.contract.trigger.ITriggerAction;
import com.lyshra.open.flow.integration.exception.TriggerRuleException;
import reactor.core.publisher.Mono;

public interface ITriggerActionHandler {

    /** Action target handled, for example {@code run_workflow}. */
    String getTarget();

    /** Checks the action parameters when the rule is registered. */
    default void validate(String ruleName, ITriggerAction action) throws TriggerRuleException {
    }

    Mono<Void> handle(TriggerFiring firing);
}
