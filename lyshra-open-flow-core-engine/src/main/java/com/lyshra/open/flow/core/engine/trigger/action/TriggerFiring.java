package com.lyshra.open.flow.core.engine.trigger.action;

import com.lyshra.open.flow.integration.contract.event.IEvent;
import com.lyshra.open.flow.integration.contract.trigger.ITriggerRule;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * One activation of a rule: either an event matched its condition or a schedule tick matched
 * one of its cron expressions.
 */
public record TriggerFiring(ITriggerRule rule, IEvent event, ZonedDateTime scheduledAt) {

    public static TriggerFiring forEvent(ITriggerRule rule, IEvent event) {
        return new TriggerFiring(rule, event, null);
    }

    public static TriggerFiring forTick(ITriggerRule rule, ZonedDateTime scheduledAt) {
        return new TriggerFiring(rule, null, scheduledAt);
    }

    public Optional<IEvent> triggeringEvent() {
        return Optional.ofNullable(event);
    }

    public Optional<ZonedDateTime> tick() {
        return Optional.ofNullable(scheduledAt);
    }
}
