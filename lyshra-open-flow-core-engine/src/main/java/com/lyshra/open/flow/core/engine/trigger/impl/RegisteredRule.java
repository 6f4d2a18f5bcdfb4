package com.lyshra.open.flow.core.engine.trigger.impl;

import com.lyshra.open.flow.core.engine.trigger.TriggerRuleStatus;
import com.lyshra.open.flow.core.engine.trigger.action.ITriggerActionHandler;
import com.lyshra.open.flow.core.engine.trigger.schedule.CronExpression;
import com.lyshra.open.flow.integration.contract.trigger.ITriggerRule;
import lombok.Getter;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

@Getter
class RegisteredRule {

    private final ITriggerRule rule;
    private final List<CronExpression> schedules;
    private final ITriggerActionHandler handler;
    private final AtomicLong fireCount = new AtomicLong();
    private volatile Instant lastFiredAt;
    private volatile String disabledReason;

    RegisteredRule(ITriggerRule rule, List<CronExpression> schedules, ITriggerActionHandler handler) {
        this.rule = rule;
        this.schedules = schedules;
        this.handler = handler;
    }

    boolean isEnabled() {
        return disabledReason == null;
    }

    void disable(String reason) {
        this.disabledReason = reason;
    }

    boolean isDue(ZonedDateTime tick) {
        return schedules.stream().anyMatch(schedule -> schedule.matches(tick));
    }

    void recordFiring() {
        fireCount.incrementAndGet();
        lastFiredAt = Instant.now();
    }

    TriggerRuleStatus status() {
        return TriggerRuleStatus.builder()
                .name(rule.getName())
                .type(rule.getType())
                .enabled(isEnabled())
                .fireCount(fireCount.get())
                .lastFiredAt(lastFiredAt)
                .disabledReason(disabledReason)
                .build();
    }
}
