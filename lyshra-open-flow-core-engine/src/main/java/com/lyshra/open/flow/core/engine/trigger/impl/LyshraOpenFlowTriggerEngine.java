package com.lyshra.open.flow.core.engine.trigger.impl;

import com.lyshra.open.flow.core.engine.trigger.ILyshraOpenFlowTriggerEngine;
import com.lyshra.open.flow.core.engine.trigger.TriggerRuleStatus;
import com.lyshra.open.flow.core.engine.trigger.action.ITriggerActionHandler;
import com.lyshra.open.flow.core.engine.trigger.action.TriggerFiring;
import com.lyshra.open.flow.core.engine.trigger.condition.ConditionEvaluator;
import com.lyshra.open.flow.core.engine.trigger.schedule.CronExpression;
import com.lyshra.open.flow.core.engine.trigger.schedule.ScheduleClock;
import com.lyshra.open.flow.core.engine.validation.LyshraOpenFlowDefinitionValidator;
import com.lyshra.open.flow.integration.contract.definition.DefinitionChange;
import com.lyshra.open.flow.integration.contract.definition.IDefinitionStore;
import com.lyshra.open.flow.integration.contract.event.IEvent;
import com.lyshra.open.flow.integration.contract.event.IEventBus;
import com.lyshra.open.flow.integration.contract.trigger.ITriggerRule;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowChangeType;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowResourceKind;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowTriggerRuleType;
import com.lyshra.open.flow.integration.exception.RuleEvaluationException;
import com.lyshra.open.flow.integration.exception.TriggerRuleException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

@Slf4j
public class LyshraOpenFlowTriggerEngine implements ILyshraOpenFlowTriggerEngine {

    private final IEventBus eventBus;
    private final ScheduleClock scheduleClock;
    private final ConditionEvaluator conditionEvaluator;
    private final Map<String, ITriggerActionHandler> actionHandlers = new LinkedHashMap<>();
    private final Map<String, RegisteredRule> rules = new ConcurrentSkipListMap<>();
    private volatile Disposable.Composite subscriptions = Disposables.composite();
    private volatile Disposable eventSubscription;

    public LyshraOpenFlowTriggerEngine(IEventBus eventBus, ScheduleClock scheduleClock,
                                       ConditionEvaluator conditionEvaluator,
                                       Collection<? extends ITriggerActionHandler> actionHandlers) {
        this.eventBus = eventBus;
        this.scheduleClock = scheduleClock;
        this.conditionEvaluator = conditionEvaluator;
        for (ITriggerActionHandler handler : actionHandlers) {
            if (this.actionHandlers.putIfAbsent(handler.getTarget(), handler) != null) {
                throw new IllegalArgumentException("Duplicate trigger action handler for [" + handler.getTarget() + "]");
            }
        }
    }

    @Override
    public void register(ITriggerRule rule) {
        String name = rule.getName();
        List<String> violations = LyshraOpenFlowDefinitionValidator.getInstance().validate(rule);
        if (!violations.isEmpty()) {
            throw new TriggerRuleException(String.valueOf(name), String.join("; ", violations));
        }
        if (rule.getAction() == null) {
            throw new TriggerRuleException(name, "rule has no action");
        }
        ITriggerActionHandler handler = actionHandlers.get(rule.getAction().getTarget());
        if (handler == null) {
            throw new TriggerRuleException(name, "unknown action [" + rule.getAction().getTarget()
                    + "], expected one of " + actionHandlers.keySet());
        }
        handler.validate(name, rule.getAction());

        List<CronExpression> schedules = new ArrayList<>();
        if (rule.getType() == LyshraOpenFlowTriggerRuleType.CONDITION) {
            if (rule.getCondition() == null) {
                throw new TriggerRuleException(name, "condition rule has no condition");
            }
        } else {
            if (rule.getSchedules() == null || rule.getSchedules().isEmpty()) {
                throw new TriggerRuleException(name, "schedule rule has no schedule");
            }
            for (String schedule : rule.getSchedules()) {
                try {
                    schedules.add(CronExpression.parse(schedule));
                } catch (IllegalArgumentException e) {
                    throw new TriggerRuleException(name, e.getMessage(), e);
                }
            }
        }
        RegisteredRule previous = rules.put(name, new RegisteredRule(rule, List.copyOf(schedules), handler));
        log.info("{} {} rule [{}] with action [{}]", previous == null ? "Registered" : "Replaced",
                rule.getType(), name, rule.getAction().getTarget());
    }

    @Override
    public boolean unregister(String name) {
        boolean removed = rules.remove(name) != null;
        if (removed) {
            log.info("Unregistered rule [{}]", name);
        }
        return removed;
    }

    @Override
    public Optional<TriggerRuleStatus> getStatus(String name) {
        return Optional.ofNullable(rules.get(name)).map(RegisteredRule::status);
    }

    @Override
    public List<TriggerRuleStatus> getStatuses() {
        return rules.values().stream().map(RegisteredRule::status).toList();
    }

    @Override
    public Mono<Void> start() {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                if (eventSubscription != null) {
                    return;
                }
                eventSubscription = eventBus.subscribe(event -> true)
                        .subscribe(this::onEvent, error -> log.error("Trigger engine lost its event subscription", error));
                scheduleClock.start(this::onTick);
                log.info("Trigger engine started with {} rule(s)", rules.size());
            }
        });
    }

    @Override
    public Mono<Void> stop() {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                if (eventSubscription == null) {
                    return;
                }
                eventSubscription.dispose();
                eventSubscription = null;
                subscriptions.dispose();
                subscriptions = Disposables.composite();
                scheduleClock.stop();
                log.info("Trigger engine stopped");
            }
        });
    }

    @Override
    public boolean isRunning() {
        return eventSubscription != null;
    }

    @Override
    public Mono<Void> followDefinitions(IDefinitionStore definitionStore) {
        return definitionStore.getTriggerRules()
                .doOnNext(this::registerQuietly)
                .then(Mono.fromRunnable(() -> subscriptions.add(definitionStore.changes()
                        .filter(change -> change.kind() == LyshraOpenFlowResourceKind.TRIGGER_RULE)
                        .subscribe(this::applyChange,
                                error -> log.error("Trigger engine lost the definition change stream", error)))));
    }

    @Override
    public int onEvent(IEvent event) {
        int fired = 0;
        for (RegisteredRule registered : rules.values()) {
            ITriggerRule rule = registered.getRule();
            if (rule.getType() != LyshraOpenFlowTriggerRuleType.CONDITION || !registered.isEnabled()) {
                continue;
            }
            boolean matched;
            try {
                matched = conditionEvaluator.test(rule.getCondition(), event);
            } catch (RuleEvaluationException e) {
                registered.disable(e.getMessage());
                log.warn("Disabled rule [{}] after evaluating event [{}]: {}", rule.getName(), event.getId(), e.getMessage());
                continue;
            }
            if (matched) {
                fire(registered, TriggerFiring.forEvent(rule, event));
                fired++;
            }
        }
        return fired;
    }

    @Override
    public int onTick(ZonedDateTime tick) {
        int fired = 0;
        for (RegisteredRule registered : rules.values()) {
            ITriggerRule rule = registered.getRule();
            if (rule.getType() == LyshraOpenFlowTriggerRuleType.SCHEDULE && registered.isEnabled() && registered.isDue(tick)) {
                fire(registered, TriggerFiring.forTick(rule, tick));
                fired++;
            }
        }
        return fired;
    }

    private void fire(RegisteredRule registered, TriggerFiring firing) {
        registered.recordFiring();
        log.info("Rule [{}] fired, running action [{}]", firing.rule().getName(), firing.rule().getAction().getTarget());
        Mono.defer(() -> registered.getHandler().handle(firing))
                .subscribe(null, error -> log.error("Action [{}] of rule [{}] failed",
                        firing.rule().getAction().getTarget(), firing.rule().getName(), error));
    }

    private void applyChange(DefinitionChange change) {
        if (change.changeType() == LyshraOpenFlowChangeType.DELETED) {
            unregister(change.name());
        } else if (change.resource() instanceof ITriggerRule rule) {
            registerQuietly(rule);
        }
    }

    private void registerQuietly(ITriggerRule rule) {
        try {
            register(rule);
        } catch (TriggerRuleException e) {
            log.error("Rejected stored rule [{}]: {}", rule.getName(), e.getMessage());
        }
    }
}
