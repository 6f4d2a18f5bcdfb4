package com.lyshra.open.flow.core.engine.definition;

import com.lyshra.open.flow.integration.contract.definition.DefinitionChange;
import com.lyshra.open.flow.integration.contract.definition.IConfigDocument;
import com.lyshra.open.flow.integration.contract.definition.IDefinitionStore;
import com.lyshra.open.flow.integration.contract.trigger.ITriggerRule;
import com.lyshra.open.flow.integration.contract.workflow.IWorkflowDefinition;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowChangeType;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowResourceKind;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Definition store kept in memory. Applying a definition replaces any definition of the same
 * kind and name and is announced on {@link #changes()}.
 */
@Slf4j
public class InMemoryDefinitionStore implements IDefinitionStore {

    private final Map<String, IWorkflowDefinition> workflows = new ConcurrentSkipListMap<>();
    private final Map<String, ITriggerRule> triggerRules = new ConcurrentSkipListMap<>();
    private final Map<String, IConfigDocument> configs = new ConcurrentSkipListMap<>();
    private final Sinks.Many<DefinitionChange> changeSink = Sinks.many().multicast().directBestEffort();

    /** Applies a YAML document of any supported kind. */
    public Object apply(String yaml) {
        Object resource = WorkflowDefinitionSerializer.fromYaml(yaml);
        switch (WorkflowDefinitionSerializer.kindOf(resource)) {
            case WORKFLOW:
                applyWorkflow((IWorkflowDefinition) resource);
                break;
            case TRIGGER_RULE:
                applyTriggerRule((ITriggerRule) resource);
                break;
            default:
                applyConfig((IConfigDocument) resource);
        }
        return resource;
    }

    public void applyWorkflow(IWorkflowDefinition workflow) {
        workflows.put(requireName(workflow.getName()), workflow);
        announce(LyshraOpenFlowResourceKind.WORKFLOW, LyshraOpenFlowChangeType.APPLIED, workflow.getName(), workflow);
    }

    public boolean deleteWorkflow(String name) {
        return delete(workflows, LyshraOpenFlowResourceKind.WORKFLOW, name);
    }

    public void applyTriggerRule(ITriggerRule rule) {
        triggerRules.put(requireName(rule.getName()), rule);
        announce(LyshraOpenFlowResourceKind.TRIGGER_RULE, LyshraOpenFlowChangeType.APPLIED, rule.getName(), rule);
    }

    public boolean deleteTriggerRule(String name) {
        return delete(triggerRules, LyshraOpenFlowResourceKind.TRIGGER_RULE, name);
    }

    public void applyConfig(IConfigDocument config) {
        configs.put(requireName(config.getName()), config);
        announce(LyshraOpenFlowResourceKind.CONFIG, LyshraOpenFlowChangeType.APPLIED, config.getName(), config);
    }

    public boolean deleteConfig(String name) {
        return delete(configs, LyshraOpenFlowResourceKind.CONFIG, name);
    }

    @Override
    public Mono<IWorkflowDefinition> getWorkflow(String name) {
        return Mono.justOrEmpty(workflows.get(name));
    }

    @Override
    public Mono<ITriggerRule> getTriggerRule(String name) {
        return Mono.justOrEmpty(triggerRules.get(name));
    }

    @Override
    public Flux<ITriggerRule> getTriggerRules() {
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(triggerRules.values())));
    }

    /**
     * Documents without a selector come first, then the documents of each selector in the
     * order given, each group sorted by name. Later documents override earlier ones when
     * merged.
     */
    @Override
    public Flux<IConfigDocument> getConfigs(String... selectors) {
        return Flux.defer(() -> {
            List<IConfigDocument> selected = new ArrayList<>();
            configs.values().stream()
                    .filter(config -> config.getSelector() == null || config.getSelector().isBlank())
                    .forEach(selected::add);
            for (String selector : selectors) {
                if (selector == null || selector.isBlank()) {
                    continue;
                }
                configs.values().stream()
                        .filter(config -> selector.equals(config.getSelector()))
                        .filter(config -> !selected.contains(config))
                        .forEach(selected::add);
            }
            return Flux.fromIterable(selected);
        });
    }

    @Override
    public Flux<DefinitionChange> changes() {
        return changeSink.asFlux().onBackpressureBuffer();
    }

    private <T> boolean delete(Map<String, T> definitions, LyshraOpenFlowResourceKind kind, String name) {
        if (definitions.remove(name) == null) {
            return false;
        }
        announce(kind, LyshraOpenFlowChangeType.DELETED, name, null);
        return true;
    }

    private synchronized void announce(LyshraOpenFlowResourceKind kind, LyshraOpenFlowChangeType changeType,
                                       String name, Object resource) {
        log.info("{} {} [{}]", changeType, kind, name);
        changeSink.tryEmitNext(new DefinitionChange(kind, changeType, name, resource));
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("definition name must not be blank");
        }
        return name;
    }
}
