package com.lyshra.open.flow.core.engine.definition;

import com.lyshra.open.flow.integration.contract.definition.DefinitionChange;
import com.lyshra.open.flow.integration.contract.definition.IConfigDocument;
import com.lyshra.open.flow.integration.contract.workflow.IWorkflowDefinition;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowChangeType;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowResourceKind;
import com.lyshra.open.flow.integration.models.config.ConfigDocument;
import com.lyshra.open.flow.integration.models.trigger.TriggerAction;
import com.lyshra.open.flow.integration.models.trigger.TriggerRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryDefinitionStore")
class InMemoryDefinitionStoreTest {

    private final InMemoryDefinitionStore store = new InMemoryDefinitionStore();

    private static ConfigDocument config(String name, String selector) {
        return ConfigDocument.builder().name(name).selector(selector).entry("source", name).build();
    }

    @Test
    @DisplayName("YAML documents of each kind are stored under their name")
    void applyYaml() {
        // Given
        String workflow = "kind: workflow\nmetadata: {name: etl}\nspec:\n  stages:\n    - {name: load, target: etl.load}\n";
        String rule = "kind: trigger_rule\nmetadata: {name: nightly}\nspec:\n  type: schedule\n  rule: ['@daily']\n"
                + "  action: {target: run_workflow, parameters: {workflow_name: etl}}\n";
        String config = "kind: config\nmetadata: {name: etl-defaults}\nspec: {selector: etl, data: {batch: 10}}\n";

        // When
        store.apply(workflow);
        store.apply(rule);
        store.apply(config);

        // Then
        StepVerifier.create(store.getWorkflow("etl").map(IWorkflowDefinition::getName))
                .expectNext("etl")
                .verifyComplete();
        StepVerifier.create(store.getTriggerRule("nightly").map(r -> r.getSchedules().get(0)))
                .expectNext("@daily")
                .verifyComplete();
        StepVerifier.create(store.getConfigs("etl").map(c -> c.getData().get("batch")))
                .expectNext(10)
                .verifyComplete();
        StepVerifier.create(store.getWorkflow("missing")).verifyComplete();
    }

    @Test
    @DisplayName("configs without a selector come first, then each selector in order")
    void configOrder() {
        store.applyConfig(config("workflow-b", "etl"));
        store.applyConfig(config("group-a", "data"));
        store.applyConfig(config("global", null));
        store.applyConfig(config("unrelated", "other"));
        store.applyConfig(config("workflow-a", "etl"));

        List<String> names = store.getConfigs(null, "data", "etl").map(IConfigDocument::getName).collectList().block();

        assertEquals(List.of("global", "group-a", "workflow-a", "workflow-b"), names);
    }

    @Test
    @DisplayName("apply and delete are announced as changes")
    void changes() {
        // Given
        List<DefinitionChange> changes = new CopyOnWriteArrayList<>();
        Disposable subscription = store.changes().subscribe(changes::add);

        // When
        store.applyTriggerRule(TriggerRule.onSchedule("nightly", List.of("@daily"), TriggerAction.logEvent("info")));
        boolean deleted = store.deleteTriggerRule("nightly");
        boolean deletedAgain = store.deleteTriggerRule("nightly");
        subscription.dispose();

        // Then
        assertTrue(deleted);
        assertFalse(deletedAgain);
        assertEquals(2, changes.size());
        assertEquals(LyshraOpenFlowResourceKind.TRIGGER_RULE, changes.get(0).kind());
        assertEquals(LyshraOpenFlowChangeType.APPLIED, changes.get(0).changeType());
        assertNotNull(changes.get(0).resource());
        assertEquals(LyshraOpenFlowChangeType.DELETED, changes.get(1).changeType());
        assertEquals("nightly", changes.get(1).name());
        assertNull(changes.get(1).resource());
    }

    @Test
    @DisplayName("nameless definitions are rejected")
    void requiresName() {
        assertThrows(IllegalArgumentException.class, () -> store.applyConfig(config(" ", null)));
    }
}
