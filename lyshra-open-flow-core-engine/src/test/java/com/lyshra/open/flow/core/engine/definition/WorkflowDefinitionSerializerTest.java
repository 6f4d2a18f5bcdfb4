package com.lyshra.open.flow.core.engine.definition;

import com.lyshra.open.flow.integration.contract.definition.IConfigDocument;
import com.lyshra.open.flow.integration.contract.trigger.ConditionNode;
import com.lyshra.open.flow.integration.contract.trigger.ITriggerRule;
import com.lyshra.open.flow.integration.contract.workflow.IStageDefinition;
import com.lyshra.open.flow.integration.contract.workflow.IWorkflowDefinition;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowComparisonOperator;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowResourceKind;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStageHandoff;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStageKind;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowTriggerRuleType;
import com.lyshra.open.flow.integration.models.config.ConfigDocument;
import com.lyshra.open.flow.integration.models.trigger.TriggerAction;
import com.lyshra.open.flow.integration.models.trigger.TriggerRule;
import com.lyshra.open.flow.integration.models.workflows.WorkflowDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WorkflowDefinitionSerializer")
class WorkflowDefinitionSerializerTest {

    private static final String TRAIN_YAML = String.join("\n",
            "kind: workflow",
            "metadata:",
            "  name: train_all",
            "  annotations:",
            "    group: models",
            "spec:",
            "  stages:",
            "    - name: load",
            "      target: data.load",
            "    - name: train",
            "      target: models.train",
            "      type: parameterized",
            "      depends_on: [load]",
            "      resources: {cpus: 1, memory_gb: 0.5}",
            "      timeout: PT30S",
            "      handoff: object_store",
            "    - name: report",
            "      target: models.report",
            "      depends_on: [train]",
            "      collector: true",
            "");

    // =========================================================================
    // WORKFLOWS
    // =========================================================================

    @Nested
    @DisplayName("Workflows")
    class WorkflowTests {

        @Test
        @DisplayName("YAML document becomes a workflow definition")
        void readsYaml() {
            // When
            IWorkflowDefinition workflow = WorkflowDefinitionSerializer.workflowFromYaml(TRAIN_YAML);

            // Then
            assertEquals("train_all", workflow.getName());
            assertEquals("models", workflow.getConfigGroup());
            assertEquals(3, workflow.getStages().size());

            IStageDefinition train = workflow.getStages().get(1);
            assertEquals("models.train", train.getTarget());
            assertEquals(LyshraOpenFlowStageKind.PARAMETERIZED, train.getKind());
            assertEquals(List.of("load"), train.getDependsOn());
            assertEquals(Map.of("cpus", 1.0, "memory_gb", 0.5), train.getResources());
            assertEquals(Duration.ofSeconds(30), train.getTimeout());
            assertEquals(LyshraOpenFlowStageHandoff.OBJECT_STORE, train.getHandoff());

            IStageDefinition load = workflow.getStages().get(0);
            assertEquals(LyshraOpenFlowStageKind.NORMAL, load.getKind());
            assertEquals(LyshraOpenFlowStageHandoff.DIRECT, load.getHandoff());
            assertTrue(workflow.getStages().get(2).isCollector());
        }

        @Test
        @DisplayName("workflow survives YAML and JSON round trips")
        void roundTrip() {
            IWorkflowDefinition workflow = WorkflowDefinition.builder()
                    .name("etl")
                    .description("nightly load")
                    .stages(stages -> stages
                            .stage(stage -> stage.name("extract").target("etl.extract").resource("cpus", 2))
                            .stage(stage -> stage.name("split").target("etl.split").parameterized()
                                    .dependsOn("extract").mapOn("rows"))
                            .stage(stage -> stage.name("load").target("etl.load").dependsOn("split")
                                    .timeout(Duration.ofMinutes(5)).collector()))
                    .build();

            assertEquals(workflow, WorkflowDefinitionSerializer.fromYaml(WorkflowDefinitionSerializer.toYaml(workflow)));
            assertEquals(workflow, WorkflowDefinitionSerializer.fromJson(WorkflowDefinitionSerializer.toJson(workflow)));
        }

        @Test
        @DisplayName("unknown stage type is rejected")
        void unknownStageType() {
            String yaml = TRAIN_YAML.replace("type: parameterized", "type: streaming");

            assertThrows(IllegalArgumentException.class, () -> WorkflowDefinitionSerializer.fromYaml(yaml));
        }
    }

    // =========================================================================
    // TRIGGER RULES AND CONFIG
    // =========================================================================

    @Nested
    @DisplayName("Trigger rules and config")
    class OtherKindsTests {

        @Test
        @DisplayName("condition rule document is parsed into a condition tree")
        void conditionRule() {
            String yaml = String.join("\n",
                    "kind: trigger_rule",
                    "metadata:",
                    "  name: retrain-on-failure",
                    "spec:",
                    "  type: condition",
                    "  rule:",
                    "    eq: [{var: data.state}, failed]",
                    "  action:",
                    "    target: run_workflow",
                    "    parameters:",
                    "      workflow_name: retrain",
                    "");

            ITriggerRule rule = WorkflowDefinitionSerializer.triggerRuleFromYaml(yaml);

            assertEquals("retrain-on-failure", rule.getName());
            assertEquals(LyshraOpenFlowTriggerRuleType.CONDITION, rule.getType());
            assertEquals(new ConditionNode.Comparison(LyshraOpenFlowComparisonOperator.EQ,
                    new ConditionNode.Var("data.state"), new ConditionNode.Literal("failed")), rule.getCondition());
            assertEquals("run_workflow", rule.getAction().getTarget());
            assertEquals("retrain", rule.getAction().getParameters().get("workflow_name"));
        }

        @Test
        @DisplayName("schedule rule and config document survive a round trip")
        void roundTrips() {
            TriggerRule schedule = TriggerRule.onSchedule("nightly", List.of("0 2 * * *", "@hourly"),
                    TriggerAction.runWorkflow("report", Map.of("full", true)));
            ConfigDocument config = ConfigDocument.builder()
                    .name("model-defaults")
                    .selector("models")
                    .entry("batch_size", 64)
                    .entry("optimizer", Map.of("name", "adam"))
                    .build();

            assertEquals(schedule, WorkflowDefinitionSerializer.fromYaml(WorkflowDefinitionSerializer.toYaml(schedule)));
            Object parsed = WorkflowDefinitionSerializer.fromYaml(WorkflowDefinitionSerializer.toYaml(config));
            assertEquals(LyshraOpenFlowResourceKind.CONFIG, WorkflowDefinitionSerializer.kindOf(parsed));
            assertEquals(config.getData(), ((IConfigDocument) parsed).getData());
            assertEquals("models", ((IConfigDocument) parsed).getSelector());
        }
    }

    @Test
    @DisplayName("documents without a known kind are rejected")
    void rejectsUnknownKinds() {
        assertThrows(IllegalArgumentException.class,
                () -> WorkflowDefinitionSerializer.fromYaml("metadata: {name: x}"));
        assertThrows(IllegalArgumentException.class,
                () -> WorkflowDefinitionSerializer.fromYaml("kind: pipeline\nmetadata: {name: x}"));
        assertThrows(IllegalArgumentException.class,
                () -> WorkflowDefinitionSerializer.workflowFromYaml("kind: config\nmetadata: {name: x}\nspec: {data: {}}"));
        assertThrows(IllegalArgumentException.class,
                () -> WorkflowDefinitionSerializer.fromJson("{not json"));
        assertThrows(IllegalArgumentException.class, () -> WorkflowDefinitionSerializer.kindOf("text"));
    }
}
