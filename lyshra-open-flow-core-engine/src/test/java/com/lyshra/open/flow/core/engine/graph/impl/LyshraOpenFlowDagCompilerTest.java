package com.lyshra.open.flow.core.engine.graph.impl;

import com.lyshra.open.flow.core.engine.graph.CompiledGraph;
import com.lyshra.open.flow.core.engine.graph.ILyshraOpenFlowDagCompiler;
import com.lyshra.open.flow.integration.exception.WorkflowValidationException;
import com.lyshra.open.flow.integration.models.workflows.WorkflowDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LyshraOpenFlowDagCompiler")
class LyshraOpenFlowDagCompilerTest {

    private final ILyshraOpenFlowDagCompiler compiler = LyshraOpenFlowDagCompiler.getInstance();

    // =========================================================================
    // ORDERING
    // =========================================================================

    @Nested
    @DisplayName("Topological ordering")
    class OrderingTests {

        @Test
        @DisplayName("diamond is split into levels in declaration order")
        void diamondLevels() {
            // Given
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("diamond")
                    .stages(s -> s
                            .stage(st -> st.name("load").target("noop"))
                            .stage(st -> st.name("right").target("noop").dependsOn("load"))
                            .stage(st -> st.name("left").target("noop").dependsOn("load"))
                            .stage(st -> st.name("merge").target("noop").dependsOn("left", "right")))
                    .build();

            // When
            CompiledGraph graph = compiler.compile(definition);

            // Then
            assertEquals(List.of(List.of("load"), List.of("right", "left"), List.of("merge")), graph.getLevels());
            assertEquals(List.of("load", "right", "left", "merge"), graph.getTopologicalOrder());
            assertEquals(List.of("load"), graph.roots());
            assertEquals(List.of("merge"), graph.terminals());
            assertEquals(List.of("left", "right"), graph.predecessorsOf("merge"));
            assertEquals(List.of("right", "left"), graph.successorsOf("load"));
            assertEquals(2, graph.levelOf("merge"));
            assertEquals(4, graph.size());
        }

        @Test
        @DisplayName("every stage comes after all of its dependencies")
        void dependenciesPrecedeDependents() {
            // Given stages declared before their dependencies
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("reversed")
                    .stages(s -> s
                            .stage(st -> st.name("report").target("noop").dependsOn("train", "score"))
                            .stage(st -> st.name("score").target("noop").dependsOn("train"))
                            .stage(st -> st.name("train").target("noop").dependsOn("fetch"))
                            .stage(st -> st.name("fetch").target("noop")))
                    .build();

            // When
            CompiledGraph graph = compiler.compile(definition);

            // Then
            List<String> order = graph.getTopologicalOrder();
            for (String stage : order) {
                for (String dependency : graph.predecessorsOf(stage)) {
                    assertTrue(order.indexOf(dependency) < order.indexOf(stage),
                            dependency + " must precede " + stage);
                }
            }
            assertEquals(List.of("fetch", "train", "score", "report"), order);
        }

        @Test
        @DisplayName("result stage is the collector when declared, otherwise the last terminal")
        void resultStage() {
            WorkflowDefinition withoutCollector = WorkflowDefinition.builder()
                    .name("two-branches")
                    .stages(s -> s
                            .stage(st -> st.name("a").target("noop"))
                            .stage(st -> st.name("b").target("noop")))
                    .build();
            WorkflowDefinition withCollector = WorkflowDefinition.builder()
                    .name("collected")
                    .stages(s -> s
                            .stage(st -> st.name("a").target("noop").collector())
                            .stage(st -> st.name("b").target("noop").dependsOn("a")))
                    .build();

            assertEquals("b", compiler.compile(withoutCollector).resultStage());
            assertEquals("a", compiler.compile(withCollector).resultStage());
        }
    }

    // =========================================================================
    // VALIDATION
    // =========================================================================

    @Nested
    @DisplayName("Validation failures")
    class ValidationTests {

        @Test
        @DisplayName("two-stage cycle names both stages")
        void cycleIsRejected() {
            // Given
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("loop")
                    .stages(s -> s
                            .stage(st -> st.name("A").target("noop").dependsOn("B"))
                            .stage(st -> st.name("B").target("noop").dependsOn("A")))
                    .build();

            // When
            WorkflowValidationException error = assertThrows(WorkflowValidationException.class,
                    () -> compiler.compile(definition));

            // Then
            assertEquals("loop", error.getWorkflowName());
            assertEquals(Set.of("A", "B"), error.getOffendingStages());
            assertTrue(error.getViolations().get(0).startsWith("dependency cycle between stages"));
        }

        @Test
        @DisplayName("stages feeding a cycle are not reported as part of it")
        void cycleBehindRoot() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("tail-loop")
                    .stages(s -> s
                            .stage(st -> st.name("root").target("noop"))
                            .stage(st -> st.name("x").target("noop").dependsOn("root", "z"))
                            .stage(st -> st.name("y").target("noop").dependsOn("x"))
                            .stage(st -> st.name("z").target("noop").dependsOn("y")))
                    .build();

            WorkflowValidationException error = assertThrows(WorkflowValidationException.class,
                    () -> compiler.compile(definition));

            assertEquals(Set.of("x", "y", "z"), error.getOffendingStages());
        }

        @Test
        @DisplayName("self dependency is a cycle")
        void selfDependency() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("self")
                    .stages(s -> s.stage(st -> st.name("only").target("noop").dependsOn("only")))
                    .build();

            WorkflowValidationException error = assertThrows(WorkflowValidationException.class,
                    () -> compiler.compile(definition));

            assertEquals(Set.of("only"), error.getOffendingStages());
        }

        @Test
        @DisplayName("duplicate stage names are rejected")
        void duplicateNames() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("dupes")
                    .stages(s -> s
                            .stage(st -> st.name("same").target("noop"))
                            .stage(st -> st.name("same").target("other")))
                    .build();

            WorkflowValidationException error = assertThrows(WorkflowValidationException.class,
                    () -> compiler.compile(definition));

            assertTrue(error.getViolations().contains("duplicate stage name [same]"));
            assertEquals(Set.of("same"), error.getOffendingStages());
        }

        @Test
        @DisplayName("dependency on an undeclared stage is rejected")
        void danglingDependency() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("dangling")
                    .stages(s -> s.stage(st -> st.name("a").target("noop").dependsOn("ghost")))
                    .build();

            WorkflowValidationException error = assertThrows(WorkflowValidationException.class,
                    () -> compiler.compile(definition));

            assertEquals(List.of("stage [a] depends on unknown stage [ghost]"), error.getViolations());
        }

        @Test
        @DisplayName("map_on on a normal stage is rejected")
        void mapOnRequiresParameterized() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("bad-map-on")
                    .stages(s -> s.stage(st -> st.name("a").target("noop").mapOn("items")))
                    .build();

            WorkflowValidationException error = assertThrows(WorkflowValidationException.class,
                    () -> compiler.compile(definition));

            assertEquals(Set.of("a"), error.getOffendingStages());
        }

        @Test
        @DisplayName("parameterized stage needs a single source to iterate")
        void parameterizedNeedsSource() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("no-source")
                    .stages(s -> s
                            .stage(st -> st.name("a").target("noop"))
                            .stage(st -> st.name("b").target("noop"))
                            .stage(st -> st.name("fan").target("noop").parameterized().dependsOn("a", "b")))
                    .build();

            WorkflowValidationException error = assertThrows(WorkflowValidationException.class,
                    () -> compiler.compile(definition));

            assertEquals(Set.of("fan"), error.getOffendingStages());
        }

        @Test
        @DisplayName("non-positive timeout and second collector are reported together")
        void multipleShapeViolations() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("shape")
                    .stages(s -> s
                            .stage(st -> st.name("a").target("noop").timeout(Duration.ZERO).collector())
                            .stage(st -> st.name("b").target("noop").collector()))
                    .build();

            WorkflowValidationException error = assertThrows(WorkflowValidationException.class,
                    () -> compiler.compile(definition));

            assertEquals(2, error.getViolations().size());
            assertEquals(Set.of("a", "b"), error.getOffendingStages());
        }

        @Test
        @DisplayName("constraint violations are reported before graph checks")
        void beanValidation() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("bad name")
                    .stages(s -> s.stage(st -> st.name("has space").target("")))
                    .build();

            WorkflowValidationException error = assertThrows(WorkflowValidationException.class,
                    () -> compiler.compile(definition));

            assertTrue(error.getViolations().stream().anyMatch(v -> v.contains("name")));
            assertTrue(error.getViolations().stream().anyMatch(v -> v.contains("target")));
        }
    }
}
