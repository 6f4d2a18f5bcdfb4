package com.lyshra.open.flow.core.engine.coordinator.impl;

import com.lyshra.open.flow.core.engine.config.LyshraOpenFlowConfig;
import com.lyshra.open.flow.core.engine.context.RunContextHolder;
import com.lyshra.open.flow.core.engine.coordinator.RunHandle;
import com.lyshra.open.flow.core.engine.definition.InMemoryDefinitionStore;
import com.lyshra.open.flow.core.engine.event.InMemoryEventBus;
import com.lyshra.open.flow.core.engine.executor.LocalStageExecutor;
import com.lyshra.open.flow.core.engine.graph.impl.LyshraOpenFlowDagCompiler;
import com.lyshra.open.flow.core.engine.resolver.RegistryTargetResolver;
import com.lyshra.open.flow.core.engine.store.LyshraOpenFlowObjectStore;
import com.lyshra.open.flow.core.engine.store.NamespaceBoundObjectStore;
import com.lyshra.open.flow.core.engine.store.artifact.FileSystemArtifactRepository;
import com.lyshra.open.flow.integration.constant.LyshraOpenFlowConstants;
import com.lyshra.open.flow.integration.contract.event.IEvent;
import com.lyshra.open.flow.integration.contract.store.IObjectStore;
import com.lyshra.open.flow.integration.contract.workflow.IRunContext;
import com.lyshra.open.flow.integration.contract.workflow.IWorkflowRun;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowRunSource;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowRunState;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStageHandoff;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStoreStrategy;
import com.lyshra.open.flow.integration.exception.StageExecutionException;
import com.lyshra.open.flow.integration.exception.StageTimeoutException;
import com.lyshra.open.flow.integration.exception.TargetResolutionException;
import com.lyshra.open.flow.integration.exception.WorkflowNotFoundException;
import com.lyshra.open.flow.integration.exception.WorkflowRunNotFoundException;
import com.lyshra.open.flow.integration.exception.WorkflowTimeoutException;
import com.lyshra.open.flow.integration.exception.WorkflowValidationException;
import com.lyshra.open.flow.integration.models.config.ConfigDocument;
import com.lyshra.open.flow.integration.models.workflowrun.RunFailure;
import com.lyshra.open.flow.integration.models.workflows.WorkflowDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LyshraOpenFlowWorkflowCoordinator")
class LyshraOpenFlowWorkflowCoordinatorTest {

    private static final Duration AWAIT = Duration.ofSeconds(10);

    @TempDir
    Path artifactDir;

    private LocalStageExecutor executor;
    private RegistryTargetResolver targets;
    private InMemoryDefinitionStore definitionStore;
    private InMemoryEventBus eventBus;
    private LyshraOpenFlowObjectStore objectStore;
    private LyshraOpenFlowWorkflowCoordinator coordinator;

    private final List<String> invokedStages = new CopyOnWriteArrayList<>();
    private final AtomicInteger fanOutCalls = new AtomicInteger();

    @BeforeEach
    void setUp() {
        executor = new LocalStageExecutor(8);
        executor.start().block();
        targets = new RegistryTargetResolver();
        definitionStore = new InMemoryDefinitionStore();
        eventBus = new InMemoryEventBus(Schedulers.immediate());

        targets.register("record", (context, args) -> {
            invokedStages.add(context.getStageName());
            return context.getStageName();
        });
        targets.register("identity", (context, args) -> args.get(0));
        targets.register("range", (context, args) -> List.of(1, 2, 3));
        targets.register("times-ten", (context, args) -> {
            fanOutCalls.incrementAndGet();
            int value = (Integer) args.get(0);
            // larger elements finish first
            Thread.sleep((4L - value) * 60);
            return value * 10;
        });
        targets.register("explode-on-two", (context, args) -> {
            if (Integer.valueOf(2).equals(args.get(0))) {
                throw new IllegalStateException("element two is broken");
            }
            return args.get(0);
        });
        targets.register("sum", (context, args) -> {
            @SuppressWarnings("unchecked")
            List<Integer> values = (List<Integer>) args.get(0);
            return values.stream().mapToInt(Integer::intValue).sum();
        });
        targets.register("sleepy", (context, args) -> {
            Thread.sleep(1_500);
            return "woke up";
        });
        targets.register("nothing", (context, args) -> null);
        targets.register("config", (context, args) -> context.getConfig());
        targets.register("whoami", (context, args) -> RunContextHolder.current().map(IRunContext::getStageName));

        coordinator = coordinator(LyshraOpenFlowConfig.defaultConfig());
    }

    @AfterEach
    void tearDown() {
        executor.close().block();
    }

    private LyshraOpenFlowWorkflowCoordinator coordinator(LyshraOpenFlowConfig config) {
        return new LyshraOpenFlowWorkflowCoordinator(config, LyshraOpenFlowDagCompiler.getInstance(), targets,
                executor, stageExecutor -> {
                    objectStore = LyshraOpenFlowObjectStore.create(stageExecutor::getClusterMemory,
                            new FileSystemArtifactRepository(artifactDir), LyshraOpenFlowStoreStrategy.FALLBACK,
                            config.getDefaultNamespace());
                    return objectStore;
                }, eventBus, definitionStore);
    }

    private static WorkflowDefinition singleStage(String name, String target) {
        return WorkflowDefinition.builder()
                .name(name)
                .stages(s -> s.stage(st -> st.name("only").target(target)))
                .build();
    }

    // =========================================================================
    // SCHEDULING
    // =========================================================================

    @Nested
    @DisplayName("Scheduling")
    class SchedulingTests {

        @Test
        @DisplayName("stages run after their dependencies and the terminal value is the result")
        void diamondRunsInDependencyOrder() {
            // Given
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("diamond")
                    .stages(s -> s
                            .stage(st -> st.name("load").target("record"))
                            .stage(st -> st.name("left").target("record").dependsOn("load"))
                            .stage(st -> st.name("right").target("record").dependsOn("load"))
                            .stage(st -> st.name("merge").target("record").dependsOn("left", "right")))
                    .build();

            // When
            IWorkflowRun run = coordinator.submit(definition, Map.of(), null).block(AWAIT);

            // Then
            assertEquals(LyshraOpenFlowRunState.COMPLETED, run.getState());
            assertEquals("merge", run.getResult());
            assertEquals(LyshraOpenFlowConstants.DEFAULT_NAMESPACE, run.getNamespace());
            assertEquals(LyshraOpenFlowRunSource.API, run.getSource());
            assertEquals(4, invokedStages.size());
            assertEquals("load", invokedStages.get(0));
            assertEquals("merge", invokedStages.get(3));
            assertNotNull(run.getFinishedAt());
        }

        @Test
        @DisplayName("root stage receives the run input and its successor the root's value")
        void inputFlowsThroughChain() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("echo")
                    .stages(s -> s
                            .stage(st -> st.name("first").target("identity"))
                            .stage(st -> st.name("second").target("identity").dependsOn("first")))
                    .build();

            IWorkflowRun run = coordinator.submit(definition, Map.of("k", "v"), "team-a").block(AWAIT);

            assertEquals(Map.of("k", "v"), run.getResult());
            assertEquals("team-a", run.getNamespace());
        }

        @Test
        @DisplayName("stage with several predecessors receives their values in declaration order")
        void multiplePredecessors() {
            targets.register("one", (context, args) -> 1);
            targets.register("two", (context, args) -> 2);
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("join")
                    .stages(s -> s
                            .stage(st -> st.name("b").target("two"))
                            .stage(st -> st.name("a").target("one"))
                            .stage(st -> st.name("join").target("sum").dependsOn("b", "a")))
                    .build();

            IWorkflowRun run = coordinator.submit(definition, Map.of(), null).block(AWAIT);

            assertEquals(3, run.getResult());
        }

        @Test
        @DisplayName("null stage value is passed on and becomes the result")
        void nullValue() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("nulls")
                    .stages(s -> s
                            .stage(st -> st.name("blank").target("nothing"))
                            .stage(st -> st.name("echo").target("identity").dependsOn("blank")))
                    .build();

            IWorkflowRun run = coordinator.submit(definition, Map.of(), null).block(AWAIT);

            assertEquals(LyshraOpenFlowRunState.COMPLETED, run.getState());
            assertNull(run.getResult());
        }

        @Test
        @DisplayName("collector value wins over the terminal stage")
        void collectorResult() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("collected")
                    .stages(s -> s
                            .stage(st -> st.name("model").target("record").collector())
                            .stage(st -> st.name("cleanup").target("record").dependsOn("model")))
                    .build();

            IWorkflowRun run = coordinator.submit(definition, Map.of(), null).block(AWAIT);

            assertEquals("model", run.getResult());
            assertTrue(invokedStages.contains("cleanup"));
        }

        @Test
        @DisplayName("stage can read its own context from the reactive context")
        void runContextHolder() {
            IWorkflowRun run = coordinator.submit(singleStage("who", "whoami"), Map.of(), null).block(AWAIT);

            assertEquals("only", run.getResult());
        }

        @Test
        @DisplayName("config documents are merged global, group, then workflow")
        void configSnapshot() {
            definitionStore.applyConfig(ConfigDocument.builder().name("global").selector("")
                    .entry("region", "eu").entry("retries", 1).build());
            definitionStore.applyConfig(ConfigDocument.builder().name("group").selector("training")
                    .entry("retries", 2).build());
            definitionStore.applyConfig(ConfigDocument.builder().name("own").selector("configured")
                    .entry("retries", 3).entry("owner", "ml").build());
            definitionStore.applyConfig(ConfigDocument.builder().name("other").selector("unrelated")
                    .entry("owner", "nobody").build());
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("configured")
                    .configGroup("training")
                    .stages(s -> s.stage(st -> st.name("read").target("config")))
                    .build();

            IWorkflowRun run = coordinator.submit(definition, Map.of(), null).block(AWAIT);

            assertEquals(Map.of("region", "eu", "retries", 3, "owner", "ml"), run.getResult());
        }
    }

    // =========================================================================
    // FAN-OUT
    // =========================================================================

    @Nested
    @DisplayName("Parameterized stages")
    class FanOutTests {

        @Test
        @DisplayName("results keep input order although later elements finish first")
        void orderPreserved() {
            // Given
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("fan-out")
                    .stages(s -> s.stage(st -> st.name("scale").target("times-ten").parameterized().mapOn("items")))
                    .build();

            // When
            IWorkflowRun run = coordinator.submit(definition, Map.of("items", List.of(1, 2, 3)), null).block(AWAIT);

            // Then
            assertEquals(LyshraOpenFlowRunState.COMPLETED, run.getState());
            assertEquals(List.of(10, 20, 30), run.getResult());
        }

        @Test
        @DisplayName("predecessor list is iterated and funneled into the next stage")
        void fanOutThenFunnel() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("fan-funnel")
                    .stages(s -> s
                            .stage(st -> st.name("generate").target("range"))
                            .stage(st -> st.name("scale").target("times-ten").parameterized().dependsOn("generate"))
                            .stage(st -> st.name("total").target("sum").dependsOn("scale")))
                    .build();

            IWorkflowRun run = coordinator.submit(definition, Map.of(), null).block(AWAIT);

            assertEquals(60, run.getResult());
            assertEquals(3, fanOutCalls.get());
        }

        @Test
        @DisplayName("empty iterable yields an empty list without invoking the target")
        void emptyFanOut() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("empty")
                    .stages(s -> s.stage(st -> st.name("scale").target("times-ten").parameterized().mapOn("items")))
                    .build();

            IWorkflowRun run = coordinator.submit(definition, Map.of("items", List.of()), null).block(AWAIT);

            assertEquals(List.of(), run.getResult());
            assertEquals(0, fanOutCalls.get());
        }

        @Test
        @DisplayName("failing element fails the run and its successor never runs")
        void failFast() {
            // Given
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("fragile")
                    .stages(s -> s
                            .stage(st -> st.name("scale").target("explode-on-two").parameterized().mapOn("items"))
                            .stage(st -> st.name("funnel").target("record").dependsOn("scale")))
                    .build();

            // When
            IWorkflowRun run = coordinator.submit(definition, Map.of("items", List.of(1, 2, 3)), null).block(AWAIT);

            // Then
            assertEquals(LyshraOpenFlowRunState.FAILED, run.getState());
            StageExecutionException cause = assertInstanceOf(StageExecutionException.class,
                    run.getFailureCause().orElseThrow());
            assertEquals("scale", cause.getStageName());
            assertEquals(1, cause.getElementIndex());
            assertInstanceOf(IllegalStateException.class, cause.getCause());
            RunFailure failure = assertInstanceOf(RunFailure.class, run.getResult());
            assertEquals("scale", failure.getStageName());
            assertFalse(invokedStages.contains("funnel"));
        }

        @Test
        @DisplayName("non-iterable source fails the stage")
        void notIterable() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("scalar")
                    .stages(s -> s.stage(st -> st.name("scale").target("times-ten").parameterized().mapOn("items")))
                    .build();

            IWorkflowRun run = coordinator.submit(definition, Map.of("items", 7), null).block(AWAIT);

            assertEquals(LyshraOpenFlowRunState.FAILED, run.getState());
            assertInstanceOf(StageExecutionException.class, run.getFailureCause().orElseThrow());
        }
    }

    // =========================================================================
    // FAILURES, CANCELLATION, TIMEOUTS
    // =========================================================================

    @Nested
    @DisplayName("Termination")
    class TerminationTests {

        @Test
        @DisplayName("unknown target is rejected before any run exists")
        void unresolvedTarget() {
            WorkflowDefinition definition = singleStage("ghost", "does-not-exist");

            assertThrows(TargetResolutionException.class, () -> coordinator.submit(definition, Map.of(), null));
            assertTrue(coordinator.listRuns(null, 10).isEmpty());
        }

        @Test
        @DisplayName("cyclic definition is rejected before any run exists")
        void cyclicDefinition() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("loop")
                    .stages(s -> s
                            .stage(st -> st.name("A").target("record").dependsOn("B"))
                            .stage(st -> st.name("B").target("record").dependsOn("A")))
                    .build();

            assertThrows(WorkflowValidationException.class, () -> coordinator.submit(definition, Map.of(), null));
            assertTrue(invokedStages.isEmpty());
        }

        @Test
        @DisplayName("cancel moves a running run to cancelled exactly once")
        void cancel() {
            // Given
            RunHandle handle = coordinator.submit(singleStage("slow", "sleepy"), Map.of(), null);

            // When
            boolean cancelled = coordinator.cancel(handle.getRunUid());

            // Then
            assertTrue(cancelled);
            IWorkflowRun run = handle.block(AWAIT);
            assertEquals(LyshraOpenFlowRunState.CANCELLED, run.getState());
            assertFalse(handle.cancel());
            assertEquals(LyshraOpenFlowRunState.CANCELLED, coordinator.getRun(handle.getRunUid()).getState());
        }

        @Test
        @DisplayName("stage exceeding its timeout fails the run")
        void stageTimeout() {
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("slow-stage")
                    .stages(s -> s.stage(st -> st.name("nap").target("sleepy").timeout(Duration.ofMillis(100))))
                    .build();

            IWorkflowRun run = coordinator.submit(definition, Map.of(), null).block(AWAIT);

            assertEquals(LyshraOpenFlowRunState.FAILED, run.getState());
            StageTimeoutException cause = assertInstanceOf(StageTimeoutException.class,
                    run.getFailureCause().orElseThrow());
            assertEquals("nap", cause.getStageName());
            assertEquals(Duration.ofMillis(100), cause.getTimeout());
        }

        @Test
        @DisplayName("stage timeout stops at the stage value and does not cover a slow handoff write")
        void slowHandoffWithinStageTimeout() {
            // Given
            LyshraOpenFlowConfig config = LyshraOpenFlowConfig.defaultConfig();
            LyshraOpenFlowWorkflowCoordinator slowStore = new LyshraOpenFlowWorkflowCoordinator(config,
                    LyshraOpenFlowDagCompiler.getInstance(), targets, executor, stageExecutor -> {
                        IObjectStore store = LyshraOpenFlowObjectStore.create(stageExecutor::getClusterMemory,
                                new FileSystemArtifactRepository(artifactDir), LyshraOpenFlowStoreStrategy.FALLBACK,
                                config.getDefaultNamespace());
                        return new NamespaceBoundObjectStore(store, config.getDefaultNamespace()) {
                            @Override
                            public Mono<Void> put(String key, Object value, LyshraOpenFlowStoreStrategy strategy,
                                                  String namespace) {
                                return Mono.delay(Duration.ofMillis(400))
                                        .then(super.put(key, value, strategy, namespace));
                            }
                        };
                    }, eventBus, definitionStore);
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("slow-handoff")
                    .stages(s -> s
                            .stage(st -> st.name("produce").target("range").timeout(Duration.ofMillis(100))
                                    .handoff(LyshraOpenFlowStageHandoff.OBJECT_STORE))
                            .stage(st -> st.name("consume").target("identity").dependsOn("produce")))
                    .build();

            // When
            IWorkflowRun run = slowStore.submit(definition, Map.of(), null).block(AWAIT);

            // Then
            assertEquals(LyshraOpenFlowRunState.COMPLETED, run.getState());
            assertEquals(List.of(1, 2, 3), run.getResult());
        }

        @Test
        @DisplayName("run exceeding the run timeout fails")
        void runTimeout() {
            LyshraOpenFlowWorkflowCoordinator bounded = coordinator(LyshraOpenFlowConfig.builder()
                    .runTimeout(Duration.ofMillis(100))
                    .build());

            IWorkflowRun run = bounded.submit(singleStage("slow-run", "sleepy"), Map.of(), null).block(AWAIT);

            assertEquals(LyshraOpenFlowRunState.FAILED, run.getState());
            assertInstanceOf(WorkflowTimeoutException.class, run.getFailureCause().orElseThrow());
        }

        @Test
        @DisplayName("unknown run uid is reported")
        void unknownRun() {
            assertThrows(WorkflowRunNotFoundException.class, () -> coordinator.getRun("missing"));
            assertThrows(WorkflowRunNotFoundException.class, () -> coordinator.cancel("missing"));
            assertTrue(coordinator.findHandle("missing").isEmpty());
        }
    }

    // =========================================================================
    // EVENTS, HANDOFF, REGISTRY
    // =========================================================================

    @Nested
    @DisplayName("Run bookkeeping")
    class BookkeepingTests {

        @Test
        @DisplayName("started and finished events are published before the run can be awaited")
        void lifecycleEvents() {
            // Given
            List<IEvent> events = new CopyOnWriteArrayList<>();
            Disposable subscription = eventBus
                    .subscribe(event -> LyshraOpenFlowConstants.RUN_EVENT_CHANNEL.equals(event.getChannel()))
                    .subscribe(events::add);

            // When
            RunHandle handle = coordinator.submit(singleStage("observed", "record"), Map.of(), null);
            handle.block(AWAIT);
            subscription.dispose();

            // Then
            assertEquals(2, events.size());
            assertEquals(LyshraOpenFlowConstants.EVENT_TYPE_WORKFLOW_STARTED, events.get(0).getType());
            IEvent finished = events.get(1);
            assertEquals(LyshraOpenFlowConstants.EVENT_TYPE_WORKFLOW_FINISHED, finished.getType());
            assertEquals(handle.getRunUid(), finished.getCorrelationId());
            assertEquals("completed", finished.getData().get("state"));
            assertEquals("observed", finished.getData().get("workflow"));
            assertEquals("only", finished.getData().get("result"));
        }

        @Test
        @DisplayName("failed run publishes its failure description")
        void failureEvent() {
            List<IEvent> events = new CopyOnWriteArrayList<>();
            Disposable subscription = eventBus
                    .subscribe(event -> LyshraOpenFlowConstants.EVENT_TYPE_WORKFLOW_FINISHED.equals(event.getType()))
                    .subscribe(events::add);
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("breaks")
                    .stages(s -> s.stage(st -> st.name("scale").target("explode-on-two").parameterized().mapOn("items")))
                    .build();

            coordinator.submit(definition, Map.of("items", List.of(2)), null).block(AWAIT);
            subscription.dispose();

            assertEquals(1, events.size());
            assertEquals("failed", events.get(0).getData().get("state"));
            @SuppressWarnings("unchecked")
            Map<String, Object> result = (Map<String, Object>) events.get(0).getData().get("result");
            assertEquals("scale", result.get("stage"));
            assertEquals(0, result.get("element_index"));
        }

        @Test
        @DisplayName("object store handoff passes the value through the store")
        void objectStoreHandoff() {
            // Given
            targets.register("features", (context, args) -> Map.of("rows", 3, "cols", List.of("a", "b")));
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("handoff")
                    .stages(s -> s
                            .stage(st -> st.name("produce").target("features")
                                    .handoff(LyshraOpenFlowStageHandoff.OBJECT_STORE))
                            .stage(st -> st.name("consume").target("identity").dependsOn("produce")))
                    .build();

            // When
            RunHandle handle = coordinator.submit(definition, Map.of(), null);
            IWorkflowRun run = handle.block(AWAIT);

            // Then
            assertEquals(Map.of("rows", 3, "cols", List.of("a", "b")), run.getResult());
            StepVerifier.create(objectStore.exists(handle.getRunUid() + "-produce", null, null))
                    .expectNext(true)
                    .verifyComplete();
        }

        @Test
        @DisplayName("stored workflows are submitted by name")
        void submitByName() {
            definitionStore.applyWorkflow(singleStage("stored", "record"));

            StepVerifier.create(coordinator.submitByName("stored", Map.of(), null, LyshraOpenFlowRunSource.TRIGGER)
                            .flatMap(RunHandle::await))
                    .assertNext(run -> {
                        assertEquals(LyshraOpenFlowRunState.COMPLETED, run.getState());
                        assertEquals(LyshraOpenFlowRunSource.TRIGGER, run.getSource());
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("submitting an unknown workflow name errors")
        void submitByUnknownName() {
            StepVerifier.create(coordinator.submit("unknown", Map.of(), null, LyshraOpenFlowRunSource.API))
                    .expectError(WorkflowNotFoundException.class)
                    .verify(AWAIT);
        }

        @Test
        @DisplayName("runs are listed most recent first and purged once retention expires")
        void listAndPurge() throws InterruptedException {
            // Given
            LyshraOpenFlowWorkflowCoordinator shortRetention = coordinator(LyshraOpenFlowConfig.builder()
                    .runRetention(Duration.ZERO)
                    .build());
            RunHandle first = shortRetention.submit(singleStage("listed", "record"), Map.of(), null);
            first.block(AWAIT);
            Thread.sleep(5);
            RunHandle second = shortRetention.submit(singleStage("listed", "record"), Map.of(), null);
            second.block(AWAIT);
            shortRetention.submit(singleStage("other", "record"), Map.of(), null).block(AWAIT);

            // When
            List<IWorkflowRun> listed = shortRetention.listRuns("listed", 10);

            // Then
            assertEquals(List.of(second.getRunUid(), first.getRunUid()),
                    listed.stream().map(IWorkflowRun::getUid).toList());
            assertEquals(1, shortRetention.listRuns(null, 1).size());

            Thread.sleep(5);
            assertEquals(3, shortRetention.purgeFinishedRuns());
            assertTrue(shortRetention.listRuns(null, 10).isEmpty());
        }
    }

    // =========================================================================
    // RUN ISOLATION
    // =========================================================================

    @Nested
    @DisplayName("Run isolation")
    class IsolationTests {

        @Test
        @DisplayName("concurrent runs each see only their own context in every fan-out element")
        void contextDoesNotLeakAcrossRuns() {
            // Given
            targets.register("stamp", (context, args) -> {
                Thread.sleep(30);
                return RunContextHolder.current().map(reactive -> List.of(
                        context.getRun().getUid(),
                        context.getNamespace(),
                        reactive.getRun().getUid(),
                        reactive.getNamespace(),
                        reactive.getElementIndex().orElse(-1)));
            });
            WorkflowDefinition definition = WorkflowDefinition.builder()
                    .name("stamped")
                    .stages(s -> s.stage(st -> st.name("stamp").target("stamp").parameterized().mapOn("items")))
                    .build();
            Map<String, Object> input = Map.of("items", List.of("a", "b", "c", "d"));

            // When
            RunHandle teamA = coordinator.submit(definition, input, "team-a");
            RunHandle teamB = coordinator.submit(definition, input, "team-b");
            IWorkflowRun runA = teamA.block(AWAIT);
            IWorkflowRun runB = teamB.block(AWAIT);

            // Then
            assertStampedBy(runA, teamA.getRunUid(), "team-a");
            assertStampedBy(runB, teamB.getRunUid(), "team-b");
        }

        private void assertStampedBy(IWorkflowRun run, String runUid, String namespace) {
            assertEquals(LyshraOpenFlowRunState.COMPLETED, run.getState());
            @SuppressWarnings("unchecked")
            List<List<Object>> stamps = (List<List<Object>>) run.getResult();
            assertEquals(4, stamps.size());
            for (int i = 0; i < stamps.size(); i++) {
                assertEquals(List.of(runUid, namespace, runUid, namespace, i), stamps.get(i));
            }
        }

        @Test
        @DisplayName("stage writes without a namespace land in the run's namespace")
        void objectStoreDefaultsToRunNamespace() {
            // Given
            targets.register("save-model", (context, args) ->
                    context.getObjectStore().put("model", "weights", null, null).thenReturn("saved"));

            // When
            IWorkflowRun run = coordinator.submit(singleStage("saver", "save-model"), Map.of(), "team-a").block(AWAIT);

            // Then
            assertEquals(LyshraOpenFlowRunState.COMPLETED, run.getState());
            StepVerifier.create(objectStore.get("model", null, "team-a"))
                    .expectNext("weights")
                    .verifyComplete();
            StepVerifier.create(objectStore.exists("model", null, LyshraOpenFlowConstants.DEFAULT_NAMESPACE))
                    .expectNext(false)
                    .verifyComplete();
        }

        @Test
        @DisplayName("an explicit namespace still wins over the run's namespace")
        void explicitNamespaceWins() {
            targets.register("save-shared", (context, args) ->
                    context.getObjectStore().put("shared", 1, null, "common").thenReturn("saved"));

            coordinator.submit(singleStage("sharer", "save-shared"), Map.of(), "team-a").block(AWAIT);

            StepVerifier.create(objectStore.exists("shared", null, "common"))
                    .expectNext(true)
                    .verifyComplete();
            StepVerifier.create(objectStore.exists("shared", null, "team-a"))
                    .expectNext(false)
                    .verifyComplete();
        }
    }
}
