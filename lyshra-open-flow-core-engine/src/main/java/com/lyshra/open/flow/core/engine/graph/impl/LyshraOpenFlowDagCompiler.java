package com.lyshra.open.flow.core.engine.graph.impl;

import com.lyshra.open.flow.core.engine.graph.CompiledGraph;
import com.lyshra.open.flow.core.engine.graph.ILyshraOpenFlowDagCompiler;
import com.lyshra.open.flow.core.engine.validation.LyshraOpenFlowDefinitionValidator;
import com.lyshra.open.flow.integration.contract.workflow.IStageDefinition;
import com.lyshra.open.flow.integration.contract.workflow.IWorkflowDefinition;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStageKind;
import com.lyshra.open.flow.integration.exception.WorkflowValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiles workflow definitions with Kahn's algorithm. Stages left unvisited after the
 * topological sort form the reported cycle.
 */
@Slf4j
public class LyshraOpenFlowDagCompiler implements ILyshraOpenFlowDagCompiler {

    private final LyshraOpenFlowDefinitionValidator validator;

    private LyshraOpenFlowDagCompiler() {
        this(LyshraOpenFlowDefinitionValidator.getInstance());
    }

    public LyshraOpenFlowDagCompiler(LyshraOpenFlowDefinitionValidator validator) {
        this.validator = validator;
    }

    private static final class SingletonHelper {
        private static final ILyshraOpenFlowDagCompiler INSTANCE = new LyshraOpenFlowDagCompiler();
    }

    public static ILyshraOpenFlowDagCompiler getInstance() {
        return SingletonHelper.INSTANCE;
    }

    @Override
    public CompiledGraph compile(IWorkflowDefinition definition) {
        if (definition == null) {
            throw new WorkflowValidationException(null, List.of("definition must not be null"), Set.of());
        }
        String workflowName = definition.getName();

        List<String> constraintViolations = validator.validate(definition);
        if (!constraintViolations.isEmpty()) {
            throw new WorkflowValidationException(workflowName, constraintViolations, Set.of());
        }

        List<String> violations = new ArrayList<>();
        Set<String> offending = new LinkedHashSet<>();

        Map<String, IStageDefinition> nodes = new LinkedHashMap<>();
        for (IStageDefinition stage : definition.getStages()) {
            if (nodes.putIfAbsent(stage.getName(), stage) != null) {
                violations.add("duplicate stage name [" + stage.getName() + "]");
                offending.add(stage.getName());
            }
        }

        Map<String, List<String>> predecessors = new LinkedHashMap<>();
        Map<String, List<String>> successors = new LinkedHashMap<>();
        nodes.keySet().forEach(name -> successors.put(name, new ArrayList<>()));

        for (IStageDefinition stage : nodes.values()) {
            List<String> stagePredecessors = new ArrayList<>(new LinkedHashSet<>(stage.getDependsOn()));
            for (String dependency : stagePredecessors) {
                if (!nodes.containsKey(dependency)) {
                    violations.add("stage [" + stage.getName() + "] depends on unknown stage [" + dependency + "]");
                    offending.add(stage.getName());
                } else {
                    successors.get(dependency).add(stage.getName());
                }
            }
            predecessors.put(stage.getName(), stagePredecessors);
            checkStageShape(stage, stagePredecessors, violations, offending);
        }

        long collectors = nodes.values().stream().filter(IStageDefinition::isCollector).count();
        if (collectors > 1) {
            violations.add("at most one collector stage is allowed, found " + collectors);
            nodes.values().stream().filter(IStageDefinition::isCollector).forEach(s -> offending.add(s.getName()));
        }

        if (!violations.isEmpty()) {
            throw new WorkflowValidationException(workflowName, violations, offending);
        }

        List<List<String>> levels = new ArrayList<>();
        List<String> order = new ArrayList<>();
        Set<String> cycle = topologicalLevels(nodes, predecessors, successors, levels, order);
        if (!cycle.isEmpty()) {
            throw new WorkflowValidationException(workflowName,
                    List.of("dependency cycle between stages " + cycle), cycle);
        }

        log.debug("Compiled workflow [{}]: {} stages in {} levels", workflowName, nodes.size(), levels.size());
        return new CompiledGraph(definition, nodes, predecessors, successors, levels, order);
    }

    private void checkStageShape(IStageDefinition stage, List<String> stagePredecessors,
                                 List<String> violations, Set<String> offending) {
        boolean parameterized = stage.getKind() == LyshraOpenFlowStageKind.PARAMETERIZED;
        boolean hasMapOn = stage.getMapOn() != null && !stage.getMapOn().isBlank();
        if (!parameterized && hasMapOn) {
            violations.add("stage [" + stage.getName() + "] sets map_on but is not parameterized");
            offending.add(stage.getName());
        }
        if (parameterized && !hasMapOn && stagePredecessors.size() != 1) {
            violations.add("parameterized stage [" + stage.getName()
                    + "] needs map_on or exactly one predecessor to iterate over");
            offending.add(stage.getName());
        }
        if (stage.getTimeout() != null && (stage.getTimeout().isNegative() || stage.getTimeout().isZero())) {
            violations.add("stage [" + stage.getName() + "] timeout must be positive");
            offending.add(stage.getName());
        }
    }

    /**
     * Fills {@code levels} and {@code order}; returns the stages that could not be ordered.
     */
    private Set<String> topologicalLevels(Map<String, IStageDefinition> nodes,
                                          Map<String, List<String>> predecessors,
                                          Map<String, List<String>> successors,
                                          List<List<String>> levels,
                                          List<String> order) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        nodes.keySet().forEach(name -> inDegree.put(name, predecessors.get(name).size()));

        List<String> current = inDegree.entrySet().stream()
                .filter(entry -> entry.getValue() == 0)
                .map(Map.Entry::getKey)
                .toList();

        while (!current.isEmpty()) {
            levels.add(current);
            order.addAll(current);
            Set<String> next = new LinkedHashSet<>();
            for (String name : current) {
                for (String successor : successors.get(name)) {
                    int remaining = inDegree.merge(successor, -1, Integer::sum);
                    if (remaining == 0) {
                        next.add(successor);
                    }
                }
            }
            // declaration order within a level
            current = nodes.keySet().stream().filter(next::contains).toList();
        }

        Set<String> unvisited = new LinkedHashSet<>(nodes.keySet());
        order.forEach(unvisited::remove);
        return unvisited;
    }
}
