package com.lyshra.open.flow.core.engine.graph;

import com.lyshra.open.flow.integration.contract.workflow.IStageDefinition;
import com.lyshra.open.flow.integration.contract.workflow.IWorkflowDefinition;
import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executable form of a workflow. Built per run and discarded with it.
 *
 * <p>{@code levels} partitions the stages into waves whose dependencies are all satisfied by
 * earlier waves; stages in the same level can run concurrently.</p>
 */
@Getter
public final class CompiledGraph {

    private final IWorkflowDefinition definition;
    private final Map<String, IStageDefinition> nodes;
    private final Map<String, List<String>> predecessors;
    private final Map<String, List<String>> successors;
    private final List<List<String>> levels;
    private final List<String> topologicalOrder;

    public CompiledGraph(IWorkflowDefinition definition,
                         Map<String, IStageDefinition> nodes,
                         Map<String, List<String>> predecessors,
                         Map<String, List<String>> successors,
                         List<List<String>> levels,
                         List<String> topologicalOrder) {
        this.definition = definition;
        this.nodes = Collections.unmodifiableMap(nodes);
        this.predecessors = Collections.unmodifiableMap(predecessors);
        this.successors = Collections.unmodifiableMap(successors);
        this.levels = Collections.unmodifiableList(levels);
        this.topologicalOrder = Collections.unmodifiableList(topologicalOrder);
    }

    public IStageDefinition stage(String stageName) {
        IStageDefinition stage = nodes.get(stageName);
        if (stage == null) {
            throw new IllegalArgumentException("Unknown stage: " + stageName);
        }
        return stage;
    }

    public List<String> predecessorsOf(String stageName) {
        return predecessors.getOrDefault(stageName, List.of());
    }

    public List<String> successorsOf(String stageName) {
        return successors.getOrDefault(stageName, List.of());
    }

    public List<String> roots() {
        return levels.isEmpty() ? List.of() : levels.get(0);
    }

    /** Stages nothing depends on, in topological order. */
    public List<String> terminals() {
        return topologicalOrder.stream()
                .filter(stageName -> successorsOf(stageName).isEmpty())
                .toList();
    }

    /**
     * Stage whose value becomes the run result: the collector when one is declared, otherwise
     * the last terminal stage in topological order.
     */
    public String resultStage() {
        Optional<String> collector = topologicalOrder.stream()
                .filter(stageName -> nodes.get(stageName).isCollector())
                .findFirst();
        if (collector.isPresent()) {
            return collector.get();
        }
        List<String> terminals = terminals();
        return terminals.get(terminals.size() - 1);
    }

    public int levelOf(String stageName) {
        for (int i = 0; i < levels.size(); i++) {
            if (levels.get(i).contains(stageName)) {
                return i;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + stageName);
    }

    public int size() {
        return nodes.size();
    }
}
