package com.lyshra.open.flow.core.engine.coordinator.impl;

import com.lyshra.open.flow.integration.contract.workflow.IWorkflowRun;
import com.lyshra.open.flow.integration.exception.WorkflowRunNotFoundException;
import com.lyshra.open.flow.integration.models.workflowrun.WorkflowRun;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs known to this coordinator, live or finished, until purged.
 */
class WorkflowRunRegistry {

    private final Map<String, RunExecution> executions = new ConcurrentHashMap<>();

    void register(RunExecution execution) {
        executions.put(execution.getRun().getUid(), execution);
    }

    Optional<RunExecution> find(String runUid) {
        return Optional.ofNullable(executions.get(runUid));
    }

    RunExecution get(String runUid) {
        return find(runUid).orElseThrow(() -> new WorkflowRunNotFoundException(runUid));
    }

    List<IWorkflowRun> list(String workflowName, int limit) {
        return executions.values().stream()
                .map(RunExecution::getRun)
                .filter(run -> workflowName == null || workflowName.equals(run.getWorkflow()))
                .sorted(Comparator.comparing(WorkflowRun::getStartedAt).reversed())
                .limit(Math.max(0, limit))
                .map(run -> (IWorkflowRun) run.snapshot())
                .toList();
    }

    int purgeFinishedBefore(Instant cutoff) {
        int before = executions.size();
        executions.values().removeIf(execution -> {
            WorkflowRun run = execution.getRun();
            return run.isTerminal() && run.getFinishedAt() != null && run.getFinishedAt().isBefore(cutoff);
        });
        return before - executions.size();
    }

    int size() {
        return executions.size();
    }
}
