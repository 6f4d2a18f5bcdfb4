package com.lyshra.open.flow.core.engine.coordinator;

import com.lyshra.open.flow.integration.constant.LyshraOpenFlowConstants;
import com.lyshra.open.flow.integration.contract.workflow.IWorkflowRun;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowRunState;
import com.lyshra.open.flow.integration.models.events.Event;
import com.lyshra.open.flow.integration.models.workflowrun.RunFailure;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lifecycle events of workflow runs. The run's uid is the correlation id; the payload is
 * {@code uid, workflow, namespace, source, state, started_at, finished_at, result}.
 */
public final class WorkflowRunEvents {

    private WorkflowRunEvents() {}

    public static Event started(IWorkflowRun run) {
        return event(LyshraOpenFlowConstants.EVENT_TYPE_WORKFLOW_STARTED, run);
    }

    public static Event finished(IWorkflowRun run) {
        return event(LyshraOpenFlowConstants.EVENT_TYPE_WORKFLOW_FINISHED, run);
    }

    public static Map<String, Object> toData(IWorkflowRun run) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("uid", run.getUid());
        data.put("workflow", run.getWorkflow());
        data.put("namespace", run.getNamespace());
        data.put("source", run.getSource() == null ? null : run.getSource().wireName());
        data.put("state", run.getState().wireName());
        data.put("started_at", run.getStartedAt() == null ? null : run.getStartedAt().toString());
        data.put("finished_at", run.getFinishedAt() == null ? null : run.getFinishedAt().toString());
        Object result = run.getResult();
        if (run.getState() == LyshraOpenFlowRunState.FAILED && result instanceof RunFailure failure) {
            result = failure.toMap();
        }
        data.put("result", result);
        return data;
    }

    private static Event event(String type, IWorkflowRun run) {
        return Event.builder()
                .channel(LyshraOpenFlowConstants.RUN_EVENT_CHANNEL)
                .source(LyshraOpenFlowConstants.RUN_EVENT_SOURCE)
                .type(type)
                .correlationId(run.getUid())
                .data(toData(run))
                .build();
    }
}
