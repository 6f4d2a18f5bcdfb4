package com.lyshra.open.flow.core.engine.trigger.action;

import com.lyshra.open.flow.core.util.CastUtil;
import com.lyshra.open.flow.integration.constant.LyshraOpenFlowConstants;
import com.lyshra.open.flow.integration.contract.coordinator.IWorkflowRunSubmitter;
import com.lyshra.open.flow.integration.contract.trigger.ITriggerAction;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowRunSource;
import com.lyshra.open.flow.integration.exception.TriggerRuleException;
import com.lyshra.open.flow.integration.models.events.Event;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Submits a workflow run and returns as soon as the run is accepted. The triggering event is
 * passed to the run as {@code trigger_event}, the schedule tick as {@code scheduled_at}.
 */
@Slf4j
public class RunWorkflowActionHandler implements ITriggerActionHandler {

    public static final String INPUT_TRIGGER_EVENT = "trigger_event";
    public static final String INPUT_SCHEDULED_AT = "scheduled_at";
    private static final String LEGACY_PARAM_WORKFLOW = "workflow";

    private final IWorkflowRunSubmitter submitter;

    public RunWorkflowActionHandler(IWorkflowRunSubmitter submitter) {
        this.submitter = submitter;
    }

    @Override
    public String getTarget() {
        return LyshraOpenFlowConstants.ACTION_RUN_WORKFLOW;
    }

    @Override
    public void validate(String ruleName, ITriggerAction action) {
        String workflowName = workflowName(action.getParameters());
        if (workflowName == null || workflowName.isBlank()) {
            throw new TriggerRuleException(ruleName, "run_workflow requires the [" + LyshraOpenFlowConstants.ACTION_PARAM_WORKFLOW_NAME + "] parameter");
        }
        Object input = action.getParameters().get(LyshraOpenFlowConstants.ACTION_PARAM_INPUT);
        if (input != null && !(input instanceof Map<?, ?>)) {
            throw new TriggerRuleException(ruleName, "run_workflow input must be a map");
        }
    }

    @Override
    public Mono<Void> handle(TriggerFiring firing) {
        Map<String, Object> parameters = firing.rule().getAction().getParameters();
        String workflowName = workflowName(parameters);
        String namespace = CastUtil.castAsString(parameters.get(LyshraOpenFlowConstants.ACTION_PARAM_NAMESPACE));
        Map<String, Object> input = new LinkedHashMap<>();
        if (parameters.get(LyshraOpenFlowConstants.ACTION_PARAM_INPUT) instanceof Map<?, ?> configured) {
            configured.forEach((key, value) -> input.put(String.valueOf(key), value));
        }
        firing.triggeringEvent().ifPresent(event -> input.put(INPUT_TRIGGER_EVENT, Event.toMap(event)));
        firing.tick().ifPresent(tick -> input.put(INPUT_SCHEDULED_AT, tick.toInstant().toString()));
        LyshraOpenFlowRunSource source = firing.event() != null
                ? LyshraOpenFlowRunSource.TRIGGER
                : LyshraOpenFlowRunSource.SCHEDULE;

        return submitter.submit(workflowName, input, namespace, source)
                .doOnNext(run -> log.info("Rule [{}] started run [{}] of workflow [{}]",
                        firing.rule().getName(), run.getUid(), workflowName))
                .then();
    }

    private static String workflowName(Map<String, Object> parameters) {
        Object name = parameters.get(LyshraOpenFlowConstants.ACTION_PARAM_WORKFLOW_NAME);
        if (name == null) {
            name = parameters.get(LEGACY_PARAM_WORKFLOW);
        }
        return CastUtil.castAsString(name);
    }
}
