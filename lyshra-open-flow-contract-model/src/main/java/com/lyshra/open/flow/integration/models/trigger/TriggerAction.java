package com.lyshra.open.flow.integration.models.trigger;

import com.lyshra.open.flow.integration.constant.LyshraOpenFlowConstants;
import com.lyshra.open.flow.integration.contract.trigger.ITriggerAction;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
public class TriggerAction implements ITriggerAction, Serializable {

    private static final long serialVersionUID = 1L;

    @NotBlank
    private final String target;

    @NotNull
    @Singular
    private final Map<String, Object> parameters;

    public static TriggerAction runWorkflow(String workflowName, Map<String, Object> input) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put(LyshraOpenFlowConstants.ACTION_PARAM_WORKFLOW_NAME, workflowName);
        parameters.put(LyshraOpenFlowConstants.ACTION_PARAM_INPUT, input == null ? Map.of() : input);
        return TriggerAction.builder()
                .target(LyshraOpenFlowConstants.ACTION_RUN_WORKFLOW)
                .parameters(parameters)
                .build();
    }

    public static TriggerAction logEvent(String level) {
        return TriggerAction.builder()
                .target(LyshraOpenFlowConstants.ACTION_LOG_EVENT)
                .parameter(LyshraOpenFlowConstants.ACTION_PARAM_LEVEL, level)
                .build();
    }
}
