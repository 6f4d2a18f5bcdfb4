package com.lyshra.open.flow.integration.exception.codes;

import com.lyshra.open.flow.integration.exception.ILyshraOpenFlowErrorInfo;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum LyshraOpenFlowErrorCodes implements ILyshraOpenFlowErrorInfo {

    WORKFLOW_VALIDATION_FAILED(
            "LYSHRA_FLOW_ERR_0001",
            "Workflow [%s] is invalid: %s"
    ),

    TARGET_RESOLUTION_FAILED(
            "LYSHRA_FLOW_ERR_0002",
            "Stage target [%s] could not be resolved: %s"
    ),

    STAGE_EXECUTION_FAILED(
            "LYSHRA_FLOW_ERR_0003",
            "Stage [%s]%s failed: %s"
    ),

    STAGE_TIMED_OUT(
            "LYSHRA_FLOW_ERR_0004",
            "Stage [%s]%s did not finish within %s"
    ),

    WORKFLOW_TIMED_OUT(
            "LYSHRA_FLOW_ERR_0005",
            "Run [%s] did not finish within %s"
    ),

    OBJECT_STORAGE_FAILED(
            "LYSHRA_FLOW_ERR_0006",
            "Object [%s] in namespace [%s] could not be accessed on tier [%s]: %s"
    ),

    OBJECT_SERIALIZATION_FAILED(
            "LYSHRA_FLOW_ERR_0007",
            "Value of type [%s] could not be serialized: %s"
    ),

    OBJECT_NOT_FOUND(
            "LYSHRA_FLOW_ERR_0008",
            "Object [%s] not found in namespace [%s]"
    ),

    RULE_EVALUATION_FAILED(
            "LYSHRA_FLOW_ERR_0009",
            "Condition could not be evaluated: %s"
    ),

    WORKFLOW_NOT_FOUND(
            "LYSHRA_FLOW_ERR_0010",
            "Workflow [%s] not found"
    ),

    WORKFLOW_RUN_NOT_FOUND(
            "LYSHRA_FLOW_ERR_0011",
            "Workflow run [%s] not found"
    ),

    EXECUTOR_UNAVAILABLE(
            "LYSHRA_FLOW_ERR_0012",
            "Executor [%s] unavailable: %s"
    ),

    TRIGGER_RULE_INVALID(
            "LYSHRA_FLOW_ERR_0013",
            "Trigger rule [%s] is invalid: %s"
    )

    ;

    private final String errorCode;
    private final String errorTemplate;
}
