package com.lyshra.open.flow.integration.constant;

public final class LyshraOpenFlowConstants {

    private LyshraOpenFlowConstants() {}

    public static final String DEFAULT_NAMESPACE = "default";

    // Event bus
    public static final String RUN_EVENT_CHANNEL = "workflow-runs";
    public static final String RUN_EVENT_SOURCE = "lyshra-open-flow/coordinator";
    public static final String EVENT_TYPE_WORKFLOW_STARTED = "workflow_started";
    public static final String EVENT_TYPE_WORKFLOW_FINISHED = "workflow_finished";

    // Trigger actions
    public static final String ACTION_RUN_WORKFLOW = "run_workflow";
    public static final String ACTION_LOG_EVENT = "log_event";
    public static final String ACTION_PARAM_WORKFLOW_NAME = "workflow_name";
    public static final String ACTION_PARAM_INPUT = "input";
    public static final String ACTION_PARAM_NAMESPACE = "namespace";
    public static final String ACTION_PARAM_LEVEL = "level";

    // Artifacts
    public static final String ARTIFACT_METADATA_FILE = ".artifact.json";
    public static final String ARTIFACT_VALUE_FILE = "value.bin";
    public static final String ARTIFACT_NAME_PATTERN = "[A-Za-z0-9_-]+";
}
