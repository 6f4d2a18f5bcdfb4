package com.lyshra.open.flow.integration.enumerations;

public enum LyshraOpenFlowResourceKind {
    WORKFLOW,
    TRIGGER_RULE,
    CONFIG
}
