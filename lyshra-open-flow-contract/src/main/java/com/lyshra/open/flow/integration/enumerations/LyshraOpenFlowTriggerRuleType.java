package com.lyshra.open.flow.integration.enumerations;

public enum LyshraOpenFlowTriggerRuleType {
    CONDITION,
    SCHEDULE
}
