package com.lyshra.open.flow.integration.enumerations;

public enum LyshraOpenFlowStageKind {
    NORMAL,
    PARAMETERIZED
}
