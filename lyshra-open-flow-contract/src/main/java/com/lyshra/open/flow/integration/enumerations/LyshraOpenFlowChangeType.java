package com.lyshra.open.flow.integration.enumerations;

public enum LyshraOpenFlowChangeType {
    APPLIED,
    DELETED
}
