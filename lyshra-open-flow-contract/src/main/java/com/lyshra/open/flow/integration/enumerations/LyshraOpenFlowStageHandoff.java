package com.lyshra.open.flow.integration.enumerations;

/**
 * How a stage's result reaches its dependents.
 */
public enum LyshraOpenFlowStageHandoff {
    /** Result is passed as a call argument. */
    DIRECT,
    /** Result is written to the object store and read back for each dependent. */
    OBJECT_STORE
}
