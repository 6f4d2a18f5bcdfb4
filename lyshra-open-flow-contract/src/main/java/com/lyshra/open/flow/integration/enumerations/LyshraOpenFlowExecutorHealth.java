package com.lyshra.open.flow.integration.enumerations;

/**
 * Connection health of a stage executor.
 */
public enum LyshraOpenFlowExecutorHealth {
    /** Connected and accepting work. */
    HEALTHY,
    /** Connectivity was lost and reconnection is being attempted. */
    DEGRADED,
    /** The reconnection budget is exhausted or the failure was fatal. */
    UNHEALTHY
}
