package com.lyshra.open.flow.integration.enumerations;

/**
 * What the schedule clock does with minute boundaries it did not observe.
 */
public enum LyshraOpenFlowMissedTickPolicy {
    /** Only the current tick is evaluated. */
    SKIP,
    /** Missed minutes since the last evaluated tick are replayed, up to a bound. */
    CATCH_UP
}
