package com.lyshra.open.flow.integration.enumerations;

/**
 * Behaviour of a {@code var} node whose path does not resolve against the event.
 */
public enum LyshraOpenFlowMissingPathPolicy {
    /** The node evaluates to {@code null}, which is falsy. */
    FALSY,
    /** The node raises a rule evaluation error and the rule is disabled. */
    ERROR
}
