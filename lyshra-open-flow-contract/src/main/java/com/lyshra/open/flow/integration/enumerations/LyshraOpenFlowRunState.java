package com.lyshra.open.flow.integration.enumerations;

import java.util.Locale;

public enum LyshraOpenFlowRunState {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
