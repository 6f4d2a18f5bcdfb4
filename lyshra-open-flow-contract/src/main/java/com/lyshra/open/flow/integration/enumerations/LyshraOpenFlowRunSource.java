package com.lyshra.open.flow.integration.enumerations;

import java.util.Locale;

public enum LyshraOpenFlowRunSource {
    API,
    TRIGGER,
    SCHEDULE,
    MANUAL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
