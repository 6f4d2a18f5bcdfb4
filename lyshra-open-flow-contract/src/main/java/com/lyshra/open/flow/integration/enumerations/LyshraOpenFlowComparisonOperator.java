package com.lyshra.open.flow.integration.enumerations;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum LyshraOpenFlowComparisonOperator {
    EQ,
    NE,
    GT,
    LT,
    GE,
    LE;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<LyshraOpenFlowComparisonOperator> fromTag(String tag) {
        return Arrays.stream(values())
                .filter(operator -> operator.tag().equals(tag))
                .findFirst();
    }
}
