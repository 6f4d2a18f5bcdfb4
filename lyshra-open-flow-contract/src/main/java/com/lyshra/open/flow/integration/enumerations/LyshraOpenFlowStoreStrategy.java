package com.lyshra.open.flow.integration.enumerations;

import java.util.Arrays;
import java.util.Locale;

public enum LyshraOpenFlowStoreStrategy {
    CLUSTER_MEMORY,
    ARTIFACT,
    FALLBACK;

    public static LyshraOpenFlowStoreStrategy fromWireName(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(strategy -> strategy.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown object store strategy: " + value));
    }
}
