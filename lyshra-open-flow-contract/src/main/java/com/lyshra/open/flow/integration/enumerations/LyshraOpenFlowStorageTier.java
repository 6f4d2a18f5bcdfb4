package com.lyshra.open.flow.integration.enumerations;

/**
 * Physical tier an object store entry lives in.
 */
public enum LyshraOpenFlowStorageTier {
    CLUSTER_MEMORY,
    ARTIFACT
}
