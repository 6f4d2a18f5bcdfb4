package com.lyshra.open.flow.core.engine.store;

import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStorageTier;

import java.time.Instant;

/**
 * One stored value in serialized form.
 */
public record ObjectStoreEntry(String key,
                               String namespace,
                               LyshraOpenFlowStorageTier tier,
                               String serializerId,
                               String valueType,
                               byte[] bytes,
                               Instant storedAt) {
}
