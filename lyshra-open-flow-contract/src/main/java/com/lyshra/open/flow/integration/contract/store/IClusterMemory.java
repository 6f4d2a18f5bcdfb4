package com.lyshra.open.flow.integration.contract.store;

import java.util.Optional;
import java.util.Set;

/**
 * Keyed memory shared by the workers of one executor session. Operations on different
 * keys never block each other; {@link #clear(String)} is exclusive across its namespace.
 */
public interface IClusterMemory {

    boolean isAvailable();

    void put(String namespace, String key, Object value);

    Optional<Object> get(String namespace, String key);

    boolean delete(String namespace, String key);

    boolean exists(String namespace, String key);

    Set<String> keys(String namespace);

    int clear(String namespace);

    /** Drops every namespace; called when the executor session ends. */
    void shutdown();
}
