package com.lyshra.open.flow.core.engine.store.memory;

import com.lyshra.open.flow.integration.contract.store.IClusterMemory;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Process-local cluster memory for the local executor.
 *
 * <h2>Locking</h2>
 * <p>Each namespace owns a read/write lock. Per-key operations share the read side, so they
 * never wait for each other and rely on the concurrent map for per-key atomicity. {@link #clear}
 * takes the write side: it waits for in-flight puts and gets of that namespace and holds
 * new ones back until the namespace is empty, which linearizes it against them.</p>
 */
@Slf4j
public class InMemoryClusterMemory implements IClusterMemory {

    private final Map<String, NamespaceSegment> segments = new ConcurrentHashMap<>();
    private volatile boolean available;

    public InMemoryClusterMemory() {
        this(true);
    }

    public InMemoryClusterMemory(boolean available) {
        this.available = available;
    }

    /** Starts a new session; contents of a previous session are gone. */
    public void open() {
        segments.clear();
        available = true;
    }

    /** Marks the memory unreachable without dropping its contents. */
    public void setAvailable(boolean available) {
        this.available = available;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public void put(String namespace, String key, Object value) {
        shared(namespace, segment -> segment.entries.put(key, value));
    }

    @Override
    public Optional<Object> get(String namespace, String key) {
        return shared(namespace, segment -> Optional.ofNullable(segment.entries.get(key)));
    }

    @Override
    public boolean delete(String namespace, String key) {
        return shared(namespace, segment -> segment.entries.remove(key) != null);
    }

    @Override
    public boolean exists(String namespace, String key) {
        return shared(namespace, segment -> segment.entries.containsKey(key));
    }

    @Override
    public Set<String> keys(String namespace) {
        return shared(namespace, segment -> Set.copyOf(segment.entries.keySet()));
    }

    @Override
    public int clear(String namespace) {
        ensureAvailable();
        NamespaceSegment segment = segment(namespace);
        Lock lock = segment.lock.writeLock();
        lock.lock();
        try {
            int removed = segment.entries.size();
            segment.entries.clear();
            log.debug("Cleared {} entries from cluster memory namespace [{}]", removed, namespace);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void shutdown() {
        available = false;
        segments.clear();
        log.info("Cluster memory session closed");
    }

    private <T> T shared(String namespace, Function<NamespaceSegment, T> operation) {
        ensureAvailable();
        NamespaceSegment segment = segment(namespace);
        Lock lock = segment.lock.readLock();
        lock.lock();
        try {
            return operation.apply(segment);
        } finally {
            lock.unlock();
        }
    }

    private void ensureAvailable() {
        if (!available) {
            throw new IllegalStateException("cluster memory session is not available");
        }
    }

    private NamespaceSegment segment(String namespace) {
        return segments.computeIfAbsent(namespace, ignored -> new NamespaceSegment());
    }

    private static final class NamespaceSegment {
        private final ReadWriteLock lock = new ReentrantReadWriteLock();
        private final Map<String, Object> entries = new ConcurrentHashMap<>();
    }
}
