package com.lyshra.open.flow.core.engine.store.backend;

import com.lyshra.open.flow.core.engine.store.IObjectStoreBackend;
import com.lyshra.open.flow.core.engine.store.ObjectStoreEntry;
import com.lyshra.open.flow.core.engine.store.serializer.ObjectSerializerRegistry;
import com.lyshra.open.flow.core.engine.store.serializer.SerializedValue;
import com.lyshra.open.flow.integration.contract.store.IClusterMemory;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStorageTier;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStoreStrategy;
import com.lyshra.open.flow.integration.exception.LyshraOpenFlowRuntimeException;
import com.lyshra.open.flow.integration.exception.ObjectNotFoundException;
import com.lyshra.open.flow.integration.exception.ObjectStorageException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Ephemeral tier backed by the executor session's cluster memory. Values are stored
 * serialized, so a stored value cannot be mutated through the reference that was put.
 */
@Slf4j
public class ClusterMemoryStore implements IObjectStoreBackend {

    private final Supplier<Optional<IClusterMemory>> clusterMemorySupplier;
    private final ObjectSerializerRegistry serializers;

    public ClusterMemoryStore(Supplier<Optional<IClusterMemory>> clusterMemorySupplier,
                              ObjectSerializerRegistry serializers) {
        this.clusterMemorySupplier = clusterMemorySupplier;
        this.serializers = serializers;
    }

    @Override
    public LyshraOpenFlowStoreStrategy getStrategy() {
        return LyshraOpenFlowStoreStrategy.CLUSTER_MEMORY;
    }

    @Override
    public Mono<Void> put(String namespace, String key, Object value) {
        return Mono.fromRunnable(() -> {
            SerializedValue serialized = serializers.serialize(value);
            ObjectStoreEntry entry = new ObjectStoreEntry(key, namespace, LyshraOpenFlowStorageTier.CLUSTER_MEMORY,
                    serialized.serializerId(), serialized.valueType(), serialized.bytes(), Instant.now());
            withMemory(namespace, key, memory -> {
                memory.put(namespace, key, entry);
                return null;
            });
            log.debug("Stored [{}/{}] in cluster memory using serializer [{}]", namespace, key, entry.serializerId());
        });
    }

    @Override
    public Mono<Object> get(String namespace, String key) {
        return Mono.fromCallable(() -> {
            Optional<Object> stored = withMemory(namespace, key, memory -> memory.get(namespace, key));
            ObjectStoreEntry entry = (ObjectStoreEntry) stored
                    .orElseThrow(() -> new ObjectNotFoundException(key, namespace));
            return serializers.deserialize(entry.serializerId(), entry.bytes());
        });
    }

    @Override
    public Mono<Void> delete(String namespace, String key) {
        return Mono.fromRunnable(() -> withMemory(namespace, key, memory -> memory.delete(namespace, key)));
    }

    @Override
    public Mono<Boolean> exists(String namespace, String key) {
        return Mono.fromCallable(() -> withMemory(namespace, key, memory -> memory.exists(namespace, key)));
    }

    @Override
    public Flux<String> list(String namespace) {
        return Mono.fromCallable(() -> withMemory(namespace, null, memory -> memory.keys(namespace)))
                .flatMapMany(keys -> Flux.fromIterable(keys).sort());
    }

    @Override
    public Mono<Integer> clear(String namespace) {
        return Mono.fromCallable(() -> withMemory(namespace, null, memory -> memory.clear(namespace)));
    }

    private <T> T withMemory(String namespace, String key, Function<IClusterMemory, T> operation) {
        IClusterMemory memory = clusterMemorySupplier.get()
                .orElseThrow(() -> new ObjectStorageException(key, namespace, LyshraOpenFlowStorageTier.CLUSTER_MEMORY,
                        "no executor session with cluster memory"));
        if (!memory.isAvailable()) {
            throw new ObjectStorageException(key, namespace, LyshraOpenFlowStorageTier.CLUSTER_MEMORY,
                    "cluster memory is unreachable");
        }
        try {
            return operation.apply(memory);
        } catch (LyshraOpenFlowRuntimeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ObjectStorageException(key, namespace, LyshraOpenFlowStorageTier.CLUSTER_MEMORY, e.getMessage(), e);
        }
    }
}
