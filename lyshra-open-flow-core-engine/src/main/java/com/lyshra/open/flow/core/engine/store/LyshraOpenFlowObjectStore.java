package com.lyshra.open.flow.core.engine.store;

import com.lyshra.open.flow.core.engine.store.artifact.FileSystemArtifactRepository;
import com.lyshra.open.flow.core.engine.store.backend.ArtifactStore;
import com.lyshra.open.flow.core.engine.store.backend.ClusterMemoryStore;
import com.lyshra.open.flow.core.engine.store.backend.FallbackStore;
import com.lyshra.open.flow.core.engine.store.serializer.ObjectSerializerRegistry;
import com.lyshra.open.flow.integration.contract.store.IClusterMemory;
import com.lyshra.open.flow.integration.contract.store.IObjectStore;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStoreStrategy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Dispatches object store calls to the backend of the requested strategy, defaulting the
 * strategy and namespace when the caller leaves them out.
 *
 * <pre>{@code
 * IObjectStore store = LyshraOpenFlowObjectStore.create(executor::getClusterMemory,
 *         new FileSystemArtifactRepository(basePath), LyshraOpenFlowStoreStrategy.FALLBACK, "default");
 * store.put("features", rows, LyshraOpenFlowStoreStrategy.CLUSTER_MEMORY, "team-a").block();
 * }</pre>
 */
@Slf4j
public class LyshraOpenFlowObjectStore implements IObjectStore {

    private final Map<LyshraOpenFlowStoreStrategy, IObjectStoreBackend> backends;
    @Getter
    private final LyshraOpenFlowStoreStrategy defaultStrategy;
    @Getter
    private final String defaultNamespace;

    public LyshraOpenFlowObjectStore(IObjectStoreBackend clusterMemory,
                                     IObjectStoreBackend artifact,
                                     LyshraOpenFlowStoreStrategy defaultStrategy,
                                     String defaultNamespace) {
        this.backends = new EnumMap<>(LyshraOpenFlowStoreStrategy.class);
        this.backends.put(LyshraOpenFlowStoreStrategy.CLUSTER_MEMORY, clusterMemory);
        this.backends.put(LyshraOpenFlowStoreStrategy.ARTIFACT, artifact);
        this.backends.put(LyshraOpenFlowStoreStrategy.FALLBACK, new FallbackStore(clusterMemory, artifact));
        this.defaultStrategy = defaultStrategy;
        this.defaultNamespace = defaultNamespace;
    }

    public static LyshraOpenFlowObjectStore create(Supplier<Optional<IClusterMemory>> clusterMemory,
                                                   FileSystemArtifactRepository artifactRepository,
                                                   LyshraOpenFlowStoreStrategy defaultStrategy,
                                                   String defaultNamespace) {
        ObjectSerializerRegistry serializers = ObjectSerializerRegistry.defaultRegistry();
        return new LyshraOpenFlowObjectStore(
                new ClusterMemoryStore(clusterMemory, serializers),
                new ArtifactStore(artifactRepository, serializers),
                defaultStrategy,
                defaultNamespace);
    }

    @Override
    public Mono<Void> put(String key, Object value, LyshraOpenFlowStoreStrategy strategy, String namespace) {
        return withKey(key, () -> backend(strategy).put(namespace(namespace), key, value));
    }

    @Override
    public Mono<Object> get(String key, LyshraOpenFlowStoreStrategy strategy, String namespace) {
        return withKey(key, () -> backend(strategy).get(namespace(namespace), key));
    }

    @Override
    public Mono<Void> delete(String key, LyshraOpenFlowStoreStrategy strategy, String namespace) {
        return withKey(key, () -> backend(strategy).delete(namespace(namespace), key));
    }

    @Override
    public Mono<Boolean> exists(String key, LyshraOpenFlowStoreStrategy strategy, String namespace) {
        return withKey(key, () -> backend(strategy).exists(namespace(namespace), key));
    }

    @Override
    public Flux<String> list(LyshraOpenFlowStoreStrategy strategy, String namespace) {
        return Flux.defer(() -> backend(strategy).list(namespace(namespace)));
    }

    @Override
    public Mono<Integer> clear(LyshraOpenFlowStoreStrategy strategy, String namespace) {
        return Mono.defer(() -> backend(strategy).clear(namespace(namespace)))
                .doOnNext(removed -> log.info("Cleared {} objects from namespace [{}]", removed, namespace(namespace)));
    }

    private IObjectStoreBackend backend(LyshraOpenFlowStoreStrategy strategy) {
        return backends.get(strategy == null ? defaultStrategy : strategy);
    }

    private String namespace(String namespace) {
        return namespace == null || namespace.isBlank() ? defaultNamespace : namespace;
    }

    private static <T> Mono<T> withKey(String key, Supplier<Mono<T>> operation) {
        if (key == null || key.isBlank()) {
            return Mono.error(new IllegalArgumentException("object store key must not be blank"));
        }
        return Mono.defer(operation);
    }
}
