package com.lyshra.open.flow.core.engine.store.backend;

import com.lyshra.open.flow.core.engine.store.IObjectStoreBackend;
import com.lyshra.open.flow.core.engine.store.artifact.FileSystemArtifactRepository;
import com.lyshra.open.flow.core.engine.store.serializer.ObjectSerializerRegistry;
import com.lyshra.open.flow.core.engine.store.serializer.SerializedValue;
import com.lyshra.open.flow.integration.constant.LyshraOpenFlowConstants;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStorageTier;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStoreStrategy;
import com.lyshra.open.flow.integration.exception.LyshraOpenFlowRuntimeException;
import com.lyshra.open.flow.integration.exception.ObjectNotFoundException;
import com.lyshra.open.flow.integration.exception.ObjectStorageException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Callable;

/**
 * Durable tier: each key is an artifact holding the serialized value and its metadata.
 */
@Slf4j
public class ArtifactStore implements IObjectStoreBackend {

    private final FileSystemArtifactRepository repository;
    private final ObjectSerializerRegistry serializers;

    public ArtifactStore(FileSystemArtifactRepository repository, ObjectSerializerRegistry serializers) {
        this.repository = repository;
        this.serializers = serializers;
    }

    @Override
    public LyshraOpenFlowStoreStrategy getStrategy() {
        return LyshraOpenFlowStoreStrategy.ARTIFACT;
    }

    @Override
    public Mono<Void> put(String namespace, String key, Object value) {
        return io(namespace, key, () -> {
            SerializedValue serialized = serializers.serialize(value);
            repository.write(namespace, key, session -> session
                    .valueType(serialized.valueType())
                    .serializer(serialized.serializerId())
                    .writeFile(LyshraOpenFlowConstants.ARTIFACT_VALUE_FILE, serialized.bytes()));
            log.debug("Stored [{}/{}] as artifact using serializer [{}]", namespace, key, serialized.serializerId());
            return Boolean.TRUE;
        }).then();
    }

    @Override
    public Mono<Object> get(String namespace, String key) {
        return io(namespace, key, () -> {
            FileSystemArtifactRepository.CommittedFile stored = repository
                    .readCommittedFile(namespace, key, LyshraOpenFlowConstants.ARTIFACT_VALUE_FILE)
                    .orElseThrow(() -> new ObjectNotFoundException(key, namespace));
            return serializers.deserialize(stored.metadata().getSerializer(), stored.content());
        });
    }

    @Override
    public Mono<Void> delete(String namespace, String key) {
        return io(namespace, key, () -> repository.delete(namespace, key)).then();
    }

    @Override
    public Mono<Boolean> exists(String namespace, String key) {
        return io(namespace, key, () -> repository.findCommitted(namespace, key).isPresent());
    }

    @Override
    public Flux<String> list(String namespace) {
        return io(namespace, null, () -> repository.list(namespace)).flatMapMany(Flux::fromIterable);
    }

    @Override
    public Mono<Integer> clear(String namespace) {
        return io(namespace, null, () -> repository.clear(namespace));
    }

    private <T> Mono<T> io(String namespace, String key, Callable<T> operation) {
        return Mono.fromCallable(() -> {
            try {
                return operation.call();
            } catch (LyshraOpenFlowRuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new ObjectStorageException(key, namespace, LyshraOpenFlowStorageTier.ARTIFACT, e.getMessage(), e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
