package com.lyshra.open.flow.integration.contract.store;

import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStoreStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Keyed value store shared by concurrently running stages. A {@code null} strategy selects
 * the deployment default. Entries are last-writer-wins per {@code (namespace, key)}.
 */
public interface IObjectStore {

    /**
     * Errors with {@link com.lyshra.open.flow.integration.exception.ObjectSerializationException}
     * when no serializer accepts the value and with
     * {@link com.lyshra.open.flow.integration.exception.ObjectStorageException} when the tier is
     * unreachable and the strategy is not {@code FALLBACK}.
     */
    Mono<Void> put(String key, Object value, LyshraOpenFlowStoreStrategy strategy, String namespace);

    /**
     * Errors with {@link com.lyshra.open.flow.integration.exception.ObjectNotFoundException}
     * when no tier consulted by the strategy holds the key.
     */
    Mono<Object> get(String key, LyshraOpenFlowStoreStrategy strategy, String namespace);

    /** Idempotent. */
    Mono<Void> delete(String key, LyshraOpenFlowStoreStrategy strategy, String namespace);

    Mono<Boolean> exists(String key, LyshraOpenFlowStoreStrategy strategy, String namespace);

    Flux<String> list(LyshraOpenFlowStoreStrategy strategy, String namespace);

    /** Removes every key in the namespace; emits the number of removed entries. */
    Mono<Integer> clear(LyshraOpenFlowStoreStrategy strategy, String namespace);

    default <T> Mono<T> get(String key, Class<T> type, LyshraOpenFlowStoreStrategy strategy, String namespace) {
        return get(key, strategy, namespace).cast(type);
    }
}
