package com.lyshra.open.flow.core.engine.store;

import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStoreStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * One storage strategy behind the object store.
 */
public interface IObjectStoreBackend {

    LyshraOpenFlowStoreStrategy getStrategy();

    Mono<Void> put(String namespace, String key, Object value);

    Mono<Object> get(String namespace, String key);

    Mono<Void> delete(String namespace, String key);

    Mono<Boolean> exists(String namespace, String key);

    Flux<String> list(String namespace);

    Mono<Integer> clear(String namespace);
}
