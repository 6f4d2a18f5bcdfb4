package com.lyshra.open.flow.core.engine.store;

import com.lyshra.open.flow.integration.contract.store.IObjectStore;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStoreStrategy;
import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * View of an object store that substitutes a fixed namespace when a call leaves the namespace
 * out. Stages receive this view bound to their run's namespace; an explicit namespace still wins.
 */
public class NamespaceBoundObjectStore implements IObjectStore {

    private final IObjectStore delegate;
    @Getter
    private final String namespace;

    public NamespaceBoundObjectStore(IObjectStore delegate, String namespace) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
    }

    @Override
    public Mono<Void> put(String key, Object value, LyshraOpenFlowStoreStrategy strategy, String namespace) {
        return delegate.put(key, value, strategy, resolve(namespace));
    }

    @Override
    public Mono<Object> get(String key, LyshraOpenFlowStoreStrategy strategy, String namespace) {
        return delegate.get(key, strategy, resolve(namespace));
    }

    @Override
    public Mono<Void> delete(String key, LyshraOpenFlowStoreStrategy strategy, String namespace) {
        return delegate.delete(key, strategy, resolve(namespace));
    }

    @Override
    public Mono<Boolean> exists(String key, LyshraOpenFlowStoreStrategy strategy, String namespace) {
        return delegate.exists(key, strategy, resolve(namespace));
    }

    @Override
    public Flux<String> list(LyshraOpenFlowStoreStrategy strategy, String namespace) {
        return delegate.list(strategy, resolve(namespace));
    }

    @Override
    public Mono<Integer> clear(LyshraOpenFlowStoreStrategy strategy, String namespace) {
        return delegate.clear(strategy, resolve(namespace));
    }

    private String resolve(String requested) {
        return requested == null || requested.isBlank() ? namespace : requested;
    }
}
