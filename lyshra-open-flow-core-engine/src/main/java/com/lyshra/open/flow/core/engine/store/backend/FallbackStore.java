package com.lyshra.open.flow.core.engine.store.backend;

import com.lyshra.open.flow.core.engine.store.IObjectStoreBackend;
import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowStoreStrategy;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Tries the primary tier and, on any failure, repeats the operation on the secondary tier.
 * The primary failure is logged and never reaches the caller.
 */
@Slf4j
public class FallbackStore implements IObjectStoreBackend {

    private final IObjectStoreBackend primary;
    private final IObjectStoreBackend secondary;

    public FallbackStore(IObjectStoreBackend primary, IObjectStoreBackend secondary) {
        this.primary = primary;
        this.secondary = secondary;
    }

    @Override
    public LyshraOpenFlowStoreStrategy getStrategy() {
        return LyshraOpenFlowStoreStrategy.FALLBACK;
    }

    @Override
    public Mono<Void> put(String namespace, String key, Object value) {
        return primary.put(namespace, key, value)
                .onErrorResume(e -> {
                    logFallback("put", namespace, key, e);
                    return secondary.put(namespace, key, value);
                });
    }

    @Override
    public Mono<Object> get(String namespace, String key) {
        return primary.get(namespace, key)
                .onErrorResume(e -> {
                    logFallback("get", namespace, key, e);
                    return secondary.get(namespace, key);
                });
    }

    /** Removes the key from both tiers. */
    @Override
    public Mono<Void> delete(String namespace, String key) {
        return primary.delete(namespace, key)
                .onErrorResume(e -> {
                    logFallback("delete", namespace, key, e);
                    return Mono.empty();
                })
                .then(secondary.delete(namespace, key));
    }

    @Override
    public Mono<Boolean> exists(String namespace, String key) {
        return primary.exists(namespace, key)
                .onErrorResume(e -> {
                    logFallback("exists", namespace, key, e);
                    return Mono.just(false);
                })
                .flatMap(found -> found ? Mono.just(true) : secondary.exists(namespace, key));
    }

    @Override
    public Flux<String> list(String namespace) {
        Flux<String> primaryKeys = primary.list(namespace)
                .onErrorResume(e -> {
                    logFallback("list", namespace, null, e);
                    return Flux.empty();
                });
        return Flux.concat(primaryKeys, secondary.list(namespace)).distinct().sort();
    }

    @Override
    public Mono<Integer> clear(String namespace) {
        Mono<Integer> primaryCleared = primary.clear(namespace)
                .onErrorResume(e -> {
                    logFallback("clear", namespace, null, e);
                    return Mono.just(0);
                });
        return primaryCleared.zipWith(secondary.clear(namespace), Integer::sum);
    }

    private void logFallback(String operation, String namespace, String key, Throwable e) {
        log.debug("Primary tier [{}] failed for {} of [{}/{}], using [{}]: {}",
                primary.getStrategy(), operation, namespace, key, secondary.getStrategy(), e.getMessage());
    }
}
