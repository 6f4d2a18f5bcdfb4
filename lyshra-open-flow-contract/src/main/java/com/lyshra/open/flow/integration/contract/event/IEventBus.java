package com.lyshra.open.flow.integration.contract.event;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.function.Predicate;

public interface IEventBus {

    Mono<Void> publish(IEvent event);

    /** Hot stream of events published after subscription that match {@code filter}. */
    Flux<IEvent> subscribe(Predicate<IEvent> filter);
}
