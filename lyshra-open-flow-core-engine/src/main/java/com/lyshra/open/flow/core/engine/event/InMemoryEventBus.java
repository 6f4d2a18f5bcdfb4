package com.lyshra.open.flow.core.engine.event;

import com.lyshra.open.flow.integration.contract.event.IEvent;
import com.lyshra.open.flow.integration.contract.event.IEventBus;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Process-local event bus. Every subscriber sees the events published after it subscribed, in
 * publication order, delivered on its own worker so a subscriber may publish from its handler.
 */
@Slf4j
public class InMemoryEventBus implements IEventBus {

    private final Sinks.Many<IEvent> sink = Sinks.many().multicast().directBestEffort();
    private final Scheduler dispatchScheduler;

    public InMemoryEventBus() {
        this(Schedulers.boundedElastic());
    }

    public InMemoryEventBus(Scheduler dispatchScheduler) {
        this.dispatchScheduler = dispatchScheduler;
    }

    @Override
    public Mono<Void> publish(IEvent event) {
        return Mono.fromRunnable(() -> emit(Objects.requireNonNull(event, "event")));
    }

    @Override
    public Flux<IEvent> subscribe(Predicate<IEvent> filter) {
        return sink.asFlux()
                .onBackpressureBuffer()
                .publishOn(dispatchScheduler)
                .filter(filter);
    }

    public int subscriberCount() {
        return sink.currentSubscriberCount();
    }

    private synchronized void emit(IEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("No subscriber for event [{}] of type [{}]", event.getId(), event.getType());
        } else if (result.isFailure()) {
            log.warn("Event [{}] of type [{}] was not delivered: {}", event.getId(), event.getType(), result);
        } else {
            log.debug("Published event [{}] of type [{}] on channel [{}]", event.getId(), event.getType(), event.getChannel());
        }
    }
}
