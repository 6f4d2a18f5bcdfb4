package com.lyshra.open.flow.core.engine.trigger.schedule;

import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowMissedTickPolicy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Turns wall-clock time into minute ticks. Each minute boundary is delivered to the listener
 * exactly once; minutes that passed unobserved are dropped or replayed according to the
 * {@link LyshraOpenFlowMissedTickPolicy}.
 */
@Slf4j
public class ScheduleClock {

    @Getter
    private final Clock clock;
    private final LyshraOpenFlowMissedTickPolicy missedTickPolicy;
    private final int maxCatchUpTicks;
    private final Duration pollInterval;
    private final Scheduler scheduler;

    private Instant lastTick;
    private Disposable polling;

    public ScheduleClock(Clock clock, LyshraOpenFlowMissedTickPolicy missedTickPolicy, int maxCatchUpTicks) {
        this(clock, missedTickPolicy, maxCatchUpTicks, Duration.ofSeconds(1), Schedulers.parallel());
    }

    public ScheduleClock(Clock clock, LyshraOpenFlowMissedTickPolicy missedTickPolicy, int maxCatchUpTicks,
                         Duration pollInterval, Scheduler scheduler) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.missedTickPolicy = Objects.requireNonNull(missedTickPolicy, "missedTickPolicy");
        this.maxCatchUpTicks = maxCatchUpTicks;
        this.pollInterval = pollInterval;
        this.scheduler = scheduler;
    }

    public synchronized void start(Consumer<ZonedDateTime> listener) {
        if (polling != null && !polling.isDisposed()) {
            return;
        }
        polling = Flux.interval(Duration.ZERO, pollInterval, scheduler)
                .subscribe(ignored -> tick(clock.instant()).forEach(tick -> deliver(listener, tick)),
                        error -> log.error("Schedule clock stopped", error));
        log.info("Schedule clock started, missed tick policy {}", missedTickPolicy);
    }

    public synchronized void stop() {
        if (polling != null) {
            polling.dispose();
            polling = null;
            log.info("Schedule clock stopped");
        }
    }

    public synchronized boolean isRunning() {
        return polling != null && !polling.isDisposed();
    }

    /**
     * Advances the clock to {@code now} and returns the minute ticks that became due, oldest
     * first. Calling it again within the same minute returns nothing.
     */
    public synchronized List<ZonedDateTime> tick(Instant now) {
        Instant minute = now.truncatedTo(ChronoUnit.MINUTES);
        List<ZonedDateTime> due = new ArrayList<>();
        if (lastTick != null && !minute.isAfter(lastTick)) {
            return due;
        }
        if (lastTick != null && missedTickPolicy == LyshraOpenFlowMissedTickPolicy.CATCH_UP) {
            long missed = ChronoUnit.MINUTES.between(lastTick, minute) - 1;
            long replayed = Math.min(missed, maxCatchUpTicks);
            if (missed > replayed) {
                log.warn("Dropping {} missed schedule ticks beyond the catch-up limit of {}", missed - replayed, maxCatchUpTicks);
            }
            for (long back = replayed; back >= 1; back--) {
                due.add(minute.minus(back, ChronoUnit.MINUTES).atZone(clock.getZone()));
            }
        } else if (lastTick != null && ChronoUnit.MINUTES.between(lastTick, minute) > 1) {
            log.debug("Skipping {} missed schedule ticks", ChronoUnit.MINUTES.between(lastTick, minute) - 1);
        }
        due.add(minute.atZone(clock.getZone()));
        lastTick = minute;
        return due;
    }

    private static void deliver(Consumer<ZonedDateTime> listener, ZonedDateTime tick) {
        try {
            listener.accept(tick);
        } catch (RuntimeException e) {
            log.error("Schedule tick {} failed", tick, e);
        }
    }
}
