package com.lyshra.open.flow.core.engine.trigger.schedule;

import com.lyshra.open.flow.integration.enumerations.LyshraOpenFlowMissedTickPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScheduleClock")
class ScheduleClockTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");
    private static final Clock UTC = Clock.fixed(START, ZoneOffset.UTC);

    @Test
    @DisplayName("every-five-minutes schedule fires four times over twenty simulated minutes")
    void everyFiveMinutesOverTwentyMinutes() {
        // Given
        ScheduleClock clock = new ScheduleClock(UTC, LyshraOpenFlowMissedTickPolicy.SKIP, 60);
        CronExpression cron = CronExpression.parse("*/5 * * * *");
        List<ZonedDateTime> fired = new ArrayList<>();

        // When polling every 10 seconds from 10:00:05 to 10:20:00 exclusive
        for (Instant now = START.plusSeconds(5); now.isBefore(START.plus(Duration.ofMinutes(20)));
             now = now.plusSeconds(10)) {
            for (ZonedDateTime tick : clock.tick(now)) {
                if (cron.matches(tick)) {
                    fired.add(tick);
                }
            }
        }

        // Then
        assertEquals(List.of(
                ZonedDateTime.parse("2026-03-01T10:00Z"),
                ZonedDateTime.parse("2026-03-01T10:05Z"),
                ZonedDateTime.parse("2026-03-01T10:10Z"),
                ZonedDateTime.parse("2026-03-01T10:15Z")), fired);
    }

    @Test
    @DisplayName("each minute is delivered once however often it is polled")
    void minuteDeliveredOnce() {
        ScheduleClock clock = new ScheduleClock(UTC, LyshraOpenFlowMissedTickPolicy.SKIP, 60);

        assertEquals(1, clock.tick(START.plusSeconds(1)).size());
        assertTrue(clock.tick(START.plusSeconds(30)).isEmpty());
        assertTrue(clock.tick(START.plusSeconds(59)).isEmpty());
        assertEquals(1, clock.tick(START.plusSeconds(61)).size());
        assertTrue(clock.tick(START.plusSeconds(10)).isEmpty(), "time going backwards yields nothing");
    }

    @Test
    @DisplayName("skip policy drops minutes that passed unobserved")
    void skipPolicy() {
        ScheduleClock clock = new ScheduleClock(UTC, LyshraOpenFlowMissedTickPolicy.SKIP, 60);
        clock.tick(START);

        List<ZonedDateTime> ticks = clock.tick(START.plus(Duration.ofMinutes(5)));

        assertEquals(List.of(ZonedDateTime.parse("2026-03-01T10:05Z")), ticks);
    }

    @Test
    @DisplayName("catch-up policy replays missed minutes oldest first up to the limit")
    void catchUpPolicy() {
        ScheduleClock clock = new ScheduleClock(UTC, LyshraOpenFlowMissedTickPolicy.CATCH_UP, 2);
        clock.tick(START);

        List<ZonedDateTime> ticks = clock.tick(START.plus(Duration.ofMinutes(5)));

        assertEquals(List.of(
                ZonedDateTime.parse("2026-03-01T10:03Z"),
                ZonedDateTime.parse("2026-03-01T10:04Z"),
                ZonedDateTime.parse("2026-03-01T10:05Z")), ticks);
    }
}
