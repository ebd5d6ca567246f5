package com.mirrorswarm.common.infra;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DailySchedulerTest {

    private static final ZoneId UTC = ZoneId.of("UTC");

    @Test
    void delayUntilNext_laterToday() {
        ZonedDateTime now = ZonedDateTime.of(2024, 3, 1, 10, 0, 0, 0, UTC);

        assertEquals(Duration.ofHours(2), DailyScheduler.delayUntilNext(now, LocalTime.of(12, 0)));
    }

    @Test
    void delayUntilNext_alreadyPassed_rollsToTomorrow() {
        ZonedDateTime now = ZonedDateTime.of(2024, 3, 1, 13, 0, 0, 0, UTC);

        assertEquals(Duration.ofHours(23), DailyScheduler.delayUntilNext(now, LocalTime.of(12, 0)));
    }

    @Test
    void delayUntilNext_exactlyNow_rollsToTomorrow() {
        ZonedDateTime now = ZonedDateTime.of(2024, 3, 1, 12, 0, 0, 0, UTC);

        assertEquals(Duration.ofDays(1), DailyScheduler.delayUntilNext(now, LocalTime.of(12, 0)));
    }

    @Test
    void triggerNow_runsActionOnSchedulerThread() throws InterruptedException {
        CountDownLatch ran = new CountDownLatch(1);
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), UTC);
        try (DailyScheduler scheduler = new DailyScheduler("test-flush", LocalTime.NOON, clock, ran::countDown)) {
            scheduler.triggerNow();

            assertTrue(ran.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void triggerNow_failingAction_doesNotKillScheduler() throws InterruptedException {
        CountDownLatch second = new CountDownLatch(2);
        Clock clock = Clock.systemUTC();
        try (DailyScheduler scheduler = new DailyScheduler("test-flush", LocalTime.NOON, clock, () -> {
            second.countDown();
            throw new IllegalStateException("boom");
        })) {
            scheduler.triggerNow();
            scheduler.triggerNow();

            assertTrue(second.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void startStop_togglesRunning() {
        try (DailyScheduler scheduler = new DailyScheduler("test-flush", LocalTime.NOON, Clock.systemUTC(), () -> {
        })) {
            scheduler.start();
            assertTrue(scheduler.isRunning());
            scheduler.stop();
            assertFalse(scheduler.isRunning());
        }
    }
}
