package com.mirrorswarm.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fires an action once per day at a fixed wall-clock time.
 * The next run is computed after every firing so DST shifts follow the clock.
 */
@Slf4j
public class DailyScheduler implements AutoCloseable {

    private final String name;
    private final LocalTime fireAt;
    private final Clock clock;
    private final Runnable action;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> scheduledTask;

    public DailyScheduler(String name, LocalTime fireAt, Clock clock, Runnable action) {
        this.name = name;
        this.fireAt = fireAt;
        this.clock = clock;
        this.action = action;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Daily scheduler {} already running", name);
            return;
        }
        scheduleNext();
        log.info("Daily scheduler {} started, fires at {}", name, fireAt);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ScheduledFuture<?> task = scheduledTask;
        if (task != null) {
            task.cancel(false);
        }
        log.info("Daily scheduler {} stopped", name);
    }

    /**
     * Run the action now on the scheduler thread, outside the daily cadence.
     */
    public void triggerNow() {
        scheduler.execute(this::runOnce);
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Time until the next firing, strictly in the future.
     */
    public Duration delayUntilNext() {
        return delayUntilNext(ZonedDateTime.now(clock), fireAt);
    }

    static Duration delayUntilNext(ZonedDateTime now, LocalTime fireAt) {
        ZonedDateTime next = now.with(fireAt);
        if (!next.isAfter(now)) {
            next = next.plusDays(1);
        }
        return Duration.between(now, next);
    }

    private void scheduleNext() {
        if (!running.get()) {
            return;
        }
        long delayMs = delayUntilNext().toMillis();
        scheduledTask = scheduler.schedule(() -> {
            runOnce();
            scheduleNext();
        }, delayMs, TimeUnit.MILLISECONDS);
        log.debug("Daily scheduler {} next run in {}s", name, delayMs / 1000);
    }

    private void runOnce() {
        try {
            action.run();
        } catch (Exception e) {
            log.error("Daily scheduler {} action failed: {}", name, e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdownNow();
    }
}
