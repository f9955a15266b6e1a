package com.questrail.circuit.protocol.nsi.internal.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a
 * {@link ScheduledExecutorService}.
 *
 * <h2>Clock consistency</h2>
 * <p>Deadlines are converted into relative delays using the supplied
 * {@link MonotonicClock}. Callers computing deadlines must use the same clock
 * instance, typically {@link SystemMonotonicClock#INSTANCE}.</p>
 *
 * <h2>Executor ownership</h2>
 * <p>This class does <strong>not</strong> own the executor. Callers are
 * responsible for shutdown.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Deadlines in the past run immediately.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());

        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }
}
