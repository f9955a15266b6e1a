package com.questrail.circuit.protocol.nsi.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Scheduler port used by the runtime to drive the periodic timeout sweep.
 *
 * <h2>Binding invariant</h2>
 * Scheduling is expressed in monotonic ticks or durations, never in
 * wall-clock instants.
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task          runnable task
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule after a duration using a provided monotonic clock.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long deadline = clock.nowNanos() + delay.toNanos();
        return scheduleAtNanos(deadline, task);
    }

    /**
     * Schedule a task to run repeatedly, {@code period} apart, starting one
     * period from now.
     *
     * <p>The default implementation re-arms a one-shot task after each run.
     * The returned handle cancels whichever run is currently armed.</p>
     */
    default Cancellable scheduleEvery(Duration period, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(period, "period");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be > 0");
        }

        RepeatingTask repeating = new RepeatingTask(this, period, clock, task);
        repeating.arm();
        return repeating;
    }

    /**
     * Self re-arming wrapper used by {@link #scheduleEvery}.
     */
    final class RepeatingTask implements Cancellable, Runnable {
        private final MonotonicScheduler scheduler;
        private final Duration period;
        private final MonotonicClock clock;
        private final Runnable task;

        private Cancellable current;
        private boolean cancelled;

        private RepeatingTask(MonotonicScheduler scheduler,
                              Duration period,
                              MonotonicClock clock,
                              Runnable task) {
            this.scheduler = scheduler;
            this.period = period;
            this.clock = clock;
            this.task = task;
        }

        private synchronized void arm() {
            if (!cancelled) {
                current = scheduler.scheduleAfter(period, clock, this);
            }
        }

        @Override
        public void run() {
            synchronized (this) {
                if (cancelled) {
                    return;
                }
            }
            try {
                task.run();
            } finally {
                arm();
            }
        }

        @Override
        public synchronized boolean cancel() {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            return current == null || current.cancel();
        }
    }
}
