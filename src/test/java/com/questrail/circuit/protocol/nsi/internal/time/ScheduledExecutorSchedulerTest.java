package com.questrail.circuit.protocol.nsi.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Tests for the production scheduler that drives the timeout sweep.
 *
 * Note: These tests use real time. Tolerances are generous to avoid false
 * failures on loaded machines.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void taskExecutesAfterDeadline() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() + TimeUnit.MILLISECONDS.toNanos(50);
        scheduler.scheduleAtNanos(deadline, latch::countDown);

        assertTrue(latch.await(1, TimeUnit.SECONDS), "Task should execute");
    }

    @Test
    void pastDeadlineExecutesImmediately() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() - TimeUnit.SECONDS.toNanos(1);
        scheduler.scheduleAtNanos(deadline, latch::countDown);

        assertTrue(latch.await(200, TimeUnit.MILLISECONDS), "Task should execute immediately");
    }

    @Test
    void cancelPreventsExecution() throws InterruptedException {
        AtomicBoolean executed = new AtomicBoolean(false);

        Cancellable handle = scheduler.scheduleAfter(Duration.ofMillis(100),
                SystemMonotonicClock.INSTANCE, () -> executed.set(true));

        assertTrue(handle.cancel(), "Cancel should succeed");
        Thread.sleep(150);

        assertFalse(executed.get(), "Cancelled task should not execute");
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleAfter(Duration.ofMillis(-1), SystemMonotonicClock.INSTANCE, () -> {}));
    }

    @Test
    void repeatingTaskRunsUntilCancelled() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch threeRuns = new CountDownLatch(3);

        Cancellable handle = scheduler.scheduleEvery(Duration.ofMillis(10), SystemMonotonicClock.INSTANCE, () -> {
            runs.incrementAndGet();
            threeRuns.countDown();
        });

        assertTrue(threeRuns.await(1, TimeUnit.SECONDS), "Task should repeat");
        assertTrue(handle.cancel());

        int afterCancel = runs.get();
        Thread.sleep(100);
        assertTrue(runs.get() <= afterCancel + 1, "At most the run in progress may complete");
        assertFalse(handle.cancel(), "Second cancel is a no-op");
    }

    @Test
    void repeatingTaskSurvivesFailingRun() throws InterruptedException {
        CountDownLatch secondRun = new CountDownLatch(2);

        Cancellable handle = scheduler.scheduleEvery(Duration.ofMillis(10), SystemMonotonicClock.INSTANCE, () -> {
            secondRun.countDown();
            throw new IllegalStateException("boom");
        });

        assertTrue(secondRun.await(1, TimeUnit.SECONDS), "Failure must not stop the schedule");
        handle.cancel();
    }

    @Test
    void zeroPeriodIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleEvery(Duration.ZERO, SystemMonotonicClock.INSTANCE, () -> {}));
    }
}
