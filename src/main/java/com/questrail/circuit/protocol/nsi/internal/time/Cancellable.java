package com.questrail.circuit.protocol.nsi.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a scheduled task, such as the periodic timeout
 * sweep.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
