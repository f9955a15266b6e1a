package com.questrail.circuit.protocol.nsi.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every deadline decision in the requester.
 *
 * <h2>Binding invariant</h2>
 * Request deadlines, query backoff and end-time deadlines are all expressed in
 * this clock's ticks. Wall-clock time (e.g. {@code Instant.now()}) is used only
 * for timestamps on events, anomalies and the status projection.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful for elapsed time computations.
     */
    long nowNanos();
}
