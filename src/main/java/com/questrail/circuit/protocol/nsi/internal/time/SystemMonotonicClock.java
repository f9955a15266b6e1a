package com.questrail.circuit.protocol.nsi.internal.time;

/**
 * Production {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>For deterministic testing, use {@code ManualMonotonicClock} instead.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
