package com.questrail.circuit.api;

/**
 * LifecycleState
 * -----------------------------------------------------------------------------
 * Lifecycle sub-state of a connection.
 *
 * <p>The lifecycle only moves forward, in declaration order.
 * {@link #TERMINATED} is absorbing.</p>
 */
public enum LifecycleState
{
    CREATED,
    FAILED,
    PASSED_END_TIME,
    TERMINATING,
    TERMINATED;

    /**
     * Returns true if moving from this state to {@code next} keeps the
     * lifecycle monotonic.
     */
    public boolean canAdvanceTo(LifecycleState next) {
        return next.ordinal() > this.ordinal();
    }
}
