package com.questrail.circuit.api;

/**
 * ReservationState
 * -----------------------------------------------------------------------------
 * Reservation sub-state of a connection: whether provider resources are
 * tentatively or firmly held.
 *
 * <p>Whether a {@link #HELD} reservation has been committed is carried
 * separately (see {@link ConnectionStatus#committed()}); the provider reports
 * the same state for both.</p>
 */
public enum ReservationState
{
    /** No reservation requested yet, or a previous one was aborted. */
    START,

    /** A reserve request is outstanding. */
    CHECKING,

    /** Resources are held by the provider (committed or not). */
    HELD,

    /** The provider rejected a reservation-family request. */
    FAILED,

    /** An abort request is outstanding. */
    ABORTING,

    /** A commit request is outstanding. */
    COMMITTING,

    /** No reply within the deadline, or the provider let an uncommitted hold expire. */
    TIMEOUT;

    /**
     * Returns true while a reservation-family request awaits its reply.
     */
    public boolean isTransient() {
        return this == CHECKING || this == ABORTING || this == COMMITTING;
    }
}
