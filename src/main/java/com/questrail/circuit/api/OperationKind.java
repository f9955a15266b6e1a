package com.questrail.circuit.api;

/**
 * Requests a requester agent can send to a provider.
 */
public enum OperationKind
{
    RESERVE(true),
    RESERVE_COMMIT(true),
    RESERVE_ABORT(true),
    PROVISION(true),
    RELEASE(true),
    TERMINATE(true),
    QUERY(false);

    private final boolean stateChanging;

    OperationKind(boolean stateChanging) {
        this.stateChanging = stateChanging;
    }

    /**
     * Returns true if the operation changes provider state. A timed-out
     * state-changing request has an ambiguous outcome and is never retried
     * automatically.
     */
    public boolean isStateChanging() {
        return stateChanging;
    }
}
