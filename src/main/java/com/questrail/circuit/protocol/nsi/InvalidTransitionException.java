package com.questrail.circuit.protocol.nsi;

import com.questrail.circuit.api.OperationKind;

import java.util.Objects;

/**
 * An operator intent is not legal for the connection's current sub-states.
 * The connection is left unchanged.
 */
public final class InvalidTransitionException extends NsiProtocolException
{
    private final String connectionId;
    private final String operation;
    private final String offendingState;

    public InvalidTransitionException(String connectionId, String operation, String offendingState) {
        super("Cannot " + operation + " connection " + connectionId + ": " + offendingState);
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.operation = Objects.requireNonNull(operation, "operation");
        this.offendingState = Objects.requireNonNull(offendingState, "offendingState");
    }

    public InvalidTransitionException(String connectionId, OperationKind requested, String offendingState) {
        this(connectionId, requested.name(), offendingState);
    }

    public String connectionId() {
        return connectionId;
    }

    /**
     * The requested operation: an {@link OperationKind} name, or
     * {@code FORCE_TERMINATE} / {@code ARCHIVE} for local operator actions.
     */
    public String operation() {
        return operation;
    }

    /**
     * Description of the sub-state that forbids the operation, e.g.
     * {@code "Reservation is HELD (uncommitted)"}.
     */
    public String offendingState() {
        return offendingState;
    }
}
