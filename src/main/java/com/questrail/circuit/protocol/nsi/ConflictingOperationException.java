package com.questrail.circuit.protocol.nsi;

import com.questrail.circuit.api.OperationKind;
import com.questrail.circuit.protocol.nsi.internal.correlation.PendingOperation;

import java.util.Objects;

/**
 * A request of the same operation family is already outstanding for the
 * connection. The existing pending operation is left intact.
 */
public final class ConflictingOperationException extends NsiProtocolException
{
    private final OperationKind requested;
    private final PendingOperation existing;

    public ConflictingOperationException(OperationKind requested, PendingOperation existing) {
        super("Cannot " + requested + " connection " + existing.connectionId()
                + ": " + existing.kind() + " " + existing.correlationId() + " is still pending");
        this.requested = Objects.requireNonNull(requested, "requested");
        this.existing = existing;
    }

    public OperationKind requested() {
        return requested;
    }

    public PendingOperation existing() {
        return existing;
    }
}
