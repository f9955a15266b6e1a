package com.questrail.circuit.protocol.nsi.internal.correlation;

import com.questrail.circuit.api.OperationKind;

/**
 * Mutually exclusive groups of operations. A connection has at most one
 * pending operation per family.
 */
public enum OperationFamily
{
    RESERVATION,
    PROVISIONING,
    TERMINATION,
    QUERY;

    public static OperationFamily of(OperationKind kind) {
        return switch (kind) {
            case RESERVE, RESERVE_COMMIT, RESERVE_ABORT -> RESERVATION;
            case PROVISION, RELEASE -> PROVISIONING;
            case TERMINATE -> TERMINATION;
            case QUERY -> QUERY;
        };
    }
}
