package com.questrail.circuit.protocol.nsi.observability;

import com.questrail.circuit.api.OperationKind;

import java.time.Instant;

/**
 * Protocol bookkeeping event (request sent, reply matched, deadline expired,
 * retry scheduled or not sent, pending request cancelled).
 */
public record NsiProtocolEvent(
    Instant timestamp,
    Kind kind,
    String connectionId,
    OperationKind operation,
    String correlationId,
    String detail
) {
    public enum Kind {
        REQUEST_SENT,
        REPLY_MATCHED,
        DEADLINE_EXPIRED,
        QUERY_RETRY_SCHEDULED,
        QUERY_RETRY_FAILED,
        PENDING_CANCELLED,
        END_TIME_REACHED,
        AUTO_ADVANCE_FAILED
    }
}
