package com.questrail.circuit.protocol.nsi.internal.correlation;

import com.questrail.circuit.api.OperationKind;

import java.time.Instant;
import java.util.Objects;

/**
 * One in-flight request awaiting the provider's confirm or fault.
 *
 * @param correlationId unique id carried by the request and its reply
 * @param connectionId  owning connection
 * @param kind          requested operation
 * @param issuedAt      wall-clock issue time (observational)
 * @param deadlineNanos monotonic deadline for the reply
 * @param attempt       1 for an operator request, higher for automatic query retries
 */
public record PendingOperation(
        String correlationId,
        String connectionId,
        OperationKind kind,
        Instant issuedAt,
        long deadlineNanos,
        int attempt
) {
    public PendingOperation {
        Objects.requireNonNull(correlationId, "correlationId");
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(issuedAt, "issuedAt");

        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
    }

    public OperationFamily family() {
        return OperationFamily.of(kind);
    }
}
