package com.questrail.circuit.api;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Anomaly
 * -----------------------------------------------------------------------------
 * A non-fatal inconsistency recorded against a connection: a rejected
 * transition, an unsolicited message, a timeout, a provider fault.
 *
 * <p>Anomalies never change sub-states by themselves. They are appended to the
 * connection's log so an operator can see why a connection stopped where it
 * did.</p>
 *
 * @param timestamp      when the anomaly was observed (wall clock, observational)
 * @param type           classification
 * @param operation      operation concerned, or {@code null} for notifications
 * @param correlationId  correlation id concerned, or {@code null}
 * @param detail         human-readable detail, including any provider reason
 */
public record Anomaly(
        Instant timestamp,
        Type type,
        OperationKind operation,
        String correlationId,
        String detail
) {
    public enum Type {
        INVALID_TRANSITION,
        UNKNOWN_CORRELATION,
        ALREADY_RESOLVED,
        OPERATION_TIMEOUT,
        PROVIDER_FAULT,
        PROVIDER_ERROR_EVENT,
        STALE_STATUS,
        STATUS_DIVERGENCE,
        DELIVERY_FAILURE
    }

    public Anomaly {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(detail, "detail");
    }

    public Optional<OperationKind> operationKind() {
        return Optional.ofNullable(operation);
    }

    public Optional<String> correlation() {
        return Optional.ofNullable(correlationId);
    }
}
