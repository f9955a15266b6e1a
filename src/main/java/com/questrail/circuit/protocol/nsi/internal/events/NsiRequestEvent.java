package com.questrail.circuit.protocol.nsi.internal.events;

import com.questrail.circuit.api.OperationKind;

import java.time.Instant;
import java.util.Objects;

/**
 * Events raised when an operator intent has been accepted for sending.
 */
public sealed interface NsiRequestEvent extends NsiEvent
        permits NsiRequestEvent.RequestAccepted
{
    /**
     * A request of the given kind is about to be sent under {@code correlationId}.
     */
    final class RequestAccepted extends NsiEvent.Base implements NsiRequestEvent {
        private final OperationKind kind;
        private final String correlationId;

        public RequestAccepted(Instant timestamp, OperationKind kind, String correlationId) {
            super(timestamp);
            this.kind = Objects.requireNonNull(kind, "kind");
            this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        }

        public OperationKind kind() {
            return kind;
        }

        public String correlationId() {
            return correlationId;
        }

        @Override
        public String toString() {
            return "RequestAccepted[" + kind + ", " + correlationId + "]";
        }
    }
}
