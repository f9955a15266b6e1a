package com.questrail.circuit.protocol.nsi.internal.events;

import com.questrail.circuit.api.OperationKind;
import com.questrail.circuit.protocol.nsi.model.ProviderSummary;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * NsiReplyEvent
 * -----------------------------------------------------------------------------
 * Provider replies that have already been matched to a live pending operation.
 *
 * <p>Replies whose correlation id did not resolve never become events; they
 * are discarded at the correlation boundary. A reply event therefore always
 * answers exactly one accepted request.</p>
 */
public sealed interface NsiReplyEvent extends NsiEvent
        permits NsiReplyEvent.ConfirmReceived, NsiReplyEvent.FaultReceived
{
    OperationKind kind();

    String correlationId();

    final class ConfirmReceived extends NsiEvent.Base implements NsiReplyEvent {
        private final OperationKind kind;
        private final String correlationId;
        private final String providerConnectionId;
        private final ProviderSummary summary;

        public ConfirmReceived(Instant timestamp,
                               OperationKind kind,
                               String correlationId,
                               String providerConnectionId,
                               ProviderSummary summary) {
            super(timestamp);
            this.kind = Objects.requireNonNull(kind, "kind");
            this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
            this.providerConnectionId = providerConnectionId;
            this.summary = summary;
        }

        public ConfirmReceived(Instant timestamp, OperationKind kind, String correlationId) {
            this(timestamp, kind, correlationId, null, null);
        }

        @Override
        public OperationKind kind() {
            return kind;
        }

        @Override
        public String correlationId() {
            return correlationId;
        }

        /**
         * Provider-assigned connection id, present on reserve confirms.
         */
        public Optional<String> providerConnectionId() {
            return Optional.ofNullable(providerConnectionId);
        }

        /**
         * Provider's view of the connection, present on query confirms.
         */
        public Optional<ProviderSummary> summary() {
            return Optional.ofNullable(summary);
        }

        @Override
        public String toString() {
            return "ConfirmReceived[" + kind + ", " + correlationId + "]";
        }
    }

    final class FaultReceived extends NsiEvent.Base implements NsiReplyEvent {
        private final OperationKind kind;
        private final String correlationId;
        private final String errorId;
        private final String reason;

        public FaultReceived(Instant timestamp,
                             OperationKind kind,
                             String correlationId,
                             String errorId,
                             String reason) {
            super(timestamp);
            this.kind = Objects.requireNonNull(kind, "kind");
            this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
            this.errorId = errorId;
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        @Override
        public OperationKind kind() {
            return kind;
        }

        @Override
        public String correlationId() {
            return correlationId;
        }

        public Optional<String> errorId() {
            return Optional.ofNullable(errorId);
        }

        public String reason() {
            return reason;
        }

        @Override
        public String toString() {
            return "FaultReceived[" + kind + ", " + correlationId + ", " + reason + "]";
        }
    }
}
