package com.questrail.circuit.protocol.nsi.internal.events;

import com.questrail.circuit.api.OperationKind;

import java.time.Instant;
import java.util.Objects;

/**
 * NsiTimeoutEvent
 * -----------------------------------------------------------------------------
 * Deadline events injected by the timeout sweep.
 *
 * <p>Like a reply, a {@link TimeoutExpired} is only raised after its
 * correlation id resolved; a deadline that loses the race against a real reply
 * never reaches the reducer.</p>
 */
public sealed interface NsiTimeoutEvent extends NsiEvent
        permits NsiTimeoutEvent.TimeoutExpired
{
    final class TimeoutExpired extends NsiEvent.Base implements NsiTimeoutEvent {
        private final OperationKind kind;
        private final String correlationId;

        public TimeoutExpired(Instant timestamp, OperationKind kind, String correlationId) {
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
            return "TimeoutExpired[" + kind + ", " + correlationId + "]";
        }
    }
}
