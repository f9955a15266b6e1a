package com.questrail.circuit.protocol.nsi.internal.events;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Unsolicited status changes reported by the provider, or raised locally when
 * a reservation's scheduled end time passes.
 */
public sealed interface NsiNotificationEvent extends NsiEvent
        permits NsiNotificationEvent.DataPlaneStatusChanged,
                NsiNotificationEvent.ErrorEventReceived,
                NsiNotificationEvent.ReserveTimeoutReceived,
                NsiNotificationEvent.PassedEndTime
{
    final class DataPlaneStatusChanged extends NsiEvent.Base implements NsiNotificationEvent {
        private final boolean active;

        public DataPlaneStatusChanged(Instant timestamp, boolean active) {
            super(timestamp);
            this.active = active;
        }

        public boolean active() {
            return active;
        }

        @Override
        public String toString() {
            return "DataPlaneStatusChanged[active=" + active + "]";
        }
    }

    final class ErrorEventReceived extends NsiEvent.Base implements NsiNotificationEvent {
        private final String errorId;
        private final String text;

        public ErrorEventReceived(Instant timestamp, String errorId, String text) {
            super(timestamp);
            this.errorId = errorId;
            this.text = Objects.requireNonNull(text, "text");
        }

        public Optional<String> errorId() {
            return Optional.ofNullable(errorId);
        }

        public String text() {
            return text;
        }

        @Override
        public String toString() {
            return "ErrorEventReceived[" + text + "]";
        }
    }

    /** The provider released an uncommitted hold. */
    final class ReserveTimeoutReceived extends NsiEvent.Base implements NsiNotificationEvent {
        public ReserveTimeoutReceived(Instant timestamp) {
            super(timestamp);
        }

        @Override
        public String toString() {
            return "ReserveTimeoutReceived";
        }
    }

    final class PassedEndTime extends NsiEvent.Base implements NsiNotificationEvent {
        public PassedEndTime(Instant timestamp) {
            super(timestamp);
        }

        @Override
        public String toString() {
            return "PassedEndTime";
        }
    }
}
