package com.questrail.circuit.protocol.nsi.internal.events;

import java.time.Instant;

/**
 * Local operator actions that change a connection without any provider
 * exchange.
 */
public sealed interface NsiOperatorEvent extends NsiEvent
        permits NsiOperatorEvent.ForcedTermination, NsiOperatorEvent.ArchiveRequested
{
    /**
     * Operator-forced cleanup: the connection is driven to terminated without
     * waiting for (or sending) a terminate request.
     */
    final class ForcedTermination extends NsiEvent.Base implements NsiOperatorEvent {
        public ForcedTermination(Instant timestamp) {
            super(timestamp);
        }

        @Override
        public String toString() {
            return "ForcedTermination";
        }
    }

    final class ArchiveRequested extends NsiEvent.Base implements NsiOperatorEvent {
        public ArchiveRequested(Instant timestamp) {
            super(timestamp);
        }

        @Override
        public String toString() {
            return "ArchiveRequested";
        }
    }
}
