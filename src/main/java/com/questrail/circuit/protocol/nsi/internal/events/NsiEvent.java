package com.questrail.circuit.protocol.nsi.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * NsiEvent
 * -----------------------------------------------------------------------------
 * Marker interface for all internal events applied to a connection's state
 * machines.
 *
 * <h2>Role in the architecture</h2>
 * Events are the only way information reaches
 * {@link com.questrail.circuit.protocol.nsi.internal.state.ConnectionStateReducer}:
 * <ul>
 *   <li>accepted operator intents ({@link NsiRequestEvent})</li>
 *   <li>provider confirms and faults ({@link NsiReplyEvent})</li>
 *   <li>expired deadlines ({@link NsiTimeoutEvent})</li>
 *   <li>unsolicited provider notifications ({@link NsiNotificationEvent})</li>
 *   <li>local operator actions with no wire counterpart ({@link NsiOperatorEvent})</li>
 * </ul>
 *
 * Events for one connection are applied one at a time, in the order they are
 * accepted. They must be immutable.
 */
public interface NsiEvent
{
    /**
     * Time at which the event was accepted. Observational only; deadlines are
     * evaluated on the monotonic clock.
     */
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements NsiEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }
    }
}
