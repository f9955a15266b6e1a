package com.questrail.circuit.protocol.nsi.observability;

/**
 * Main interface for receiving requester observability events.
 * Implementations can provide logging, metrics, or UI notification.
 *
 * <p>Calls are made while the affected connection is locked. Implementations
 * must return promptly and must not call back into the engine.</p>
 */
public interface NsiObservabilitySink {
    /**
     * Called after a connection's sub-states changed and the result was saved.
     * @param event the transition event details
     */
    void onStateTransition(ConnectionTransitionEvent event);

    /**
     * Called when an anomaly is recorded (rejected transition, unsolicited
     * message, timeout, provider fault).
     * @param event the anomaly and, when known, its connection
     */
    void onAnomaly(NsiAnomalyEvent event);

    /**
     * Called for protocol bookkeeping events (request sent, deadline expired,
     * retry scheduled).
     * @param event the protocol event
     */
    void onProtocolEvent(NsiProtocolEvent event);

    /**
     * Called when a defect is detected, immediately before it is raised.
     * @param event the error event
     */
    void onError(NsiErrorEvent event);
}
