package com.questrail.circuit.protocol.nsi.observability;

/**
 * No-op implementation of NsiObservabilitySink.
 */
public final class NullObservabilitySink implements NsiObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(ConnectionTransitionEvent event) {}

    @Override
    public void onAnomaly(NsiAnomalyEvent event) {}

    @Override
    public void onProtocolEvent(NsiProtocolEvent event) {}

    @Override
    public void onError(NsiErrorEvent event) {}
}
