package com.questrail.circuit.protocol.nsi.observability;

import com.questrail.circuit.api.Anomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of NsiObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jNsiObservabilitySink implements NsiObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jNsiObservabilitySink.class);

    @Override
    public void onStateTransition(ConnectionTransitionEvent event) {
        for (String change : event.changes()) {
            log.info("Connection {}: {} (on {})", event.connectionId(), change, event.triggeringEvent());
        }
    }

    @Override
    public void onAnomaly(NsiAnomalyEvent event) {
        Anomaly anomaly = event.anomaly();
        log.warn("Connection {}: {} {} {}: {}",
            event.connection().orElse("<unattributed>"),
            anomaly.type(),
            anomaly.operationKind().map(Enum::name).orElse("-"),
            anomaly.correlation().orElse("-"),
            anomaly.detail());
    }

    @Override
    public void onProtocolEvent(NsiProtocolEvent event) {
        log.debug("NSI Protocol Event: {}", event);
    }

    @Override
    public void onError(NsiErrorEvent event) {
        log.error("NSI Error: {}", event.message(), event.cause());
    }
}
