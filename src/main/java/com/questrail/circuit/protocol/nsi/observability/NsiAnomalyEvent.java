package com.questrail.circuit.protocol.nsi.observability;

import com.questrail.circuit.api.Anomaly;

import java.util.Optional;

/**
 * An anomaly as reported to the sink.
 *
 * @param connectionId the affected connection, or {@code null} when the message
 *                     could not be attributed to any connection
 * @param anomaly      the anomaly itself
 */
public record NsiAnomalyEvent(String connectionId, Anomaly anomaly) {

    public Optional<String> connection() {
        return Optional.ofNullable(connectionId);
    }
}
