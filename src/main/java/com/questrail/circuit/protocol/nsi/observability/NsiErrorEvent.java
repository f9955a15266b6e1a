package com.questrail.circuit.protocol.nsi.observability;

import java.time.Instant;

/**
 * Record representing a defect detected in the requester.
 */
public record NsiErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
