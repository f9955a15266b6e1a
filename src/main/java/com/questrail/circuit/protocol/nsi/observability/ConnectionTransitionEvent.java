package com.questrail.circuit.protocol.nsi.observability;

import com.questrail.circuit.api.ConnectionStatus;
import com.questrail.circuit.protocol.nsi.internal.events.NsiEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Record representing a sub-state transition of one connection.
 */
public record ConnectionTransitionEvent(
    Instant timestamp,
    ConnectionStatus oldStatus,
    ConnectionStatus newStatus,
    NsiEvent triggeringEvent
) {
    public String connectionId() {
        return newStatus.connectionId();
    }

    /**
     * Returns "dimension: old -> new" for each sub-state that changed.
     */
    public List<String> changes() {
        List<String> changes = new ArrayList<>();
        String oldReservation = reservationLabel(oldStatus);
        String newReservation = reservationLabel(newStatus);
        if (!oldReservation.equals(newReservation)) {
            changes.add("Reservation: " + oldReservation + " -> " + newReservation);
        }
        if (oldStatus.provision() != newStatus.provision()) {
            changes.add("Provision: " + oldStatus.provision() + " -> " + newStatus.provision());
        }
        if (oldStatus.lifecycle() != newStatus.lifecycle()) {
            changes.add("Lifecycle: " + oldStatus.lifecycle() + " -> " + newStatus.lifecycle());
        }
        if (oldStatus.dataPlane() != newStatus.dataPlane()) {
            changes.add("DataPlane: " + oldStatus.dataPlane() + " -> " + newStatus.dataPlane());
        }
        return changes;
    }

    private static String reservationLabel(ConnectionStatus status) {
        return status.committed() ? status.reservation() + "(committed)" : status.reservation().name();
    }
}
