package com.questrail.circuit.protocol.nsi.model;

import com.questrail.circuit.api.LifecycleState;
import com.questrail.circuit.api.ProvisionState;
import com.questrail.circuit.api.ReservationState;

import java.util.Objects;

/**
 * The provider's own view of a connection, as returned by a summary query.
 */
public record ProviderSummary(
        ReservationState reservation,
        ProvisionState provision,
        LifecycleState lifecycle,
        boolean dataPlaneActive
) {
    public ProviderSummary {
        Objects.requireNonNull(reservation, "reservation");
        Objects.requireNonNull(provision, "provision");
        Objects.requireNonNull(lifecycle, "lifecycle");
    }
}
