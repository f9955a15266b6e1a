package com.questrail.circuit.api;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ConnectionStatus
 * -----------------------------------------------------------------------------
 * Read-only projection of one connection for display and operator decisions.
 *
 * <p>The overall status of a connection is the tuple of its four sub-states.
 * They are reported side by side and never collapsed: a connection may, for
 * example, be {@link ProvisionState#PROVISIONED} while its lifecycle is
 * {@link LifecycleState#PASSED_END_TIME}.</p>
 */
public record ConnectionStatus(
        String connectionId,
        String providerConnectionId,
        String description,
        ServiceParameters parameters,
        ReservationState reservation,
        boolean committed,
        ProvisionState provision,
        LifecycleState lifecycle,
        DataPlaneState dataPlane,
        boolean archived,
        List<Anomaly> anomalies,
        Instant lastTransition
) {
    public ConnectionStatus {
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(reservation, "reservation");
        Objects.requireNonNull(provision, "provision");
        Objects.requireNonNull(lifecycle, "lifecycle");
        Objects.requireNonNull(dataPlane, "dataPlane");
        anomalies = List.copyOf(anomalies);
    }

    public Optional<String> providerId() {
        return Optional.ofNullable(providerConnectionId);
    }
}
