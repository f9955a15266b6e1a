package com.questrail.circuit.protocol.nsi.internal.state;

import com.questrail.circuit.api.Anomaly;
import com.questrail.circuit.api.ConnectionStatus;
import com.questrail.circuit.api.DataPlaneState;
import com.questrail.circuit.api.LifecycleState;
import com.questrail.circuit.api.OperationKind;
import com.questrail.circuit.api.ProvisionState;
import com.questrail.circuit.api.ReservationState;
import com.questrail.circuit.api.ServiceParameters;
import com.questrail.circuit.protocol.nsi.model.ProviderSummary;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection
 * -----------------------------------------------------------------------------
 * Immutable record of one end-to-end circuit as seen by the requester.
 *
 * <h2>Four orthogonal sub-states</h2>
 * A connection carries one value for each of the Reservation, Provision,
 * Lifecycle and Data-Plane state machines. They are kept separate on purpose;
 * the protocol legitimately produces combinations such as "provisioned, but
 * past end time" that a single flat state would not represent.
 *
 * <h2>Unresolved operation</h2>
 * When a provision, release or terminate request times out (or a terminate is
 * refused), the connection stays in the in-flight sub-state and remembers the
 * operation as <em>unresolved</em>. That marker is what permits the operator to
 * re-issue the request or to back out; it is cleared by the next accepted
 * request or by a query that settles the outcome.
 *
 * <p>Like the other state types, this class has no behaviour. Transitions are
 * computed by {@link ConnectionStateReducer}.</p>
 */
public final class Connection
{
    private final String connectionId;
    private final String providerConnectionId;
    private final String description;
    private final ServiceParameters parameters;
    private final ReservationState reservation;
    private final boolean committed;
    private final ProvisionState provision;
    private final LifecycleState lifecycle;
    private final DataPlaneState dataPlane;
    private final OperationKind unresolvedOperation;
    private final boolean archived;
    private final ProviderSummary providerSummary;
    private final List<Anomaly> anomalies;
    private final Instant lastTransition;

    private Connection(Builder b) {
        this.connectionId = Objects.requireNonNull(b.connectionId, "connectionId");
        this.providerConnectionId = b.providerConnectionId;
        this.description = Objects.requireNonNull(b.description, "description");
        this.parameters = Objects.requireNonNull(b.parameters, "parameters");
        this.reservation = Objects.requireNonNull(b.reservation, "reservation");
        this.committed = b.committed;
        this.provision = Objects.requireNonNull(b.provision, "provision");
        this.lifecycle = Objects.requireNonNull(b.lifecycle, "lifecycle");
        this.dataPlane = Objects.requireNonNull(b.dataPlane, "dataPlane");
        this.unresolvedOperation = b.unresolvedOperation;
        this.archived = b.archived;
        this.providerSummary = b.providerSummary;
        this.anomalies = List.copyOf(b.anomalies);
        this.lastTransition = Objects.requireNonNull(b.lastTransition, "lastTransition");

        if (committed && reservation != ReservationState.HELD) {
            throw new IllegalArgumentException("committed requires reservation HELD, was " + reservation);
        }
    }

    public String connectionId() {
        return connectionId;
    }

    public Optional<String> providerConnectionId() {
        return Optional.ofNullable(providerConnectionId);
    }

    public String description() {
        return description;
    }

    public ServiceParameters parameters() {
        return parameters;
    }

    public ReservationState reservation() {
        return reservation;
    }

    public boolean committed() {
        return committed;
    }

    /**
     * Returns true once the reservation is firmly held.
     */
    public boolean isCommittedHeld() {
        return reservation == ReservationState.HELD && committed;
    }

    public ProvisionState provision() {
        return provision;
    }

    public LifecycleState lifecycle() {
        return lifecycle;
    }

    public DataPlaneState dataPlane() {
        return dataPlane;
    }

    public Optional<OperationKind> unresolvedOperation() {
        return Optional.ofNullable(unresolvedOperation);
    }

    public boolean isUnresolved(OperationKind kind) {
        return unresolvedOperation == kind;
    }

    public boolean archived() {
        return archived;
    }

    /**
     * Last provider view obtained by a summary query, if any.
     */
    public Optional<ProviderSummary> providerSummary() {
        return Optional.ofNullable(providerSummary);
    }

    /**
     * Append-only anomaly log, oldest first.
     */
    public List<Anomaly> anomalies() {
        return anomalies;
    }

    public Instant lastTransition() {
        return lastTransition;
    }

    /**
     * Returns true if the four sub-states (and the committed flag) are equal.
     * Anomalies, timestamps and bookkeeping fields are not compared.
     */
    public boolean sameSubStates(Connection other) {
        return reservation == other.reservation
                && committed == other.committed
                && provision == other.provision
                && lifecycle == other.lifecycle
                && dataPlane == other.dataPlane;
    }

    public ConnectionStatus status() {
        return new ConnectionStatus(
                connectionId,
                providerConnectionId,
                description,
                parameters,
                reservation,
                committed,
                provision,
                lifecycle,
                dataPlane,
                archived,
                anomalies,
                lastTransition
        );
    }

    // ---------------------------------------------------------------------
    // Factory helpers
    // ---------------------------------------------------------------------

    /**
     * A freshly created connection: nothing reserved, nothing provisioned.
     */
    public static Connection created(String connectionId,
                                     String description,
                                     ServiceParameters parameters,
                                     Instant now) {
        Builder b = new Builder();
        b.connectionId = connectionId;
        b.description = description;
        b.parameters = parameters;
        b.reservation = ReservationState.START;
        b.provision = ProvisionState.RELEASED;
        b.lifecycle = LifecycleState.CREATED;
        b.dataPlane = DataPlaneState.DOWN;
        b.lastTransition = now;
        return new Connection(b);
    }

    // ---------------------------------------------------------------------
    // State transition helpers
    // ---------------------------------------------------------------------

    public Connection withReservation(ReservationState state, Instant now) {
        Builder b = copy(now);
        b.reservation = state;
        if (state != ReservationState.HELD) {
            b.committed = false;
        }
        return new Connection(b);
    }

    /**
     * Moves the reservation to {@link ReservationState#HELD} and records
     * whether it is committed.
     */
    public Connection withHeld(boolean committed, Instant now) {
        Builder b = copy(now);
        b.reservation = ReservationState.HELD;
        b.committed = committed;
        return new Connection(b);
    }

    public Connection withProvision(ProvisionState state, Instant now) {
        Builder b = copy(now);
        b.provision = state;
        return new Connection(b);
    }

    public Connection withLifecycle(LifecycleState state, Instant now) {
        Builder b = copy(now);
        b.lifecycle = state;
        return new Connection(b);
    }

    public Connection withDataPlane(DataPlaneState state, Instant now) {
        Builder b = copy(now);
        b.dataPlane = state;
        return new Connection(b);
    }

    public Connection withProviderConnectionId(String providerConnectionId, Instant now) {
        Builder b = copy(now);
        b.providerConnectionId = Objects.requireNonNull(providerConnectionId, "providerConnectionId");
        return new Connection(b);
    }

    /**
     * Sets or clears ({@code null}) the unresolved operation marker.
     */
    public Connection withUnresolvedOperation(OperationKind kind, Instant now) {
        Builder b = copy(now);
        b.unresolvedOperation = kind;
        return new Connection(b);
    }

    public Connection withArchived(Instant now) {
        Builder b = copy(now);
        b.archived = true;
        return new Connection(b);
    }

    public Connection withProviderSummary(ProviderSummary summary, Instant now) {
        Builder b = copy(now);
        b.providerSummary = Objects.requireNonNull(summary, "summary");
        return new Connection(b);
    }

    /**
     * Appends an anomaly. Sub-states and the transition time are untouched.
     */
    public Connection withAnomaly(Anomaly anomaly) {
        Builder b = copy(lastTransition);
        b.anomalies.add(Objects.requireNonNull(anomaly, "anomaly"));
        return new Connection(b);
    }

    private Builder copy(Instant now) {
        Builder b = new Builder();
        b.connectionId = connectionId;
        b.providerConnectionId = providerConnectionId;
        b.description = description;
        b.parameters = parameters;
        b.reservation = reservation;
        b.committed = committed;
        b.provision = provision;
        b.lifecycle = lifecycle;
        b.dataPlane = dataPlane;
        b.unresolvedOperation = unresolvedOperation;
        b.archived = archived;
        b.providerSummary = providerSummary;
        b.anomalies = new ArrayList<>(anomalies);
        b.lastTransition = Objects.requireNonNull(now, "now");
        return b;
    }

    private static final class Builder {
        private String connectionId;
        private String providerConnectionId;
        private String description;
        private ServiceParameters parameters;
        private ReservationState reservation;
        private boolean committed;
        private ProvisionState provision;
        private LifecycleState lifecycle;
        private DataPlaneState dataPlane;
        private OperationKind unresolvedOperation;
        private boolean archived;
        private ProviderSummary providerSummary;
        private List<Anomaly> anomalies = new ArrayList<>();
        private Instant lastTransition;
    }

    @Override
    public String toString() {
        return "Connection[" + connectionId
                + ", reservation=" + reservation + (committed ? "(committed)" : "")
                + ", provision=" + provision
                + ", lifecycle=" + lifecycle
                + ", dataPlane=" + dataPlane
                + (unresolvedOperation != null ? ", unresolved=" + unresolvedOperation : "")
                + (archived ? ", archived" : "")
                + "]";
    }
}
