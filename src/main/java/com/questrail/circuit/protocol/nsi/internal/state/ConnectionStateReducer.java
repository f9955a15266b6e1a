package com.questrail.circuit.protocol.nsi.internal.state;

import com.questrail.circuit.api.Anomaly;
import com.questrail.circuit.api.DataPlaneState;
import com.questrail.circuit.api.LifecycleState;
import com.questrail.circuit.api.OperationKind;
import com.questrail.circuit.api.ProvisionState;
import com.questrail.circuit.api.ReservationState;
import com.questrail.circuit.protocol.nsi.internal.events.NsiEvent;
import com.questrail.circuit.protocol.nsi.internal.events.NsiNotificationEvent;
import com.questrail.circuit.protocol.nsi.internal.events.NsiOperatorEvent;
import com.questrail.circuit.protocol.nsi.internal.events.NsiReplyEvent;
import com.questrail.circuit.protocol.nsi.internal.events.NsiRequestEvent;
import com.questrail.circuit.protocol.nsi.internal.events.NsiTimeoutEvent;
import com.questrail.circuit.protocol.nsi.model.ProviderSummary;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * ConnectionStateReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic transition engine for the four sub-state machines of a
 * {@link Connection}.
 *
 * <h2>Role in the architecture</h2>
 * Given a connection and a single {@link NsiEvent}, the reducer computes:
 * <ul>
 *   <li>the next connection record</li>
 *   <li>the follow-up {@link ConnectionEffects} for the protocol engine</li>
 *   <li>whether the event had a defined transition at all</li>
 * </ul>
 * It performs no I/O, keeps no timers, and never throws for a reachable
 * protocol situation.
 *
 * <h2>Undefined transitions</h2>
 * An event that has no transition from the current sub-states is a protocol
 * violation. The sub-states are left exactly as they were and an
 * {@link Anomaly.Type#INVALID_TRANSITION} anomaly is appended, so the
 * violation is visible rather than silently swallowed.
 *
 * <h2>Gating</h2>
 * {@link #checkIntent(Connection, OperationKind)} is the single source of
 * truth for which operator intents are legal; the engine consults it before
 * registering a request and the reducer applies the same rule when the
 * request is accepted.
 */
public final class ConnectionStateReducer
{
    /**
     * Result of applying an event to a connection.
     *
     * @param connection the updated connection (may carry new anomalies)
     * @param effects    follow-up actions for the caller
     * @param accepted   false if the event had no defined transition
     */
    public record Result(Connection connection,
                         ConnectionEffects effects,
                         boolean accepted) {}

    private final FaultSeverityPolicy faultPolicy;
    private final boolean autoCommit;
    private final boolean autoProvision;

    public ConnectionStateReducer(FaultSeverityPolicy faultPolicy,
                                  boolean autoCommit,
                                  boolean autoProvision) {
        this.faultPolicy = Objects.requireNonNull(faultPolicy, "faultPolicy");
        this.autoCommit = autoCommit;
        this.autoProvision = autoProvision;
    }

    public ConnectionStateReducer() {
        this(FaultSeverityPolicy.defaults(), false, false);
    }

    /**
     * Applies a single event to a connection.
     *
     * @throws IllegalStateException if the event type is not recognised at all
     *         (an implementation mismatch, not a runtime scenario)
     */
    public Result apply(Connection connection, NsiEvent event) {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(event, "event");

        if (connection.archived()) {
            return violation(connection, event.timestamp(), null, null,
                    event + " on archived connection");
        }

        if (event instanceof NsiRequestEvent.RequestAccepted e) {
            return onRequestAccepted(connection, e);
        }
        if (event instanceof NsiReplyEvent.ConfirmReceived e) {
            return onConfirm(connection, e);
        }
        if (event instanceof NsiReplyEvent.FaultReceived e) {
            return onFault(connection, e);
        }
        if (event instanceof NsiTimeoutEvent.TimeoutExpired e) {
            return onTimeout(connection, e);
        }
        if (event instanceof NsiNotificationEvent e) {
            return onNotification(connection, e);
        }
        if (event instanceof NsiOperatorEvent e) {
            return onOperator(connection, e);
        }

        throw new IllegalStateException("Unrecognised event type: " + event.getClass().getName());
    }

    /**
     * Checks whether an operator intent is legal for the connection's current
     * sub-states.
     *
     * @return empty if permitted, otherwise a description of the offending sub-state
     */
    public Optional<String> checkIntent(Connection c, OperationKind kind) {
        Objects.requireNonNull(c, "connection");
        Objects.requireNonNull(kind, "kind");

        if (c.archived()) {
            return Optional.of("connection is archived");
        }

        final LifecycleState lifecycle = c.lifecycle();
        final ReservationState reservation = c.reservation();
        final ProvisionState provision = c.provision();

        switch (kind) {
            case RESERVE -> {
                if (lifecycle != LifecycleState.CREATED) {
                    return lifecycleIs(c);
                }
                if (reservation != ReservationState.START) {
                    return reservationIs(c);
                }
            }
            case RESERVE_COMMIT -> {
                if (lifecycle != LifecycleState.CREATED) {
                    return lifecycleIs(c);
                }
                if (reservation != ReservationState.HELD || c.committed()) {
                    return reservationIs(c);
                }
            }
            case RESERVE_ABORT -> {
                if (lifecycle != LifecycleState.CREATED) {
                    return lifecycleIs(c);
                }
                if (provision != ProvisionState.RELEASED) {
                    return provisionIs(c);
                }
                if (reservation != ReservationState.HELD
                        && reservation != ReservationState.FAILED
                        && reservation != ReservationState.TIMEOUT) {
                    return reservationIs(c);
                }
            }
            case PROVISION -> {
                if (lifecycle != LifecycleState.CREATED) {
                    return lifecycleIs(c);
                }
                if (!c.isCommittedHeld()) {
                    return reservationIs(c);
                }
                boolean retryable = provision == ProvisionState.PROVISIONING
                        && c.isUnresolved(OperationKind.PROVISION);
                if (provision != ProvisionState.RELEASED && !retryable) {
                    return provisionIs(c);
                }
            }
            case RELEASE -> {
                if (!isOpen(lifecycle)) {
                    return lifecycleIs(c);
                }
                boolean releasable = provision == ProvisionState.PROVISIONED
                        || (provision == ProvisionState.PROVISIONING && c.isUnresolved(OperationKind.PROVISION))
                        || (provision == ProvisionState.RELEASING && c.isUnresolved(OperationKind.RELEASE));
                if (!releasable) {
                    return provisionIs(c);
                }
            }
            case TERMINATE -> {
                boolean retryable = lifecycle == LifecycleState.TERMINATING
                        && c.isUnresolved(OperationKind.TERMINATE);
                if (!isOpen(lifecycle) && !retryable) {
                    return lifecycleIs(c);
                }
            }
            case QUERY -> {
                // Status refresh is always permitted on a live record.
            }
        }
        return Optional.empty();
    }

    // ---------------------------------------------------------------------
    // Accepted requests
    // ---------------------------------------------------------------------

    private Result onRequestAccepted(Connection c, NsiRequestEvent.RequestAccepted e) {
        final Instant now = e.timestamp();
        final OperationKind kind = e.kind();

        Optional<String> rejection = checkIntent(c, kind);
        if (rejection.isPresent()) {
            return violation(c, now, kind, e.correlationId(),
                    "cannot " + kind + ": " + rejection.get());
        }

        if (kind == OperationKind.QUERY) {
            return accepted(c);
        }

        // Any new state-changing request supersedes the unresolved one.
        Connection base = c.withUnresolvedOperation(null, now);

        return switch (kind) {
            case RESERVE -> accepted(base.withReservation(ReservationState.CHECKING, now));
            case RESERVE_COMMIT -> accepted(base.withReservation(ReservationState.COMMITTING, now));
            case RESERVE_ABORT -> accepted(base.withReservation(ReservationState.ABORTING, now));
            case PROVISION -> accepted(base.withProvision(ProvisionState.PROVISIONING, now));
            case RELEASE -> accepted(base.withProvision(ProvisionState.RELEASING, now));
            case TERMINATE -> new Result(
                    base.withLifecycle(LifecycleState.TERMINATING, now),
                    ConnectionEffects.cancelPending(),
                    true);
            case QUERY -> throw new AssertionError("handled above");
        };
    }

    // ---------------------------------------------------------------------
    // Confirms
    // ---------------------------------------------------------------------

    private Result onConfirm(Connection c, NsiReplyEvent.ConfirmReceived e) {
        final Instant now = e.timestamp();

        switch (e.kind()) {
            case RESERVE -> {
                if (c.reservation() != ReservationState.CHECKING) {
                    break;
                }
                Connection held = c.withHeld(false, now);
                if (e.providerConnectionId().isPresent() && c.providerConnectionId().isEmpty()) {
                    held = held.withProviderConnectionId(e.providerConnectionId().get(), now);
                }
                return new Result(held,
                        autoCommit ? ConnectionEffects.issueReserveCommit() : ConnectionEffects.none(),
                        true);
            }
            case RESERVE_COMMIT -> {
                if (c.reservation() != ReservationState.COMMITTING) {
                    break;
                }
                return new Result(c.withHeld(true, now),
                        autoProvision ? ConnectionEffects.issueProvision() : ConnectionEffects.none(),
                        true);
            }
            case RESERVE_ABORT -> {
                if (c.reservation() != ReservationState.ABORTING) {
                    break;
                }
                return accepted(c.withReservation(ReservationState.START, now));
            }
            case PROVISION -> {
                if (c.provision() != ProvisionState.PROVISIONING) {
                    break;
                }
                return accepted(c.withProvision(ProvisionState.PROVISIONED, now));
            }
            case RELEASE -> {
                if (c.provision() != ProvisionState.RELEASING) {
                    break;
                }
                return accepted(c.withProvision(ProvisionState.RELEASED, now));
            }
            case TERMINATE -> {
                if (c.lifecycle() != LifecycleState.TERMINATING) {
                    break;
                }
                return new Result(terminated(c, now), ConnectionEffects.cancelPending(), true);
            }
            case QUERY -> {
                return onQueryConfirmed(c, e, now);
            }
        }

        return violation(c, now, e.kind(), e.correlationId(),
                "confirm of " + e.kind() + " while " + describe(c));
    }

    private Result onQueryConfirmed(Connection c, NsiReplyEvent.ConfirmReceived e, Instant now) {
        if (e.summary().isEmpty()) {
            return accepted(c);
        }
        ProviderSummary s = e.summary().get();

        Connection next = c
                .withProviderSummary(s, now)
                .withDataPlane(s.dataPlaneActive() ? DataPlaneState.UP : DataPlaneState.DOWN, now);

        // The provider's view settles an operation whose reply never arrived.
        if (next.isUnresolved(OperationKind.PROVISION) && next.provision() == ProvisionState.PROVISIONING) {
            if (s.provision() == ProvisionState.PROVISIONED || s.provision() == ProvisionState.RELEASED) {
                next = next.withProvision(s.provision(), now).withUnresolvedOperation(null, now);
            }
        }
        else if (next.isUnresolved(OperationKind.RELEASE) && next.provision() == ProvisionState.RELEASING) {
            if (s.provision() == ProvisionState.PROVISIONED || s.provision() == ProvisionState.RELEASED) {
                next = next.withProvision(s.provision(), now).withUnresolvedOperation(null, now);
            }
        }
        else if (next.isUnresolved(OperationKind.TERMINATE)
                && next.lifecycle() == LifecycleState.TERMINATING
                && s.lifecycle() == LifecycleState.TERMINATED) {
            return new Result(terminated(next, now), ConnectionEffects.cancelPending(), true);
        }

        if (s.lifecycle() != next.lifecycle()) {
            next = next.withAnomaly(new Anomaly(now, Anomaly.Type.STATUS_DIVERGENCE,
                    OperationKind.QUERY, e.correlationId(),
                    "provider reports lifecycle " + s.lifecycle() + ", local lifecycle " + next.lifecycle()));
        }
        return accepted(next);
    }

    // ---------------------------------------------------------------------
    // Faults
    // ---------------------------------------------------------------------

    private Result onFault(Connection c, NsiReplyEvent.FaultReceived e) {
        final Instant now = e.timestamp();

        Connection faulted = c.withAnomaly(new Anomaly(now, Anomaly.Type.PROVIDER_FAULT,
                e.kind(), e.correlationId(), e.reason()));

        Connection next = null;
        switch (e.kind()) {
            case RESERVE -> {
                if (c.reservation() == ReservationState.CHECKING) {
                    next = faulted.withReservation(ReservationState.FAILED, now);
                }
            }
            case RESERVE_COMMIT -> {
                if (c.reservation() == ReservationState.COMMITTING) {
                    next = faulted.withReservation(ReservationState.FAILED, now);
                }
            }
            case RESERVE_ABORT -> {
                if (c.reservation() == ReservationState.ABORTING) {
                    next = faulted.withReservation(ReservationState.FAILED, now);
                }
            }
            case PROVISION -> {
                if (c.provision() == ProvisionState.PROVISIONING) {
                    next = faulted.withProvision(ProvisionState.RELEASED, now);
                }
            }
            case RELEASE -> {
                if (c.provision() == ProvisionState.RELEASING) {
                    next = faulted.withProvision(ProvisionState.PROVISIONED, now);
                }
            }
            case TERMINATE -> {
                if (c.lifecycle() == LifecycleState.TERMINATING) {
                    next = faulted.withUnresolvedOperation(OperationKind.TERMINATE, now);
                }
            }
            case QUERY -> next = faulted;
        }

        if (next == null) {
            return violation(faulted, now, e.kind(), e.correlationId(),
                    "fault of " + e.kind() + " while " + describe(c));
        }

        if (e.kind() != OperationKind.QUERY
                && faultPolicy.isUnrecoverable(e.kind(), e.errorId())
                && next.lifecycle() == LifecycleState.CREATED) {
            next = next.withLifecycle(LifecycleState.FAILED, now);
        }
        return accepted(next);
    }

    // ---------------------------------------------------------------------
    // Timeouts
    // ---------------------------------------------------------------------

    private Result onTimeout(Connection c, NsiTimeoutEvent.TimeoutExpired e) {
        final Instant now = e.timestamp();

        if (e.kind() == OperationKind.QUERY) {
            // Idempotent: the engine decides between a retry and a stale-status report.
            return new Result(c, ConnectionEffects.retryQuery(), true);
        }

        /*
         * A state-changing request that timed out may or may not have been
         * applied by the provider. It is never retried here; the connection is
         * parked in an explicit timeout/unresolved reading until the operator
         * (or a status query) decides.
         */
        Connection timedOut = c.withAnomaly(new Anomaly(now, Anomaly.Type.OPERATION_TIMEOUT,
                e.kind(), e.correlationId(), "no reply to " + e.kind() + " before deadline"));

        Connection next = null;
        switch (e.kind()) {
            case RESERVE -> {
                if (c.reservation() == ReservationState.CHECKING) {
                    next = timedOut.withReservation(ReservationState.TIMEOUT, now);
                }
            }
            case RESERVE_COMMIT -> {
                if (c.reservation() == ReservationState.COMMITTING) {
                    next = timedOut.withReservation(ReservationState.TIMEOUT, now);
                }
            }
            case RESERVE_ABORT -> {
                if (c.reservation() == ReservationState.ABORTING) {
                    next = timedOut.withReservation(ReservationState.TIMEOUT, now);
                }
            }
            case PROVISION -> {
                if (c.provision() == ProvisionState.PROVISIONING) {
                    next = timedOut.withUnresolvedOperation(OperationKind.PROVISION, now);
                }
            }
            case RELEASE -> {
                if (c.provision() == ProvisionState.RELEASING) {
                    next = timedOut.withUnresolvedOperation(OperationKind.RELEASE, now);
                }
            }
            case TERMINATE -> {
                if (c.lifecycle() == LifecycleState.TERMINATING) {
                    next = timedOut.withUnresolvedOperation(OperationKind.TERMINATE, now);
                }
            }
            case QUERY -> throw new AssertionError("handled above");
        }

        if (next == null) {
            return violation(timedOut, now, e.kind(), e.correlationId(),
                    "timeout of " + e.kind() + " while " + describe(c));
        }
        return accepted(next);
    }

    // ---------------------------------------------------------------------
    // Notifications
    // ---------------------------------------------------------------------

    private Result onNotification(Connection c, NsiNotificationEvent event) {
        final Instant now = event.timestamp();

        if (event instanceof NsiNotificationEvent.DataPlaneStatusChanged e) {
            return accepted(c.withDataPlane(e.active() ? DataPlaneState.UP : DataPlaneState.DOWN, now));
        }

        if (event instanceof NsiNotificationEvent.ErrorEventReceived e) {
            Connection noted = c.withAnomaly(new Anomaly(now, Anomaly.Type.PROVIDER_ERROR_EVENT,
                    null, null, e.errorId().map(id -> id + ": ").orElse("") + e.text()));
            if (c.lifecycle() == LifecycleState.CREATED) {
                return accepted(noted.withLifecycle(LifecycleState.FAILED, now));
            }
            return accepted(noted);
        }

        if (event instanceof NsiNotificationEvent.ReserveTimeoutReceived) {
            if (c.reservation() == ReservationState.HELD && !c.committed()) {
                Connection noted = c.withAnomaly(new Anomaly(now, Anomaly.Type.OPERATION_TIMEOUT,
                        null, null, "provider released the uncommitted hold"));
                return accepted(noted.withReservation(ReservationState.TIMEOUT, now));
            }
            return violation(c, now, null, null, "reserve timeout while " + describe(c));
        }

        if (event instanceof NsiNotificationEvent.PassedEndTime) {
            LifecycleState lifecycle = c.lifecycle();
            if (lifecycle == LifecycleState.PASSED_END_TIME) {
                // Reported both locally and by the provider; the second report is a no-op.
                return accepted(c);
            }
            if (lifecycle.canAdvanceTo(LifecycleState.PASSED_END_TIME)) {
                return accepted(c.withLifecycle(LifecycleState.PASSED_END_TIME, now));
            }
            return violation(c, now, null, null, "passed end time while " + describe(c));
        }

        throw new IllegalStateException("Unrecognised notification: " + event.getClass().getName());
    }

    // ---------------------------------------------------------------------
    // Operator actions
    // ---------------------------------------------------------------------

    private Result onOperator(Connection c, NsiOperatorEvent event) {
        final Instant now = event.timestamp();

        if (event instanceof NsiOperatorEvent.ForcedTermination) {
            if (c.lifecycle() == LifecycleState.TERMINATED) {
                return violation(c, now, OperationKind.TERMINATE, null, "forced termination while " + describe(c));
            }
            return new Result(terminated(c, now), ConnectionEffects.cancelPending(), true);
        }

        if (event instanceof NsiOperatorEvent.ArchiveRequested) {
            if (c.lifecycle() != LifecycleState.TERMINATED) {
                return violation(c, now, null, null, "archive while " + describe(c));
            }
            return accepted(c.withArchived(now));
        }

        throw new IllegalStateException("Unrecognised operator event: " + event.getClass().getName());
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    /**
     * Terminal reading: provision released, data plane down, nothing
     * unresolved. A reservation that still holds or awaits resources reads
     * FAILED (and uncommitted); START, FAILED and TIMEOUT already hold nothing
     * and are kept.
     */
    private static Connection terminated(Connection c, Instant now) {
        Connection next = c
                .withLifecycle(LifecycleState.TERMINATED, now)
                .withProvision(ProvisionState.RELEASED, now)
                .withDataPlane(DataPlaneState.DOWN, now)
                .withUnresolvedOperation(null, now);
        if (holdsOrAwaitsResources(next.reservation())) {
            next = next.withReservation(ReservationState.FAILED, now);
        }
        return next;
    }

    private static boolean holdsOrAwaitsResources(ReservationState reservation) {
        return reservation == ReservationState.HELD || reservation.isTransient();
    }

    private static boolean isOpen(LifecycleState lifecycle) {
        return lifecycle == LifecycleState.CREATED
                || lifecycle == LifecycleState.FAILED
                || lifecycle == LifecycleState.PASSED_END_TIME;
    }

    private static Result accepted(Connection c) {
        return new Result(c, ConnectionEffects.none(), true);
    }

    private static Result violation(Connection c,
                                    Instant now,
                                    OperationKind kind,
                                    String correlationId,
                                    String detail) {
        Connection noted = c.withAnomaly(new Anomaly(now, Anomaly.Type.INVALID_TRANSITION,
                kind, correlationId, detail));
        return new Result(noted, ConnectionEffects.none(), false);
    }

    private static Optional<String> lifecycleIs(Connection c) {
        return Optional.of("Lifecycle is " + c.lifecycle());
    }

    private static Optional<String> reservationIs(Connection c) {
        return Optional.of("Reservation is " + reservationLabel(c));
    }

    private static Optional<String> provisionIs(Connection c) {
        String suffix = c.unresolvedOperation().map(k -> " (" + k + " unresolved)").orElse("");
        return Optional.of("Provision is " + c.provision() + suffix);
    }

    private static String reservationLabel(Connection c) {
        if (c.reservation() == ReservationState.HELD) {
            return c.committed() ? "HELD (committed)" : "HELD (uncommitted)";
        }
        return c.reservation().name();
    }

    static String describe(Connection c) {
        return "Reservation " + reservationLabel(c)
                + ", Provision " + c.provision()
                + ", Lifecycle " + c.lifecycle();
    }
}
