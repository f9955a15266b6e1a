package com.questrail.circuit.protocol.nsi.internal.state;

import com.questrail.circuit.api.Anomaly;
import com.questrail.circuit.api.DataPlaneState;
import com.questrail.circuit.api.LifecycleState;
import com.questrail.circuit.api.OperationKind;
import com.questrail.circuit.api.ProvisionState;
import com.questrail.circuit.api.ReservationState;
import com.questrail.circuit.api.ServiceParameters;
import com.questrail.circuit.protocol.nsi.internal.events.NsiEvent;
import com.questrail.circuit.protocol.nsi.internal.events.NsiNotificationEvent;
import com.questrail.circuit.protocol.nsi.internal.events.NsiOperatorEvent;
import com.questrail.circuit.protocol.nsi.internal.events.NsiReplyEvent;
import com.questrail.circuit.protocol.nsi.internal.events.NsiRequestEvent;
import com.questrail.circuit.protocol.nsi.internal.events.NsiTimeoutEvent;
import com.questrail.circuit.protocol.nsi.model.ProviderSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConnectionStateReducerTest
 * -----------------------------------------------------------------------------
 * Unit tests for the pure connection state reducer.
 *
 * These tests deliberately:
 * <ul>
 *   <li>do not involve the correlation tracker</li>
 *   <li>do not involve timers</li>
 *   <li>do not involve threading</li>
 * </ul>
 *
 * They validate that, given a connection and an event, the reducer produces
 * the correct next sub-states, anomalies and effects.
 */
class ConnectionStateReducerTest {

    private static final ServiceParameters PARAMS = new ServiceParameters(
            "urn:ogf:network:a.example:2024:port-1", "urn:ogf:network:b.example:2024:port-7",
            100, 200, 1000, null, null);

    private ConnectionStateReducer reducer;
    private Instant now;
    private int correlation;

    @BeforeEach
    void setUp() {
        reducer = new ConnectionStateReducer();
        now = Instant.parse("2026-03-01T10:00:00Z");
        correlation = 0;
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private Connection fresh() {
        return Connection.created("conn-1", "test circuit", PARAMS, now);
    }

    private String nextCorrelation() {
        return "urn:uuid:test-" + (++correlation);
    }

    private Connection step(Connection c, NsiEvent event) {
        ConnectionStateReducer.Result result = reducer.apply(c, event);
        assertTrue(result.accepted(), () -> event + " should be accepted from " + c);
        return result.connection();
    }

    private Connection request(Connection c, OperationKind kind) {
        return step(c, new NsiRequestEvent.RequestAccepted(now, kind, nextCorrelation()));
    }

    private Connection confirm(Connection c, OperationKind kind) {
        return step(c, new NsiReplyEvent.ConfirmReceived(now, kind, "urn:uuid:c"));
    }

    private Connection held(boolean committed) {
        Connection c = request(fresh(), OperationKind.RESERVE);
        c = step(c, new NsiReplyEvent.ConfirmReceived(now, OperationKind.RESERVE, "urn:uuid:c", "prov-1", null));
        if (committed) {
            c = confirm(request(c, OperationKind.RESERVE_COMMIT), OperationKind.RESERVE_COMMIT);
        }
        return c;
    }

    private Connection provisioned() {
        return confirm(request(held(true), OperationKind.PROVISION), OperationKind.PROVISION);
    }

    // ---------------------------------------------------------------------
    // Reservation
    // ---------------------------------------------------------------------

    @Test
    void reserveRequestMovesStartToChecking() {
        Connection c = request(fresh(), OperationKind.RESERVE);

        assertEquals(ReservationState.CHECKING, c.reservation());
        assertEquals(ProvisionState.RELEASED, c.provision());
        assertEquals(LifecycleState.CREATED, c.lifecycle());
    }

    @Test
    void reserveConfirmHoldsAndRecordsProviderId() {
        Connection c = held(false);

        assertEquals(ReservationState.HELD, c.reservation());
        assertFalse(c.committed());
        assertEquals(Optional.of("prov-1"), c.providerConnectionId());
    }

    @Test
    void reserveFaultFailsReservationWithReason() {
        Connection c = request(fresh(), OperationKind.RESERVE);

        ConnectionStateReducer.Result result = reducer.apply(c,
                new NsiReplyEvent.FaultReceived(now, OperationKind.RESERVE, "urn:uuid:c", "00702", "no path"));

        assertTrue(result.accepted());
        assertEquals(ReservationState.FAILED, result.connection().reservation());
        assertEquals(LifecycleState.CREATED, result.connection().lifecycle());

        Anomaly anomaly = result.connection().anomalies().get(0);
        assertEquals(Anomaly.Type.PROVIDER_FAULT, anomaly.type());
        assertEquals("no path", anomaly.detail());
    }

    @Test
    void reserveTimeoutMovesCheckingToTimeout() {
        Connection c = request(fresh(), OperationKind.RESERVE);

        Connection next = step(c, new NsiTimeoutEvent.TimeoutExpired(now, OperationKind.RESERVE, "urn:uuid:c"));

        assertEquals(ReservationState.TIMEOUT, next.reservation());
        assertEquals(Anomaly.Type.OPERATION_TIMEOUT, next.anomalies().get(0).type());
    }

    @Test
    void commitFlowSetsCommittedFlag() {
        Connection c = request(held(false), OperationKind.RESERVE_COMMIT);
        assertEquals(ReservationState.COMMITTING, c.reservation());
        assertFalse(c.committed());

        c = confirm(c, OperationKind.RESERVE_COMMIT);

        assertEquals(ReservationState.HELD, c.reservation());
        assertTrue(c.committed());
        assertTrue(c.isCommittedHeld());
    }

    @Test
    void commitTwiceIsRejected() {
        Optional<String> rejection = reducer.checkIntent(held(true), OperationKind.RESERVE_COMMIT);

        assertEquals(Optional.of("Reservation is HELD (committed)"), rejection);
    }

    @Test
    void abortReturnsHeldReservationToStart() {
        Connection c = request(held(true), OperationKind.RESERVE_ABORT);
        assertEquals(ReservationState.ABORTING, c.reservation());
        assertFalse(c.committed());

        c = confirm(c, OperationKind.RESERVE_ABORT);

        assertEquals(ReservationState.START, c.reservation());
        assertTrue(reducer.checkIntent(c, OperationKind.RESERVE).isEmpty(), "reserve again after abort");
    }

    @Test
    void failedReservationCanBeAbortedAndReservedAgain() {
        Connection c = request(fresh(), OperationKind.RESERVE);
        c = step(c, new NsiReplyEvent.FaultReceived(now, OperationKind.RESERVE, "urn:uuid:c", null, "busy"));

        assertTrue(reducer.checkIntent(c, OperationKind.RESERVE).isPresent());
        assertTrue(reducer.checkIntent(c, OperationKind.RESERVE_ABORT).isEmpty());

        c = confirm(request(c, OperationKind.RESERVE_ABORT), OperationKind.RESERVE_ABORT);
        c = request(c, OperationKind.RESERVE);

        assertEquals(ReservationState.CHECKING, c.reservation());
    }

    @Test
    void abortIsRefusedWhileProvisioned() {
        Optional<String> rejection = reducer.checkIntent(provisioned(), OperationKind.RESERVE_ABORT);

        assertEquals(Optional.of("Provision is PROVISIONED"), rejection);
    }

    // ---------------------------------------------------------------------
    // Provision
    // ---------------------------------------------------------------------

    @Test
    void provisionRequiresCommittedReservation() {
        assertEquals(Optional.of("Reservation is HELD (uncommitted)"),
                reducer.checkIntent(held(false), OperationKind.PROVISION));
        assertEquals(Optional.of("Reservation is START"),
                reducer.checkIntent(fresh(), OperationKind.PROVISION));
        assertTrue(reducer.checkIntent(held(true), OperationKind.PROVISION).isEmpty());
    }

    @Test
    void provisionAndReleaseRoundTrip() {
        Connection c = provisioned();
        assertEquals(ProvisionState.PROVISIONED, c.provision());

        c = request(c, OperationKind.RELEASE);
        assertEquals(ProvisionState.RELEASING, c.provision());

        c = confirm(c, OperationKind.RELEASE);
        assertEquals(ProvisionState.RELEASED, c.provision());
        assertTrue(c.isCommittedHeld());
    }

    @Test
    void provisionFaultLeavesProvisionReleased() {
        Connection c = request(held(true), OperationKind.PROVISION);

        Connection next = step(c, new NsiReplyEvent.FaultReceived(
                now, OperationKind.PROVISION, "urn:uuid:c", null, "resource_unavailable"));

        assertEquals(ProvisionState.RELEASED, next.provision());
        assertEquals(LifecycleState.CREATED, next.lifecycle());
        assertEquals("resource_unavailable", next.anomalies().get(0).detail());
    }

    @Test
    void provisionTimeoutMarksOperationUnresolved() {
        Connection c = request(held(true), OperationKind.PROVISION);

        Connection next = step(c, new NsiTimeoutEvent.TimeoutExpired(now, OperationKind.PROVISION, "urn:uuid:c"));

        assertEquals(ProvisionState.PROVISIONING, next.provision());
        assertEquals(Optional.of(OperationKind.PROVISION), next.unresolvedOperation());
        assertTrue(reducer.checkIntent(next, OperationKind.PROVISION).isEmpty(), "provision may be re-issued");
        assertTrue(reducer.checkIntent(next, OperationKind.RELEASE).isEmpty(), "or backed out");
    }

    @Test
    void acceptedRequestClearsUnresolvedMarker() {
        Connection c = request(held(true), OperationKind.PROVISION);
        c = step(c, new NsiTimeoutEvent.TimeoutExpired(now, OperationKind.PROVISION, "urn:uuid:c"));

        Connection next = request(c, OperationKind.RELEASE);

        assertEquals(ProvisionState.RELEASING, next.provision());
        assertTrue(next.unresolvedOperation().isEmpty());
    }

    @Test
    void releaseFaultIsUnrecoverableByDefault() {
        Connection c = request(provisioned(), OperationKind.RELEASE);

        Connection next = step(c, new NsiReplyEvent.FaultReceived(
                now, OperationKind.RELEASE, "urn:uuid:c", null, "switch unreachable"));

        assertEquals(ProvisionState.PROVISIONED, next.provision());
        assertEquals(LifecycleState.FAILED, next.lifecycle());
    }

    @Test
    void lenientPolicyKeepsLifecycleOnReleaseFault() {
        reducer = new ConnectionStateReducer(FaultSeverityPolicy.lenient(), false, false);
        Connection c = request(provisioned(), OperationKind.RELEASE);

        Connection next = step(c, new NsiReplyEvent.FaultReceived(
                now, OperationKind.RELEASE, "urn:uuid:c", null, "switch unreachable"));

        assertEquals(LifecycleState.CREATED, next.lifecycle());
    }

    @Test
    void unrecoverableErrorIdFailsLifecycleForAnyOperation() {
        reducer = new ConnectionStateReducer(new FaultSeverityPolicy(Set.of(), Set.of("00500")), false, false);
        Connection c = request(held(true), OperationKind.PROVISION);

        Connection next = step(c, new NsiReplyEvent.FaultReceived(
                now, OperationKind.PROVISION, "urn:uuid:c", "00500", "internal error"));

        assertEquals(ProvisionState.RELEASED, next.provision());
        assertEquals(LifecycleState.FAILED, next.lifecycle());
    }

    @Test
    void releaseIsAllowedAfterLifecycleFailed() {
        Connection c = step(provisioned(), new NsiNotificationEvent.ErrorEventReceived(now, null, "forwarding failed"));
        assertEquals(LifecycleState.FAILED, c.lifecycle());

        assertTrue(reducer.checkIntent(c, OperationKind.RELEASE).isEmpty());
        assertEquals(Optional.of("Lifecycle is FAILED"), reducer.checkIntent(c, OperationKind.PROVISION));
    }

    // ---------------------------------------------------------------------
    // Termination
    // ---------------------------------------------------------------------

    @Test
    void terminateRequestCancelsOtherPendingWork() {
        Connection c = request(held(true), OperationKind.PROVISION);

        ConnectionStateReducer.Result result = reducer.apply(c,
                new NsiRequestEvent.RequestAccepted(now, OperationKind.TERMINATE, nextCorrelation()));

        assertTrue(result.accepted());
        assertEquals(LifecycleState.TERMINATING, result.connection().lifecycle());
        assertTrue(result.effects().contains(ConnectionEffects.Kind.CANCEL_PENDING));
    }

    @Test
    void terminateConfirmForcesTerminalReading() {
        Connection c = step(provisioned(), new NsiNotificationEvent.DataPlaneStatusChanged(now, true));
        c = request(c, OperationKind.TERMINATE);

        ConnectionStateReducer.Result result = reducer.apply(c,
                new NsiReplyEvent.ConfirmReceived(now, OperationKind.TERMINATE, "urn:uuid:c"));

        Connection terminated = result.connection();
        assertEquals(LifecycleState.TERMINATED, terminated.lifecycle());
        assertEquals(ProvisionState.RELEASED, terminated.provision());
        assertEquals(DataPlaneState.DOWN, terminated.dataPlane());
        assertEquals(ReservationState.FAILED, terminated.reservation());
        assertFalse(terminated.committed());
        assertFalse(terminated.isCommittedHeld());
        assertTrue(result.effects().contains(ConnectionEffects.Kind.CANCEL_PENDING));
    }

    @Test
    void terminateConfirmReleasesUncommittedHold() {
        Connection c = request(held(false), OperationKind.TERMINATE);

        Connection next = confirm(c, OperationKind.TERMINATE);

        assertEquals(ReservationState.FAILED, next.reservation());
        assertFalse(next.committed());
    }

    @Test
    void terminateConfirmKeepsReservationThatHoldsNothing() {
        Connection timedOut = step(request(fresh(), OperationKind.RESERVE),
                new NsiTimeoutEvent.TimeoutExpired(now, OperationKind.RESERVE, "urn:uuid:test-1"));
        Connection next = confirm(request(timedOut, OperationKind.TERMINATE), OperationKind.TERMINATE);
        assertEquals(ReservationState.TIMEOUT, next.reservation());

        Connection neverReserved = step(fresh(), new NsiOperatorEvent.ForcedTermination(now));
        assertEquals(ReservationState.START, neverReserved.reservation());
    }

    @Test
    void terminateConfirmFailsTransientReservation() {
        Connection c = request(fresh(), OperationKind.RESERVE);
        c = request(c, OperationKind.TERMINATE);

        Connection next = confirm(c, OperationKind.TERMINATE);

        assertEquals(ReservationState.FAILED, next.reservation());
        assertEquals(LifecycleState.TERMINATED, next.lifecycle());
    }

    @Test
    void terminateFaultLeavesTerminatingUnresolved() {
        Connection c = request(held(true), OperationKind.TERMINATE);

        Connection next = step(c, new NsiReplyEvent.FaultReceived(
                now, OperationKind.TERMINATE, "urn:uuid:c", null, "try later"));

        assertEquals(LifecycleState.TERMINATING, next.lifecycle());
        assertEquals(Optional.of(OperationKind.TERMINATE), next.unresolvedOperation());
        assertTrue(reducer.checkIntent(next, OperationKind.TERMINATE).isEmpty());
        assertTrue(reducer.checkIntent(c, OperationKind.TERMINATE).isPresent(), "not while the first is in flight");
    }

    @Test
    void forcedTerminationDrivesAnyLifecycleToTerminated() {
        Connection c = request(held(true), OperationKind.PROVISION);

        ConnectionStateReducer.Result result = reducer.apply(c, new NsiOperatorEvent.ForcedTermination(now));

        assertTrue(result.accepted());
        assertEquals(LifecycleState.TERMINATED, result.connection().lifecycle());
        assertEquals(ProvisionState.RELEASED, result.connection().provision());
        assertEquals(ReservationState.FAILED, result.connection().reservation());
        assertFalse(result.connection().committed());
        assertTrue(result.effects().contains(ConnectionEffects.Kind.CANCEL_PENDING));
    }

    @Test
    void archiveOnlyAfterTermination() {
        ConnectionStateReducer.Result early = reducer.apply(held(false), new NsiOperatorEvent.ArchiveRequested(now));
        assertFalse(early.accepted());

        Connection terminated = step(held(false), new NsiOperatorEvent.ForcedTermination(now));
        Connection archived = step(terminated, new NsiOperatorEvent.ArchiveRequested(now));

        assertTrue(archived.archived());
        assertEquals(Optional.of("connection is archived"), reducer.checkIntent(archived, OperationKind.QUERY));
    }

    @Test
    void archivedConnectionRejectsEveryEvent() {
        Connection archived = step(step(fresh(), new NsiOperatorEvent.ForcedTermination(now)),
                new NsiOperatorEvent.ArchiveRequested(now));

        ConnectionStateReducer.Result result = reducer.apply(archived,
                new NsiNotificationEvent.DataPlaneStatusChanged(now, true));

        assertFalse(result.accepted());
        assertEquals(DataPlaneState.DOWN, result.connection().dataPlane());
    }

    // ---------------------------------------------------------------------
    // Notifications
    // ---------------------------------------------------------------------

    @Test
    void passedEndTimeKeepsDataPlaneProvisioned() {
        Connection c = step(provisioned(), new NsiNotificationEvent.PassedEndTime(now));

        assertEquals(LifecycleState.PASSED_END_TIME, c.lifecycle());
        assertEquals(ProvisionState.PROVISIONED, c.provision());
        assertTrue(reducer.checkIntent(c, OperationKind.RELEASE).isEmpty());
        assertTrue(reducer.checkIntent(c, OperationKind.TERMINATE).isEmpty());
    }

    @Test
    void secondPassedEndTimeIsNoOp() {
        Connection once = step(held(true), new NsiNotificationEvent.PassedEndTime(now));

        ConnectionStateReducer.Result twice = reducer.apply(once, new NsiNotificationEvent.PassedEndTime(now));

        assertTrue(twice.accepted());
        assertTrue(twice.connection().anomalies().isEmpty());
    }

    @Test
    void lifecycleNeverMovesBackwards() {
        Connection c = step(held(true), new NsiNotificationEvent.PassedEndTime(now));

        Connection next = step(c, new NsiNotificationEvent.ErrorEventReceived(now, "00800", "late error"));

        assertEquals(LifecycleState.PASSED_END_TIME, next.lifecycle());
        assertEquals(Anomaly.Type.PROVIDER_ERROR_EVENT, next.anomalies().get(0).type());
        assertEquals("00800: late error", next.anomalies().get(0).detail());
    }

    @Test
    void passedEndTimeAfterTerminationIsInvalid() {
        Connection terminated = step(held(true), new NsiOperatorEvent.ForcedTermination(now));

        ConnectionStateReducer.Result result = reducer.apply(terminated, new NsiNotificationEvent.PassedEndTime(now));

        assertFalse(result.accepted());
        assertEquals(LifecycleState.TERMINATED, result.connection().lifecycle());
        assertEquals(Anomaly.Type.INVALID_TRANSITION, result.connection().anomalies().get(0).type());
    }

    @Test
    void reserveTimeoutNotificationExpiresUncommittedHold() {
        Connection c = step(held(false), new NsiNotificationEvent.ReserveTimeoutReceived(now));
        assertEquals(ReservationState.TIMEOUT, c.reservation());

        ConnectionStateReducer.Result committed = reducer.apply(held(true),
                new NsiNotificationEvent.ReserveTimeoutReceived(now));
        assertFalse(committed.accepted());
        assertEquals(ReservationState.HELD, committed.connection().reservation());
    }

    @Test
    void dataPlaneChangesAreAdvisory() {
        Connection c = step(fresh(), new NsiNotificationEvent.DataPlaneStatusChanged(now, true));

        assertEquals(DataPlaneState.UP, c.dataPlane());
        assertEquals(ReservationState.START, c.reservation());
        assertEquals(ProvisionState.RELEASED, c.provision());
    }

    // ---------------------------------------------------------------------
    // Invalid transitions
    // ---------------------------------------------------------------------

    @Test
    void confirmWithoutRequestIsRecordedNotApplied() {
        Connection c = fresh();

        ConnectionStateReducer.Result result = reducer.apply(c,
                new NsiReplyEvent.ConfirmReceived(now, OperationKind.RESERVE_COMMIT, "urn:uuid:x"));

        assertFalse(result.accepted());
        assertTrue(c.sameSubStates(result.connection()));
        Anomaly anomaly = result.connection().anomalies().get(0);
        assertEquals(Anomaly.Type.INVALID_TRANSITION, anomaly.type());
        assertEquals(Optional.of("urn:uuid:x"), anomaly.correlation());
        assertTrue(result.effects().isEmpty());
    }

    @Test
    void illegalRequestIsRecordedNotApplied() {
        ConnectionStateReducer.Result result = reducer.apply(fresh(),
                new NsiRequestEvent.RequestAccepted(now, OperationKind.PROVISION, "urn:uuid:x"));

        assertFalse(result.accepted());
        assertEquals(ProvisionState.RELEASED, result.connection().provision());
        assertTrue(result.connection().anomalies().get(0).detail().contains("Reservation is START"));
    }

    @Test
    void unrecognisedEventTypeIsADefect() {
        NsiEvent alien = new NsiEvent.Base(now) {};

        assertThrows(IllegalStateException.class, () -> reducer.apply(fresh(), alien));
    }

    // ---------------------------------------------------------------------
    // Query
    // ---------------------------------------------------------------------

    @Test
    void queryTimeoutAsksForRetryWithoutChangingState() {
        Connection c = held(true);

        ConnectionStateReducer.Result result = reducer.apply(c,
                new NsiTimeoutEvent.TimeoutExpired(now, OperationKind.QUERY, "urn:uuid:q"));

        assertTrue(result.accepted());
        assertTrue(result.effects().contains(ConnectionEffects.Kind.RETRY_QUERY));
        assertTrue(c.sameSubStates(result.connection()));
    }

    @Test
    void querySummarySettlesUnresolvedProvision() {
        Connection c = request(held(true), OperationKind.PROVISION);
        c = step(c, new NsiTimeoutEvent.TimeoutExpired(now, OperationKind.PROVISION, "urn:uuid:c"));

        ProviderSummary summary = new ProviderSummary(
                ReservationState.HELD, ProvisionState.PROVISIONED, LifecycleState.CREATED, true);
        Connection next = step(c, new NsiReplyEvent.ConfirmReceived(now, OperationKind.QUERY, "urn:uuid:q", null, summary));

        assertEquals(ProvisionState.PROVISIONED, next.provision());
        assertTrue(next.unresolvedOperation().isEmpty());
        assertEquals(DataPlaneState.UP, next.dataPlane());
        assertEquals(Optional.of(summary), next.providerSummary());
    }

    @Test
    void querySummaryReportsLifecycleDivergence() {
        ProviderSummary summary = new ProviderSummary(
                ReservationState.HELD, ProvisionState.RELEASED, LifecycleState.TERMINATED, false);

        Connection next = step(held(true),
                new NsiReplyEvent.ConfirmReceived(now, OperationKind.QUERY, "urn:uuid:q", null, summary));

        assertEquals(LifecycleState.CREATED, next.lifecycle());
        assertEquals(Anomaly.Type.STATUS_DIVERGENCE, next.anomalies().get(0).type());
    }

    @Test
    void queryFaultOnlyRecordsAnomaly() {
        reducer = new ConnectionStateReducer(new FaultSeverityPolicy(Set.of(), Set.of("00500")), false, false);
        Connection c = held(true);

        Connection next = step(c, new NsiReplyEvent.FaultReceived(now, OperationKind.QUERY, "urn:uuid:q", "00500", "oops"));

        assertTrue(c.sameSubStates(next));
        assertEquals(Anomaly.Type.PROVIDER_FAULT, next.anomalies().get(0).type());
    }

    // ---------------------------------------------------------------------
    // Auto-advance
    // ---------------------------------------------------------------------

    @Test
    void autoCommitAndAutoProvisionEmitFollowUps() {
        reducer = new ConnectionStateReducer(FaultSeverityPolicy.defaults(), true, true);

        ConnectionStateReducer.Result reserved = reducer.apply(request(fresh(), OperationKind.RESERVE),
                new NsiReplyEvent.ConfirmReceived(now, OperationKind.RESERVE, "urn:uuid:c", "prov-1", null));
        assertTrue(reserved.effects().contains(ConnectionEffects.Kind.ISSUE_RESERVE_COMMIT));

        ConnectionStateReducer.Result committed = reducer.apply(
                request(reserved.connection(), OperationKind.RESERVE_COMMIT),
                new NsiReplyEvent.ConfirmReceived(now, OperationKind.RESERVE_COMMIT, "urn:uuid:c"));
        assertTrue(committed.effects().contains(ConnectionEffects.Kind.ISSUE_PROVISION));
    }

    @Test
    void autoAdvanceIsOffByDefault() {
        ConnectionStateReducer.Result reserved = reducer.apply(request(fresh(), OperationKind.RESERVE),
                new NsiReplyEvent.ConfirmReceived(now, OperationKind.RESERVE, "urn:uuid:c"));

        assertTrue(reserved.effects().isEmpty());
    }
}
