package com.questrail.circuit.protocol.nsi;

import com.questrail.circuit.api.Anomaly;
import com.questrail.circuit.api.CircuitRequester;
import com.questrail.circuit.api.ConnectionStatus;
import com.questrail.circuit.api.LifecycleState;
import com.questrail.circuit.api.OperationKind;
import com.questrail.circuit.api.ServiceParameters;
import com.questrail.circuit.protocol.nsi.config.NsiRequesterConfig;
import com.questrail.circuit.protocol.nsi.internal.correlation.CorrelationTracker;
import com.questrail.circuit.protocol.nsi.internal.correlation.OperationFamily;
import com.questrail.circuit.protocol.nsi.internal.correlation.PendingOperation;
import com.questrail.circuit.protocol.nsi.internal.events.NsiEvent;
import com.questrail.circuit.protocol.nsi.internal.events.NsiNotificationEvent;
import com.questrail.circuit.protocol.nsi.internal.events.NsiOperatorEvent;
import com.questrail.circuit.protocol.nsi.internal.events.NsiReplyEvent;
import com.questrail.circuit.protocol.nsi.internal.events.NsiRequestEvent;
import com.questrail.circuit.protocol.nsi.internal.events.NsiTimeoutEvent;
import com.questrail.circuit.protocol.nsi.internal.exec.ConnectionLocks;
import com.questrail.circuit.protocol.nsi.internal.exec.QueryRetryTracker;
import com.questrail.circuit.protocol.nsi.internal.exec.TimeoutManager;
import com.questrail.circuit.protocol.nsi.internal.state.Connection;
import com.questrail.circuit.protocol.nsi.internal.state.ConnectionEffects;
import com.questrail.circuit.protocol.nsi.internal.state.ConnectionStateReducer;
import com.questrail.circuit.protocol.nsi.internal.time.MonotonicClock;
import com.questrail.circuit.protocol.nsi.internal.time.WallClock;
import com.questrail.circuit.protocol.nsi.model.ProviderMessage;
import com.questrail.circuit.protocol.nsi.model.ProviderRequest;
import com.questrail.circuit.protocol.nsi.observability.ConnectionTransitionEvent;
import com.questrail.circuit.protocol.nsi.observability.NsiAnomalyEvent;
import com.questrail.circuit.protocol.nsi.observability.NsiErrorEvent;
import com.questrail.circuit.protocol.nsi.observability.NsiObservabilitySink;
import com.questrail.circuit.protocol.nsi.observability.NsiProtocolEvent;
import com.questrail.circuit.protocol.nsi.observability.NullObservabilitySink;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * NsiProtocolEngine
 * =============================================================================
 * Orchestrator of the requester: turns operator intents into provider
 * requests and provider messages into connection transitions.
 *
 * <h2>Outbound intents</h2>
 * Each intent, under the connection's lock:
 * <ol>
 *   <li>loads the connection and checks the intent against its sub-states
 *       ({@link InvalidTransitionException} otherwise)</li>
 *   <li>registers a pending operation ({@link ConflictingOperationException}
 *       if one of the same family is outstanding)</li>
 *   <li>applies the accepted request, saves, and arms the reply deadline</li>
 *   <li>hands the request to the {@link ProviderMessageEmitter}</li>
 * </ol>
 * The connection is saved before the request leaves, so a reply delivered
 * synchronously by the emitter already finds the in-flight sub-state. If the
 * emitter fails, the registration and deadline are withdrawn and the saved
 * record is restored ({@link MessageDeliveryException}).
 *
 * <h2>Inbound messages</h2>
 * Replies are matched by correlation id. Only a reply that resolves a live
 * pending operation reaches the reducer; unknown and already resolved ids are
 * recorded as anomalies and discarded. Notifications are routed by the
 * provider-assigned connection id.
 *
 * <h2>Timeouts</h2>
 * {@link #sweep()} drains expired deadlines from the {@link TimeoutManager}.
 * A reply deadline goes through the same single resolution as a reply, so of
 * a confirm and a timeout racing for one request exactly one is applied.
 *
 * <h2>Concurrency</h2>
 * All work on one connection is serialised by a per-connection lock that is
 * held until the resulting record has been saved. Different connections
 * proceed in parallel. No method blocks waiting for a provider.
 */
public final class NsiProtocolEngine implements CircuitRequester
{
    private static final Duration MAX_END_TIME_HORIZON = Duration.ofDays(365L * 100);

    private final NsiRequesterConfig config;
    private final ConnectionRepository repository;
    private final ProviderMessageEmitter emitter;
    private final CorrelationTracker tracker;
    private final TimeoutManager timeouts;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final NsiObservabilitySink sink;
    private final Supplier<String> connectionIds;

    private final ConnectionStateReducer reducer;
    private final QueryRetryTracker queryRetries;
    private final ConnectionLocks locks = new ConnectionLocks();

    public NsiProtocolEngine(NsiRequesterConfig config,
                             ConnectionRepository repository,
                             ProviderMessageEmitter emitter,
                             CorrelationTracker tracker,
                             TimeoutManager timeouts,
                             MonotonicClock clock,
                             WallClock wallClock,
                             NsiObservabilitySink sink,
                             Supplier<String> connectionIds)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.emitter = Objects.requireNonNull(emitter, "emitter");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
        this.connectionIds = Objects.requireNonNull(connectionIds, "connectionIds");

        this.reducer = new ConnectionStateReducer(config.faultPolicy(), config.autoCommit(), config.autoProvision());
        this.queryRetries = new QueryRetryTracker(config.timingPolicy());
    }

    /**
     * Engine with its own correlation tracker and timeout table, and
     * {@code urn:uuid:} connection ids.
     */
    public NsiProtocolEngine(NsiRequesterConfig config,
                             ConnectionRepository repository,
                             ProviderMessageEmitter emitter,
                             MonotonicClock clock,
                             WallClock wallClock,
                             NsiObservabilitySink sink)
    {
        this(config, repository, emitter,
                new CorrelationTracker(config.resolvedMemory()),
                new TimeoutManager(),
                clock, wallClock, sink,
                CorrelationTracker::newCorrelationId);
    }

    // ---------------------------------------------------------------------
    // Operator intents
    // ---------------------------------------------------------------------

    @Override
    public IssuedRequest reserve(String description, ServiceParameters parameters) {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(parameters, "parameters");

        String connectionId = connectionIds.get();
        Connection created = Connection.created(connectionId, description, parameters, wallClock.now());

        return locks.withLock(connectionId, () -> {
            if (repository.load(connectionId).isPresent()) {
                throw defect("Connection id generator repeated " + connectionId, null);
            }
            repository.save(created);
            scheduleEndTime(created);
            return issue(connectionId, OperationKind.RESERVE, 1);
        });
    }

    @Override
    public IssuedRequest reserveAgain(String connectionId) {
        return issueLocked(connectionId, OperationKind.RESERVE);
    }

    @Override
    public IssuedRequest reserveCommit(String connectionId) {
        return issueLocked(connectionId, OperationKind.RESERVE_COMMIT);
    }

    @Override
    public IssuedRequest reserveAbort(String connectionId) {
        return issueLocked(connectionId, OperationKind.RESERVE_ABORT);
    }

    @Override
    public IssuedRequest provision(String connectionId) {
        return issueLocked(connectionId, OperationKind.PROVISION);
    }

    @Override
    public IssuedRequest release(String connectionId) {
        return issueLocked(connectionId, OperationKind.RELEASE);
    }

    @Override
    public IssuedRequest terminate(String connectionId) {
        return issueLocked(connectionId, OperationKind.TERMINATE);
    }

    @Override
    public IssuedRequest query(String connectionId) {
        return locks.withLock(connectionId, () -> {
            // An operator query starts a fresh retry budget.
            queryRetries.reset(connectionId);
            timeouts.cancelRetry(connectionId);
            return issue(connectionId, OperationKind.QUERY, 1);
        });
    }

    @Override
    public Optional<ConnectionStatus> status(String connectionId) {
        Objects.requireNonNull(connectionId, "connectionId");
        return repository.load(connectionId).map(Connection::status);
    }

    /**
     * Operator-forced cleanup: drives the connection to terminated locally,
     * without a terminate exchange, and cancels everything still pending.
     *
     * @throws InvalidTransitionException if the connection is already terminated
     */
    public ConnectionStatus forceTerminate(String connectionId) {
        return locks.withLock(connectionId, () -> {
            Connection current = load(connectionId);
            if (current.archived() || current.lifecycle() == LifecycleState.TERMINATED) {
                throw new InvalidTransitionException(connectionId, "FORCE_TERMINATE",
                        current.archived() ? "connection is archived" : "Lifecycle is " + current.lifecycle());
            }
            NsiEvent event = new NsiOperatorEvent.ForcedTermination(wallClock.now());
            ConnectionStateReducer.Result result = apply(current, event);
            commit(current, result.connection(), event);
            applyEffects(connectionId, result.effects(), null);
            return result.connection().status();
        });
    }

    /**
     * Marks a terminated connection as archived. Archived connections are kept
     * for display but accept no further intent or message, so their lock is
     * dropped.
     *
     * @throws InvalidTransitionException unless the connection is terminated
     */
    public ConnectionStatus archive(String connectionId) {
        ConnectionStatus archived = locks.withLock(connectionId, () -> {
            Connection current = load(connectionId);
            if (current.archived() || current.lifecycle() != LifecycleState.TERMINATED) {
                throw new InvalidTransitionException(connectionId, "ARCHIVE",
                        current.archived() ? "connection is archived" : "Lifecycle is " + current.lifecycle());
            }
            NsiEvent event = new NsiOperatorEvent.ArchiveRequested(wallClock.now());
            ConnectionStateReducer.Result result = apply(current, event);
            commit(current, result.connection(), event);
            return result.connection().status();
        });
        locks.forget(connectionId);
        return archived;
    }

    /**
     * Pending operations of a connection, for display.
     */
    public List<PendingOperation> pendingOperations(String connectionId) {
        return tracker.pendingFor(connectionId);
    }

    private IssuedRequest issueLocked(String connectionId, OperationKind kind) {
        Objects.requireNonNull(connectionId, "connectionId");
        return locks.withLock(connectionId, () -> issue(connectionId, kind, 1));
    }

    /**
     * Issues one request. Caller holds the connection's lock.
     */
    private IssuedRequest issue(String connectionId, OperationKind kind, int attempt) {
        Connection current = load(connectionId);

        Optional<String> rejection = reducer.checkIntent(current, kind);
        if (rejection.isPresent()) {
            throw new InvalidTransitionException(connectionId, kind, rejection.get());
        }

        Instant now = wallClock.now();
        long deadline = clock.nowNanos() + config.timingPolicy().timeoutFor(kind).toNanos();
        PendingOperation op = tracker.register(connectionId, kind, deadline, now, attempt);

        NsiEvent accepted = new NsiRequestEvent.RequestAccepted(now, kind, op.correlationId());
        ConnectionStateReducer.Result result = apply(current, accepted);
        if (!result.accepted()) {
            tracker.cancel(op.correlationId());
            throw defect("Permitted " + kind + " was refused for " + current, null);
        }
        commit(current, result.connection(), accepted);
        timeouts.schedule(op.correlationId(), deadline);

        ProviderRequest request = toRequest(result.connection(), op);
        try {
            emitter.emit(request);
        } catch (RuntimeException e) {
            withdraw(current, op, e);
            throw new MessageDeliveryException(request, e);
        }

        sink.onProtocolEvent(new NsiProtocolEvent(now, NsiProtocolEvent.Kind.REQUEST_SENT,
                connectionId, kind, op.correlationId(), "attempt " + attempt));

        applyEffects(connectionId, result.effects(), op);
        return new IssuedRequest(connectionId, op.correlationId(), kind);
    }

    /**
     * Undoes an issue whose request never left: the registration and deadline
     * are withdrawn and the record before the attempt is restored, with the
     * delivery failure appended.
     */
    private void withdraw(Connection before, PendingOperation op, RuntimeException cause) {
        tracker.cancel(op.correlationId());
        timeouts.cancel(op.correlationId());

        Connection inFlight = repository.load(before.connectionId()).orElse(before);
        Connection restored = before.withAnomaly(new Anomaly(wallClock.now(), Anomaly.Type.DELIVERY_FAILURE,
                op.kind(), op.correlationId(), String.valueOf(cause.getMessage())));
        commit(inFlight, restored, null);
    }

    // ---------------------------------------------------------------------
    // Inbound messages
    // ---------------------------------------------------------------------

    /**
     * Entry point for decoded provider messages.
     */
    public void onProviderMessage(ProviderMessage message) {
        Objects.requireNonNull(message, "message");

        if (message instanceof ProviderMessage.Reply reply) {
            onReply(reply);
            return;
        }
        if (message instanceof ProviderMessage.Notification notification) {
            onNotification(notification);
            return;
        }

        throw defect("Unrecognised provider message: " + message.getClass().getName(), null);
    }

    private void onReply(ProviderMessage.Reply reply) {
        final String correlationId = reply.correlationId();

        Optional<String> owner = tracker.ownerOf(correlationId);
        if (owner.isEmpty()) {
            reportAnomaly(null, new Anomaly(wallClock.now(), Anomaly.Type.UNKNOWN_CORRELATION,
                    reply.kind(), correlationId, "unsolicited " + label(reply)));
            return;
        }

        locks.runLocked(owner.get(), () -> {
            Instant now = wallClock.now();

            Optional<PendingOperation> awaiting = tracker.pending(correlationId);
            if (awaiting.isPresent() && awaiting.get().kind() != reply.kind()) {
                recordOnConnection(awaiting.get().connectionId(), new Anomaly(now, Anomaly.Type.UNKNOWN_CORRELATION,
                        reply.kind(), correlationId,
                        label(reply) + " does not answer pending " + awaiting.get().kind()));
                return;
            }

            CorrelationTracker.Resolution resolution = tracker.resolve(correlationId);

            if (resolution instanceof CorrelationTracker.Resolved resolved) {
                PendingOperation op = resolved.operation();
                timeouts.cancel(correlationId);
                if (op.kind() == OperationKind.QUERY) {
                    queryRetries.reset(op.connectionId());
                }
                sink.onProtocolEvent(new NsiProtocolEvent(now, NsiProtocolEvent.Kind.REPLY_MATCHED,
                        op.connectionId(), op.kind(), correlationId, label(reply)));

                Connection current = loadForPending(op);
                NsiEvent event = toEvent(reply, now);
                ConnectionStateReducer.Result result = apply(current, event);
                commit(current, result.connection(), event);
                applyEffects(op.connectionId(), result.effects(), op);
            }
            else if (resolution instanceof CorrelationTracker.AlreadyResolved already) {
                recordOnConnection(already.operation().connectionId(), new Anomaly(now, Anomaly.Type.ALREADY_RESOLVED,
                        reply.kind(), correlationId, "duplicate or late " + label(reply)));
            }
            else {
                reportAnomaly(null, new Anomaly(now, Anomaly.Type.UNKNOWN_CORRELATION,
                        reply.kind(), correlationId, "unsolicited " + label(reply)));
            }
        });
    }

    private void onNotification(ProviderMessage.Notification notification) {
        Optional<Connection> target = repository.findByProviderConnectionId(notification.providerConnectionId());
        if (target.isEmpty()) {
            reportAnomaly(null, new Anomaly(wallClock.now(), Anomaly.Type.UNKNOWN_CORRELATION, null, null,
                    notification.getClass().getSimpleName() + " for unknown provider connection "
                            + notification.providerConnectionId()));
            return;
        }

        String connectionId = target.get().connectionId();
        locks.runLocked(connectionId, () -> {
            Connection current = load(connectionId);
            NsiEvent event = toEvent(notification, wallClock.now());
            if (current.archived()) {
                reportOnArchived(current, event);
                return;
            }
            ConnectionStateReducer.Result result = apply(current, event);
            commit(current, result.connection(), event);
            if (event instanceof NsiNotificationEvent.PassedEndTime && result.accepted()) {
                timeouts.cancelEndTime(connectionId);
            }
            applyEffects(connectionId, result.effects(), null);
        });
    }

    // ---------------------------------------------------------------------
    // Timeout sweep
    // ---------------------------------------------------------------------

    /**
     * Processes every deadline that has expired by now. Invoked periodically
     * by the runtime; granularity is a deployment choice.
     *
     * @throws IllegalStateException if a defect was detected; the remaining
     *         expiries of the batch are still processed first
     */
    public void sweep() {
        List<TimeoutManager.Expiry> expired = timeouts.sweep(clock.nowNanos());

        IllegalStateException firstDefect = null;
        for (TimeoutManager.Expiry expiry : expired) {
            try {
                onExpiry(expiry);
            } catch (IllegalStateException defect) {
                if (firstDefect == null) {
                    firstDefect = defect;
                } else {
                    firstDefect.addSuppressed(defect);
                }
            }
        }
        if (firstDefect != null) {
            throw firstDefect;
        }
    }

    private void onExpiry(TimeoutManager.Expiry expiry) {
        if (expiry instanceof TimeoutManager.DeadlineExpired e) {
            onDeadlineExpired(e.correlationId());
        }
        else if (expiry instanceof TimeoutManager.RetryDue e) {
            locks.runLocked(e.connectionId(), () -> onRetryDue(e));
        }
        else if (expiry instanceof TimeoutManager.EndTimeReached e) {
            locks.runLocked(e.connectionId(), () -> onEndTimeReached(e));
        }
        else {
            throw defect("Unrecognised expiry: " + expiry, null);
        }
    }

    private void onDeadlineExpired(String correlationId) {
        Optional<PendingOperation> awaiting = tracker.pending(correlationId);
        if (awaiting.isEmpty()) {
            // The reply (or a cancellation) got there first.
            return;
        }

        locks.runLocked(awaiting.get().connectionId(), () -> {
            CorrelationTracker.Resolution resolution = tracker.resolve(correlationId);
            if (!(resolution instanceof CorrelationTracker.Resolved resolved)) {
                return;
            }
            PendingOperation op = resolved.operation();
            Instant now = wallClock.now();
            sink.onProtocolEvent(new NsiProtocolEvent(now, NsiProtocolEvent.Kind.DEADLINE_EXPIRED,
                    op.connectionId(), op.kind(), correlationId, "attempt " + op.attempt()));

            Connection current = loadForPending(op);
            NsiEvent event = new NsiTimeoutEvent.TimeoutExpired(now, op.kind(), correlationId);
            ConnectionStateReducer.Result result = apply(current, event);
            commit(current, result.connection(), event);
            applyEffects(op.connectionId(), result.effects(), op);
        });
    }

    private void onRetryDue(TimeoutManager.RetryDue due) {
        String connectionId = due.connectionId();
        Connection current = repository.load(connectionId)
                .orElseThrow(() -> defect("Query retry references missing connection " + connectionId, null));

        if (tracker.pendingFor(connectionId, OperationFamily.QUERY).isPresent()
                || reducer.checkIntent(current, OperationKind.QUERY).isPresent()) {
            queryRetries.reset(connectionId);
            return;
        }
        try {
            issue(connectionId, OperationKind.QUERY, due.attempt());
        } catch (NsiProtocolException e) {
            // Chain ends; status is stale.
            queryRetries.reset(connectionId);
            Instant now = wallClock.now();
            sink.onProtocolEvent(new NsiProtocolEvent(now, NsiProtocolEvent.Kind.QUERY_RETRY_FAILED,
                    connectionId, OperationKind.QUERY, null, e.getMessage()));
            recordOnConnection(connectionId, new Anomaly(now, Anomaly.Type.STALE_STATUS, OperationKind.QUERY, null,
                    "query attempt " + due.attempt() + " could not be sent: " + e.getMessage()));
        }
    }

    private void onEndTimeReached(TimeoutManager.EndTimeReached reached) {
        String connectionId = reached.connectionId();
        Connection current = repository.load(connectionId)
                .orElseThrow(() -> defect("End time references missing connection " + connectionId, null));

        Instant now = wallClock.now();
        sink.onProtocolEvent(new NsiProtocolEvent(now, NsiProtocolEvent.Kind.END_TIME_REACHED,
                connectionId, null, null, String.valueOf(current.parameters().endTime())));

        NsiEvent event = new NsiNotificationEvent.PassedEndTime(now);
        if (current.archived()) {
            reportOnArchived(current, event);
            return;
        }
        ConnectionStateReducer.Result result = apply(current, event);
        commit(current, result.connection(), event);
    }

    // ---------------------------------------------------------------------
    // Effects
    // ---------------------------------------------------------------------

    private void applyEffects(String connectionId, ConnectionEffects effects, PendingOperation cause) {
        if (effects.isEmpty()) {
            return;
        }
        if (effects.contains(ConnectionEffects.Kind.CANCEL_PENDING)) {
            cancelPending(connectionId);
        }
        if (effects.contains(ConnectionEffects.Kind.RETRY_QUERY)) {
            onQueryUnanswered(connectionId, cause);
        }
        if (effects.contains(ConnectionEffects.Kind.ISSUE_RESERVE_COMMIT)) {
            autoAdvance(connectionId, OperationKind.RESERVE_COMMIT);
        }
        if (effects.contains(ConnectionEffects.Kind.ISSUE_PROVISION)) {
            autoAdvance(connectionId, OperationKind.PROVISION);
        }
    }

    /**
     * Cancels everything outstanding for a connection that is being (or has
     * been) terminated. A terminate request in flight is kept while the
     * connection is still terminating.
     */
    private void cancelPending(String connectionId) {
        Connection current = load(connectionId);
        OperationFamily[] keep = current.lifecycle() == LifecycleState.TERMINATING
                ? new OperationFamily[] { OperationFamily.TERMINATION }
                : new OperationFamily[0];

        Instant now = wallClock.now();
        for (PendingOperation op : tracker.cancelAll(connectionId, keep)) {
            timeouts.cancel(op.correlationId());
            sink.onProtocolEvent(new NsiProtocolEvent(now, NsiProtocolEvent.Kind.PENDING_CANCELLED,
                    connectionId, op.kind(), op.correlationId(), "connection " + current.lifecycle()));
        }
        timeouts.cancelConnection(connectionId);
        queryRetries.reset(connectionId);
    }

    private void onQueryUnanswered(String connectionId, PendingOperation op) {
        Instant now = wallClock.now();
        String correlationId = op == null ? null : op.correlationId();

        QueryRetryTracker.Outcome outcome = queryRetries.onUnanswered(connectionId);
        if (outcome instanceof QueryRetryTracker.Retry retry) {
            timeouts.scheduleRetry(connectionId, retry.nextAttempt(), clock.nowNanos() + retry.delay().toNanos());
            sink.onProtocolEvent(new NsiProtocolEvent(now, NsiProtocolEvent.Kind.QUERY_RETRY_SCHEDULED,
                    connectionId, OperationKind.QUERY, correlationId,
                    "attempt " + retry.nextAttempt() + " in " + retry.delay()));
            return;
        }

        QueryRetryTracker.GiveUp giveUp = (QueryRetryTracker.GiveUp) outcome;
        Connection current = load(connectionId);
        Connection stale = current.withAnomaly(new Anomaly(now, Anomaly.Type.STALE_STATUS, OperationKind.QUERY,
                correlationId, "no status from provider after " + giveUp.attempts() + " attempts"));
        commit(current, stale, null);
    }

    private void autoAdvance(String connectionId, OperationKind kind) {
        try {
            issue(connectionId, kind, 1);
        } catch (NsiProtocolException e) {
            sink.onProtocolEvent(new NsiProtocolEvent(wallClock.now(), NsiProtocolEvent.Kind.AUTO_ADVANCE_FAILED,
                    connectionId, kind, null, e.getMessage()));
        }
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private ConnectionStateReducer.Result apply(Connection current, NsiEvent event) {
        try {
            return reducer.apply(current, event);
        } catch (IllegalStateException e) {
            throw defect(e.getMessage(), e);
        }
    }

    /**
     * Saves the new record and reports what changed. Anomalies appended since
     * {@code before} are reported individually.
     */
    private void commit(Connection before, Connection after, NsiEvent trigger) {
        repository.save(after);

        if (!before.sameSubStates(after)) {
            sink.onStateTransition(new ConnectionTransitionEvent(
                    wallClock.now(), before.status(), after.status(), trigger));
        }

        List<Anomaly> anomalies = after.anomalies();
        for (int i = Math.min(before.anomalies().size(), anomalies.size()); i < anomalies.size(); i++) {
            sink.onAnomaly(new NsiAnomalyEvent(after.connectionId(), anomalies.get(i)));
        }
    }

    /**
     * Appends an anomaly to a connection without touching its sub-states.
     * Archived records are left as they are.
     */
    private void recordOnConnection(String connectionId, Anomaly anomaly) {
        Optional<Connection> current = repository.load(connectionId);
        if (current.isEmpty() || current.get().archived()) {
            reportAnomaly(connectionId, anomaly);
            return;
        }
        commit(current.get(), current.get().withAnomaly(anomaly), null);
    }

    /**
     * An archived record is never saved again: the event is reported as an
     * invalid transition and the record is left untouched.
     */
    private void reportOnArchived(Connection archived, NsiEvent event) {
        reportAnomaly(archived.connectionId(), new Anomaly(event.timestamp(), Anomaly.Type.INVALID_TRANSITION,
                null, null, event + " on archived connection"));
    }

    private void reportAnomaly(String connectionId, Anomaly anomaly) {
        sink.onAnomaly(new NsiAnomalyEvent(connectionId, anomaly));
    }

    private Connection load(String connectionId) {
        return repository.load(connectionId)
                .orElseThrow(() -> new ConnectionNotFoundException(connectionId));
    }

    private Connection loadForPending(PendingOperation op) {
        return repository.load(op.connectionId())
                .orElseThrow(() -> defect("Pending " + op.kind() + " " + op.correlationId()
                        + " references missing connection " + op.connectionId(), null));
    }

    private IllegalStateException defect(String message, Throwable cause) {
        IllegalStateException e = new IllegalStateException(message, cause);
        sink.onError(new NsiErrorEvent(wallClock.now(), message, e));
        return e;
    }

    private void scheduleEndTime(Connection connection) {
        connection.parameters().end().ifPresent(end -> {
            Duration remaining = Duration.between(wallClock.now(), end);
            if (remaining.isNegative()) {
                remaining = Duration.ZERO;
            }
            if (remaining.compareTo(MAX_END_TIME_HORIZON) > 0) {
                return;
            }
            timeouts.scheduleEndTime(connection.connectionId(), clock.nowNanos() + remaining.toNanos());
        });
    }

    private ProviderRequest toRequest(Connection connection, PendingOperation op) {
        return new ProviderRequest(
                op.correlationId(),
                op.kind(),
                connection.connectionId(),
                connection.providerConnectionId().orElse(null),
                config.requesterNsa(),
                config.providerNsa(),
                config.replyTo(),
                connection.description(),
                op.kind() == OperationKind.RESERVE ? connection.parameters() : null
        );
    }

    private static NsiEvent toEvent(ProviderMessage.Reply reply, Instant now) {
        if (reply instanceof ProviderMessage.Confirmed c) {
            return new NsiReplyEvent.ConfirmReceived(now, c.kind(), c.correlationId(),
                    c.providerConnectionId(), c.summary());
        }
        ProviderMessage.Failed f = (ProviderMessage.Failed) reply;
        return new NsiReplyEvent.FaultReceived(now, f.kind(), f.correlationId(), f.errorId(), f.reason());
    }

    private static NsiEvent toEvent(ProviderMessage.Notification notification, Instant now) {
        if (notification instanceof ProviderMessage.DataPlaneStateChange n) {
            return new NsiNotificationEvent.DataPlaneStatusChanged(now, n.active());
        }
        if (notification instanceof ProviderMessage.ErrorEvent n) {
            return new NsiNotificationEvent.ErrorEventReceived(now, n.errorId(), n.text());
        }
        if (notification instanceof ProviderMessage.ReserveTimeout) {
            return new NsiNotificationEvent.ReserveTimeoutReceived(now);
        }
        return new NsiNotificationEvent.PassedEndTime(now);
    }

    private static String label(ProviderMessage.Reply reply) {
        return (reply instanceof ProviderMessage.Confirmed ? "confirm of " : "fault of ") + reply.kind();
    }
}
