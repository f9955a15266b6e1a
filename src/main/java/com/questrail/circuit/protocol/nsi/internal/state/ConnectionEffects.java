package com.questrail.circuit.protocol.nsi.internal.state;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * ConnectionEffects
 * -----------------------------------------------------------------------------
 * Immutable set of follow-up actions emitted by the
 * {@link ConnectionStateReducer}.
 *
 * <p>The reducer decides <b>what</b> should happen next; the protocol engine
 * decides <b>how</b>. No effect performs I/O by itself.</p>
 */
public final class ConnectionEffects
{
    public enum Kind {
        /** Cancel every other pending request of the connection, and its end-time deadline. */
        CANCEL_PENDING,

        /** Issue a reserve commit (auto-commit enabled). */
        ISSUE_RESERVE_COMMIT,

        /** Issue a provision (auto-provision enabled). */
        ISSUE_PROVISION,

        /** A status query went unanswered; retry or report stale status. */
        RETRY_QUERY
    }

    private static final ConnectionEffects NONE = new ConnectionEffects(EnumSet.noneOf(Kind.class));

    private final Set<Kind> kinds;

    private ConnectionEffects(Set<Kind> kinds) {
        this.kinds = Collections.unmodifiableSet(EnumSet.copyOf(kinds));
    }

    public Set<Kind> kinds() {
        return kinds;
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    public boolean contains(Kind kind) {
        return kinds.contains(kind);
    }

    // ---------------------------------------------------------------------
    // Factory methods
    // ---------------------------------------------------------------------

    public static ConnectionEffects none() {
        return NONE;
    }

    public static ConnectionEffects of(Kind kind) {
        return new ConnectionEffects(EnumSet.of(Objects.requireNonNull(kind, "kind")));
    }

    public static ConnectionEffects cancelPending() {
        return of(Kind.CANCEL_PENDING);
    }

    public static ConnectionEffects issueReserveCommit() {
        return of(Kind.ISSUE_RESERVE_COMMIT);
    }

    public static ConnectionEffects issueProvision() {
        return of(Kind.ISSUE_PROVISION);
    }

    public static ConnectionEffects retryQuery() {
        return of(Kind.RETRY_QUERY);
    }

    /**
     * Combines this set of effects with another.
     */
    public ConnectionEffects and(ConnectionEffects other) {
        Objects.requireNonNull(other, "other");
        EnumSet<Kind> merged = EnumSet.noneOf(Kind.class);
        merged.addAll(this.kinds);
        merged.addAll(other.kinds);
        return new ConnectionEffects(merged);
    }

    @Override
    public String toString() {
        return "ConnectionEffects" + kinds;
    }
}
