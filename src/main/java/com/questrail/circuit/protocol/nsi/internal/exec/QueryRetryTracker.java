package com.questrail.circuit.protocol.nsi.internal.exec;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * QueryRetryTracker
 * -----------------------------------------------------------------------------
 * Retry budget for status queries, one per connection.
 *
 * <p>Each unanswered query spends one attempt of
 * {@link ConnectionTimingPolicy#maxQueryAttempts()}. While attempts remain the
 * tracker answers with the next attempt number and its backoff; once they are
 * spent it answers {@link GiveUp} and starts the connection over with a full
 * budget. An answer from the provider, or a query issued by the operator,
 * restores the budget through {@link #reset(String)}.</p>
 *
 * <p>The tracker schedules nothing. The engine turns a {@link Retry} into a
 * timeout-table entry and a {@link GiveUp} into a stale-status anomaly.</p>
 */
public final class QueryRetryTracker {

    public sealed interface Outcome permits Retry, GiveUp {}

    /** Query again as attempt {@code nextAttempt} after {@code delay}. */
    public record Retry(int nextAttempt, Duration delay) implements Outcome {}

    /** Every attempt went unanswered. */
    public record GiveUp(int attempts) implements Outcome {}

    private final ConnectionTimingPolicy timing;
    private final ConcurrentMap<String, Integer> unanswered = new ConcurrentHashMap<>();

    public QueryRetryTracker(ConnectionTimingPolicy timing) {
        this.timing = Objects.requireNonNull(timing, "timing");
    }

    /**
     * Spends one attempt for an unanswered query and decides what follows.
     */
    public Outcome onUnanswered(String connectionId) {
        int spent = unanswered.merge(Objects.requireNonNull(connectionId, "connectionId"), 1, Integer::sum);
        if (spent < timing.maxQueryAttempts()) {
            return new Retry(spent + 1, timing.queryBackoff(spent));
        }
        unanswered.remove(connectionId);
        return new GiveUp(spent);
    }

    public void reset(String connectionId) {
        unanswered.remove(connectionId);
    }

    /** Attempts spent so far without an answer (0 if none). */
    public int unansweredFor(String connectionId) {
        return unanswered.getOrDefault(connectionId, 0);
    }
}
