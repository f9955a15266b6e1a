package com.questrail.circuit.protocol.nsi.internal.exec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * TimeoutManager
 * -----------------------------------------------------------------------------
 * Passive table of monotonic deadlines, drained by a periodic sweep.
 *
 * <h2>Three kinds of deadline</h2>
 * <ul>
 *   <li>reply deadlines, keyed by correlation id</li>
 *   <li>query retry due times, one per connection</li>
 *   <li>scheduled reservation end times, one per connection</li>
 * </ul>
 *
 * <h2>Execution model</h2>
 * The manager owns no thread and no timer. Whoever drives it (a scheduled
 * executor in production, the test directly) calls {@link #sweep(long)} with
 * the current monotonic time; expired entries are removed and returned,
 * earliest first. A cancelled entry is gone, so a later sweep performs no work
 * for it.
 *
 * <p>Whether an expired reply deadline still matters is not decided here: the
 * correlation tracker's single resolution decides that.</p>
 */
public final class TimeoutManager
{
    /**
     * An expired entry returned by {@link #sweep(long)}.
     */
    public sealed interface Expiry permits DeadlineExpired, RetryDue, EndTimeReached {
        long dueNanos();
    }

    /** No reply arrived before the deadline of a pending request. */
    public record DeadlineExpired(String correlationId, long dueNanos) implements Expiry {}

    /** A backed-off query retry is due. */
    public record RetryDue(String connectionId, int attempt, long dueNanos) implements Expiry {}

    /** The reservation's scheduled end time has passed. */
    public record EndTimeReached(String connectionId, long dueNanos) implements Expiry {}

    private final Map<String, Long> replyDeadlines = new HashMap<>();
    private final Map<String, RetryDue> retries = new HashMap<>();
    private final Map<String, Long> endTimes = new HashMap<>();

    public synchronized void schedule(String correlationId, long deadlineNanos) {
        replyDeadlines.put(Objects.requireNonNull(correlationId, "correlationId"), deadlineNanos);
    }

    public synchronized boolean cancel(String correlationId) {
        return replyDeadlines.remove(correlationId) != null;
    }

    /**
     * Schedules a query retry, replacing any retry already scheduled for the
     * connection.
     */
    public synchronized void scheduleRetry(String connectionId, int attempt, long dueNanos) {
        Objects.requireNonNull(connectionId, "connectionId");
        retries.put(connectionId, new RetryDue(connectionId, attempt, dueNanos));
    }

    public synchronized boolean cancelRetry(String connectionId) {
        return retries.remove(connectionId) != null;
    }

    public synchronized void scheduleEndTime(String connectionId, long deadlineNanos) {
        endTimes.put(Objects.requireNonNull(connectionId, "connectionId"), deadlineNanos);
    }

    public synchronized boolean cancelEndTime(String connectionId) {
        return endTimes.remove(connectionId) != null;
    }

    /**
     * Cancels the retry and end-time entries of a connection. Reply deadlines
     * are cancelled per correlation id.
     */
    public synchronized void cancelConnection(String connectionId) {
        retries.remove(connectionId);
        endTimes.remove(connectionId);
    }

    public synchronized boolean isScheduled(String correlationId) {
        return replyDeadlines.containsKey(correlationId);
    }

    public synchronized boolean hasRetry(String connectionId) {
        return retries.containsKey(connectionId);
    }

    public synchronized boolean hasEndTime(String connectionId) {
        return endTimes.containsKey(connectionId);
    }

    /**
     * Removes and returns every entry due at or before {@code nowNanos},
     * earliest first.
     */
    public synchronized List<Expiry> sweep(long nowNanos) {
        List<Expiry> expired = new ArrayList<>();

        Iterator<Map.Entry<String, Long>> deadlines = replyDeadlines.entrySet().iterator();
        while (deadlines.hasNext()) {
            Map.Entry<String, Long> e = deadlines.next();
            if (e.getValue() <= nowNanos) {
                expired.add(new DeadlineExpired(e.getKey(), e.getValue()));
                deadlines.remove();
            }
        }

        Iterator<RetryDue> due = retries.values().iterator();
        while (due.hasNext()) {
            RetryDue r = due.next();
            if (r.dueNanos() <= nowNanos) {
                expired.add(r);
                due.remove();
            }
        }

        Iterator<Map.Entry<String, Long>> ends = endTimes.entrySet().iterator();
        while (ends.hasNext()) {
            Map.Entry<String, Long> e = ends.next();
            if (e.getValue() <= nowNanos) {
                expired.add(new EndTimeReached(e.getKey(), e.getValue()));
                ends.remove();
            }
        }

        expired.sort(Comparator.comparingLong(Expiry::dueNanos));
        return expired;
    }
}
