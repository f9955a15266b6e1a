package com.questrail.circuit.protocol.nsi.internal.exec;

import com.questrail.circuit.api.OperationKind;

import java.time.Duration;
import java.util.Objects;

/**
 * ConnectionTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing configuration for the requester.
 *
 * <p>This is <em>operational only</em>. It decides how long to wait and how
 * far apart to space query retries; whether a timed-out request may be retried
 * at all is decided by the operation kind, not here.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>stateChangingTimeout</b> - Deadline for the reply to a reserve,
 *       commit, abort, provision, release or terminate request. Expiry parks the
 *       connection in a timeout or unresolved reading.</li>
 *   <li><b>queryTimeout</b> - Deadline for the reply to a status query.</li>
 *   <li><b>queryInitialBackoff</b> - Delay before the first query retry. Each
 *       further retry doubles it.</li>
 *   <li><b>queryMaxBackoff</b> - Upper bound for the retry delay.</li>
 *   <li><b>maxQueryAttempts</b> - Total query attempts (first one included)
 *       before the connection is marked as having stale status.</li>
 *   <li><b>sweepInterval</b> - Period of the runtime's timeout sweep. Deadlines
 *       fire with at most this much lateness.</li>
 * </ul>
 */
public record ConnectionTimingPolicy(
        Duration stateChangingTimeout,
        Duration queryTimeout,
        Duration queryInitialBackoff,
        Duration queryMaxBackoff,
        int maxQueryAttempts,
        Duration sweepInterval
) {
    public ConnectionTimingPolicy {
        Objects.requireNonNull(stateChangingTimeout, "stateChangingTimeout");
        Objects.requireNonNull(queryTimeout, "queryTimeout");
        Objects.requireNonNull(queryInitialBackoff, "queryInitialBackoff");
        Objects.requireNonNull(queryMaxBackoff, "queryMaxBackoff");
        Objects.requireNonNull(sweepInterval, "sweepInterval");

        if (stateChangingTimeout.isNegative() || stateChangingTimeout.isZero()) {
            throw new IllegalArgumentException("stateChangingTimeout must be positive");
        }
        if (queryTimeout.isNegative() || queryTimeout.isZero()) {
            throw new IllegalArgumentException("queryTimeout must be positive");
        }
        if (queryInitialBackoff.isNegative()) {
            throw new IllegalArgumentException("queryInitialBackoff must be non-negative");
        }
        if (queryMaxBackoff.compareTo(queryInitialBackoff) < 0) {
            throw new IllegalArgumentException("queryMaxBackoff must be >= queryInitialBackoff");
        }
        if (maxQueryAttempts < 1) {
            throw new IllegalArgumentException("maxQueryAttempts must be >= 1");
        }
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("sweepInterval must be positive");
        }
    }

    /**
     * Reply deadline for a request of the given kind.
     */
    public Duration timeoutFor(OperationKind kind) {
        return kind.isStateChanging() ? stateChangingTimeout : queryTimeout;
    }

    /**
     * Delay before the query retry that follows {@code failedAttempts}
     * unanswered attempts: {@code initial * 2^(failedAttempts - 1)}, capped at
     * {@link #queryMaxBackoff()}.
     */
    public Duration queryBackoff(int failedAttempts) {
        if (failedAttempts < 1) {
            throw new IllegalArgumentException("failedAttempts must be >= 1");
        }
        Duration delay = queryInitialBackoff;
        for (int i = 1; i < failedAttempts; i++) {
            delay = delay.multipliedBy(2);
            if (delay.compareTo(queryMaxBackoff) >= 0) {
                return queryMaxBackoff;
            }
        }
        return delay.compareTo(queryMaxBackoff) > 0 ? queryMaxBackoff : delay;
    }

    /**
     * Creates a policy with the same timeout for every operation and no query
     * retry. Intended for simple test scenarios.
     */
    public static ConnectionTimingPolicy withResponseTimeout(Duration responseTimeout) {
        return new ConnectionTimingPolicy(
                responseTimeout,
                responseTimeout,
                Duration.ZERO,
                Duration.ZERO,
                1,
                Duration.ofSeconds(1)
        );
    }

    /**
     * Defaults for a typical deployment:
     * <ul>
     *   <li>stateChangingTimeout: 5 min</li>
     *   <li>queryTimeout: 30 s</li>
     *   <li>queryInitialBackoff: 1 s</li>
     *   <li>queryMaxBackoff: 30 s</li>
     *   <li>maxQueryAttempts: 3</li>
     *   <li>sweepInterval: 1 s</li>
     * </ul>
     */
    public static ConnectionTimingPolicy defaults() {
        return new ConnectionTimingPolicy(
                Duration.ofMinutes(5),
                Duration.ofSeconds(30),
                Duration.ofSeconds(1),
                Duration.ofSeconds(30),
                3,
                Duration.ofSeconds(1)
        );
    }
}
