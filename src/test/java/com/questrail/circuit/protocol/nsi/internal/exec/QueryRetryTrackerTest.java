package com.questrail.circuit.protocol.nsi.internal.exec;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class QueryRetryTrackerTest {

    private QueryRetryTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new QueryRetryTracker(new ConnectionTimingPolicy(
                Duration.ofSeconds(10),
                Duration.ofSeconds(2),
                Duration.ofSeconds(1),
                Duration.ofSeconds(4),
                3,
                Duration.ofMillis(100)));
    }

    @Test
    void retriesWithBackoffUntilAttemptsAreSpent() {
        assertEquals(new QueryRetryTracker.Retry(2, Duration.ofSeconds(1)), tracker.onUnanswered("c-1"));
        assertEquals(new QueryRetryTracker.Retry(3, Duration.ofSeconds(2)), tracker.onUnanswered("c-1"));
        assertEquals(new QueryRetryTracker.GiveUp(3), tracker.onUnanswered("c-1"));
    }

    @Test
    void givingUpRestoresTheBudget() {
        tracker.onUnanswered("c-1");
        tracker.onUnanswered("c-1");
        tracker.onUnanswered("c-1");

        assertEquals(0, tracker.unansweredFor("c-1"));
        assertInstanceOf(QueryRetryTracker.Retry.class, tracker.onUnanswered("c-1"));
    }

    @Test
    void budgetsAreKeptPerConnection() {
        tracker.onUnanswered("c-1");
        tracker.onUnanswered("c-1");

        assertEquals(new QueryRetryTracker.Retry(2, Duration.ofSeconds(1)), tracker.onUnanswered("c-2"));
        assertEquals(2, tracker.unansweredFor("c-1"));
    }

    @Test
    void resetClearsSpentAttempts() {
        tracker.onUnanswered("c-1");
        tracker.onUnanswered("c-1");

        tracker.reset("c-1");

        assertEquals(0, tracker.unansweredFor("c-1"));
        assertEquals(new QueryRetryTracker.Retry(2, Duration.ofSeconds(1)), tracker.onUnanswered("c-1"));
    }

    @Test
    void singleAttemptPolicyGivesUpImmediately() {
        QueryRetryTracker noRetry = new QueryRetryTracker(
                ConnectionTimingPolicy.withResponseTimeout(Duration.ofSeconds(5)));

        assertEquals(new QueryRetryTracker.GiveUp(1), noRetry.onUnanswered("c-1"));
    }
}
