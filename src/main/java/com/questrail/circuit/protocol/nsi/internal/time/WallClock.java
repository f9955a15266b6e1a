package com.questrail.circuit.protocol.nsi.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used for observational timestamps and for converting a
 * reservation's scheduled end time into a monotonic deadline.
 *
 * <p>This clock may jump. It MUST NOT be compared against deadlines.</p>
 */
public interface WallClock
{
    Instant now();
}
