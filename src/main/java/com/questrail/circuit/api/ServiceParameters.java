package com.questrail.circuit.api;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Requested service of a connection: the two service termination points, the
 * VLAN label at each end, the bandwidth and the schedule window.
 *
 * @param sourceStp   source service termination point identifier
 * @param destStp     destination service termination point identifier
 * @param sourceVlan  VLAN id at the source (2-4094)
 * @param destVlan    VLAN id at the destination (2-4094)
 * @param bandwidth   requested capacity in Mbit/s (positive)
 * @param startTime   requested start, or {@code null} for immediately
 * @param endTime     requested end, or {@code null} for indefinitely
 */
public record ServiceParameters(
        String sourceStp,
        String destStp,
        int sourceVlan,
        int destVlan,
        long bandwidth,
        Instant startTime,
        Instant endTime
) {
    public static final int MIN_VLAN = 2;
    public static final int MAX_VLAN = 4094;

    public ServiceParameters {
        Objects.requireNonNull(sourceStp, "sourceStp");
        Objects.requireNonNull(destStp, "destStp");

        if (sourceStp.isBlank() || destStp.isBlank()) {
            throw new IllegalArgumentException("service termination points must not be blank");
        }
        if (sourceVlan < MIN_VLAN || sourceVlan > MAX_VLAN) {
            throw new IllegalArgumentException("sourceVlan out of range: " + sourceVlan);
        }
        if (destVlan < MIN_VLAN || destVlan > MAX_VLAN) {
            throw new IllegalArgumentException("destVlan out of range: " + destVlan);
        }
        if (bandwidth <= 0) {
            throw new IllegalArgumentException("bandwidth must be positive");
        }
        if (startTime != null && endTime != null && !endTime.isAfter(startTime)) {
            throw new IllegalArgumentException("endTime must be after startTime");
        }
    }

    public Optional<Instant> start() {
        return Optional.ofNullable(startTime);
    }

    public Optional<Instant> end() {
        return Optional.ofNullable(endTime);
    }
}
