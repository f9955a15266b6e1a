package com.questrail.circuit.protocol.nsi.internal.state;

import com.questrail.circuit.api.OperationKind;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * FaultSeverityPolicy
 * -----------------------------------------------------------------------------
 * Decides which provider faults are unrecoverable.
 *
 * <p>An unrecoverable fault moves the connection's lifecycle from
 * {@code CREATED} to {@code FAILED} in addition to the ordinary fault
 * transition of the operation's own sub-state. Everything else leaves the
 * lifecycle alone.</p>
 *
 * <p>This is deployment policy, not protocol: providers differ in how they use
 * error ids, so both sets are configurable.</p>
 *
 * @param unrecoverableKinds    operations whose faults are always unrecoverable
 * @param unrecoverableErrorIds provider error ids that are unrecoverable for any operation
 */
public record FaultSeverityPolicy(
        Set<OperationKind> unrecoverableKinds,
        Set<String> unrecoverableErrorIds
) {
    public FaultSeverityPolicy {
        Objects.requireNonNull(unrecoverableKinds, "unrecoverableKinds");
        Objects.requireNonNull(unrecoverableErrorIds, "unrecoverableErrorIds");

        unrecoverableKinds = unrecoverableKinds.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(unrecoverableKinds));
        unrecoverableErrorIds = Set.copyOf(unrecoverableErrorIds);
    }

    public boolean isUnrecoverable(OperationKind kind, Optional<String> errorId) {
        Objects.requireNonNull(kind, "kind");
        if (unrecoverableKinds.contains(kind)) {
            return true;
        }
        return errorId.map(unrecoverableErrorIds::contains).orElse(false);
    }

    /**
     * A refused release leaves the data plane possibly still up; that is the
     * only fault treated as unrecoverable by default.
     */
    public static FaultSeverityPolicy defaults() {
        return new FaultSeverityPolicy(EnumSet.of(OperationKind.RELEASE), Set.of());
    }

    /**
     * No fault is unrecoverable.
     */
    public static FaultSeverityPolicy lenient() {
        return new FaultSeverityPolicy(Set.of(), Set.of());
    }
}
