package com.questrail.circuit.protocol.nsi.internal.correlation;

import com.questrail.circuit.api.OperationKind;
import com.questrail.circuit.protocol.nsi.ConflictingOperationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * CorrelationTracker
 * -----------------------------------------------------------------------------
 * Bookkeeping table that reunites asynchronous provider replies with the
 * request they answer.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>At most one pending operation per connection per
 *       {@link OperationFamily}; a colliding {@link #register} is rejected and
 *       the existing entry is left untouched.</li>
 *   <li>Each pending entry resolves exactly once. A second resolution of the
 *       same id reports {@link AlreadyResolved} rather than handing the
 *       operation out again.</li>
 * </ul>
 *
 * <h2>Resolved memory</h2>
 * Resolved and cancelled ids are remembered in a bounded, least-recently-added
 * table so that a late duplicate can be told apart from an id that was never
 * issued. Once an id ages out of that table it reads as {@link Unknown}; both
 * outcomes are discarded by the engine, so only the diagnostic differs.
 *
 * <h2>Thread safety</h2>
 * All methods are synchronized. The tracker is shared by every connection;
 * per-connection ordering is the engine's concern.
 */
public final class CorrelationTracker
{
    public static final int DEFAULT_RESOLVED_MEMORY = 4096;

    /**
     * Outcome of {@link #resolve(String)}.
     */
    public sealed interface Resolution permits Resolved, AlreadyResolved, Unknown {
        String correlationId();
    }

    /** The id matched a live pending operation, which is now removed. */
    public record Resolved(PendingOperation operation) implements Resolution {
        @Override
        public String correlationId() {
            return operation.correlationId();
        }
    }

    /** The id was already resolved or cancelled earlier. */
    public record AlreadyResolved(PendingOperation operation) implements Resolution {
        @Override
        public String correlationId() {
            return operation.correlationId();
        }
    }

    /** The id was never issued here, or has been forgotten. */
    public record Unknown(String correlationId) implements Resolution {}

    private final Supplier<String> idGenerator;
    private final Map<String, PendingOperation> pending = new LinkedHashMap<>();
    private final Map<String, Map<OperationFamily, PendingOperation>> byConnection = new HashMap<>();
    private final Map<String, PendingOperation> finished;

    public CorrelationTracker(int resolvedMemory, Supplier<String> idGenerator) {
        if (resolvedMemory < 1) {
            throw new IllegalArgumentException("resolvedMemory must be >= 1");
        }
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
        this.finished = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, PendingOperation> eldest) {
                return size() > resolvedMemory;
            }
        };
    }

    public CorrelationTracker(int resolvedMemory) {
        this(resolvedMemory, CorrelationTracker::newCorrelationId);
    }

    public CorrelationTracker() {
        this(DEFAULT_RESOLVED_MEMORY);
    }

    public static String newCorrelationId() {
        return "urn:uuid:" + UUID.randomUUID();
    }

    /**
     * Registers a new pending operation under a fresh correlation id.
     *
     * @throws ConflictingOperationException if an operation of the same family is
     *         already pending for the connection
     */
    public synchronized PendingOperation register(String connectionId,
                                                  OperationKind kind,
                                                  long deadlineNanos,
                                                  Instant issuedAt,
                                                  int attempt) {
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(kind, "kind");

        OperationFamily family = OperationFamily.of(kind);
        Map<OperationFamily, PendingOperation> families =
                byConnection.computeIfAbsent(connectionId, id -> new EnumMap<>(OperationFamily.class));

        PendingOperation existing = families.get(family);
        if (existing != null) {
            throw new ConflictingOperationException(kind, existing);
        }

        String correlationId = idGenerator.get();
        if (pending.containsKey(correlationId) || finished.containsKey(correlationId)) {
            throw new IllegalStateException("Correlation id generator repeated " + correlationId);
        }

        PendingOperation op = new PendingOperation(correlationId, connectionId, kind, issuedAt, deadlineNanos, attempt);
        pending.put(correlationId, op);
        families.put(family, op);
        return op;
    }

    /**
     * Resolves a correlation id. A {@link Resolved} result is handed out at most
     * once per registration.
     */
    public synchronized Resolution resolve(String correlationId) {
        Objects.requireNonNull(correlationId, "correlationId");

        PendingOperation op = remove(correlationId);
        if (op != null) {
            return new Resolved(op);
        }
        PendingOperation earlier = finished.get(correlationId);
        if (earlier != null) {
            return new AlreadyResolved(earlier);
        }
        return new Unknown(correlationId);
    }

    /**
     * Withdraws a pending operation without resolving it.
     *
     * @return the cancelled operation, or empty if it was not pending
     */
    public synchronized Optional<PendingOperation> cancel(String correlationId) {
        return Optional.ofNullable(remove(correlationId));
    }

    /**
     * Cancels every pending operation of a connection except those of the
     * given families.
     *
     * @return the cancelled operations
     */
    public synchronized List<PendingOperation> cancelAll(String connectionId, OperationFamily... keep) {
        Map<OperationFamily, PendingOperation> families = byConnection.get(connectionId);
        if (families == null) {
            return List.of();
        }
        List<PendingOperation> cancelled = new ArrayList<>();
        for (PendingOperation op : new ArrayList<>(families.values())) {
            if (!isKept(op.family(), keep)) {
                remove(op.correlationId());
                cancelled.add(op);
            }
        }
        return cancelled;
    }

    /**
     * Looks up a pending operation without resolving it.
     */
    public synchronized Optional<PendingOperation> pending(String correlationId) {
        return Optional.ofNullable(pending.get(correlationId));
    }

    /**
     * Returns the connection that owns a correlation id, whether still pending
     * or remembered as resolved.
     */
    public synchronized Optional<String> ownerOf(String correlationId) {
        PendingOperation op = pending.get(correlationId);
        if (op == null) {
            op = finished.get(correlationId);
        }
        return op == null ? Optional.empty() : Optional.of(op.connectionId());
    }

    public synchronized List<PendingOperation> pendingFor(String connectionId) {
        Map<OperationFamily, PendingOperation> families = byConnection.get(connectionId);
        return families == null ? List.of() : List.copyOf(families.values());
    }

    public synchronized Optional<PendingOperation> pendingFor(String connectionId, OperationFamily family) {
        Map<OperationFamily, PendingOperation> families = byConnection.get(connectionId);
        return families == null ? Optional.empty() : Optional.ofNullable(families.get(family));
    }

    public synchronized int size() {
        return pending.size();
    }

    private PendingOperation remove(String correlationId) {
        PendingOperation op = pending.remove(correlationId);
        if (op == null) {
            return null;
        }
        Map<OperationFamily, PendingOperation> families = byConnection.get(op.connectionId());
        if (families != null) {
            families.remove(op.family());
            if (families.isEmpty()) {
                byConnection.remove(op.connectionId());
            }
        }
        finished.put(correlationId, op);
        return op;
    }

    private static boolean isKept(OperationFamily family, OperationFamily[] keep) {
        for (OperationFamily k : keep) {
            if (k == family) {
                return true;
            }
        }
        return false;
    }
}
