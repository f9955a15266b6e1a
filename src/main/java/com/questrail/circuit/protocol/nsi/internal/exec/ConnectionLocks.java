package com.questrail.circuit.protocol.nsi.internal.exec;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * ConnectionLocks
 * -----------------------------------------------------------------------------
 * One mutual-exclusion unit per connection.
 *
 * <p>Everything that reads a connection, decides, and saves the result runs
 * under that connection's lock, so a confirm and a concurrently expiring
 * deadline for the same request are applied one after the other. Different
 * connections never contend.</p>
 *
 * <p>The locks are reentrant: an automatic follow-up request (auto-commit,
 * auto-provision) issued while a reply is being applied takes the same lock
 * again on the same thread.</p>
 */
public final class ConnectionLocks {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String connectionId, Supplier<T> action) {
        Objects.requireNonNull(action, "action");
        ReentrantLock lock = locks.computeIfAbsent(
                Objects.requireNonNull(connectionId, "connectionId"),
                id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the lock of a connection that accepts no further writes (an
     * archived record). A later call for the same id gets a fresh lock.
     */
    public void forget(String connectionId) {
        locks.remove(Objects.requireNonNull(connectionId, "connectionId"));
    }

    /** Number of connections that currently have a lock. */
    public int size() {
        return locks.size();
    }

    public void runLocked(String connectionId, Runnable action) {
        Objects.requireNonNull(action, "action");
        withLock(connectionId, () -> {
            action.run();
            return null;
        });
    }
}
