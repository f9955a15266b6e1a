package com.questrail.circuit.protocol.nsi.persist;

import com.questrail.circuit.protocol.nsi.ConnectionRepository;
import com.questrail.circuit.protocol.nsi.internal.state.Connection;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Reference {@link ConnectionRepository} keeping records in memory.
 *
 * <p>Suitable for tests and for embedding where durability is provided
 * elsewhere. Records are replaced on save and never removed.</p>
 */
public final class InMemoryConnectionRepository implements ConnectionRepository {

    private final ConcurrentMap<String, Connection> connections = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> byProviderId = new ConcurrentHashMap<>();

    @Override
    public Optional<Connection> load(String connectionId) {
        return Optional.ofNullable(connections.get(Objects.requireNonNull(connectionId, "connectionId")));
    }

    @Override
    public void save(Connection connection) {
        Objects.requireNonNull(connection, "connection");
        connections.put(connection.connectionId(), connection);
        connection.providerConnectionId()
                .ifPresent(providerId -> byProviderId.put(providerId, connection.connectionId()));
    }

    @Override
    public Optional<Connection> findByProviderConnectionId(String providerConnectionId) {
        String connectionId = byProviderId.get(Objects.requireNonNull(providerConnectionId, "providerConnectionId"));
        return connectionId == null ? Optional.empty() : load(connectionId);
    }

    public Collection<Connection> all() {
        return List.copyOf(connections.values());
    }

    public int size() {
        return connections.size();
    }
}
