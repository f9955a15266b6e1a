package com.questrail.circuit.protocol.nsi;

import com.questrail.circuit.protocol.nsi.internal.state.Connection;

import java.util.Optional;

/**
 * ConnectionRepository
 * -----------------------------------------------------------------------------
 * Persistence collaborator for connection records.
 *
 * <p>The engine saves after every applied transition and reloads before
 * applying the next one; it never keeps the authoritative record in memory
 * between turns. Records are never deleted, only archived.</p>
 *
 * <p>Implementations must be safe for concurrent use by different
 * connections. Calls for one connection are already serialised by the
 * engine.</p>
 */
public interface ConnectionRepository
{
    Optional<Connection> load(String connectionId);

    void save(Connection connection);

    /**
     * Finds a connection by the id its provider assigned on the first reserve
     * confirm. Used to route unsolicited notifications.
     */
    Optional<Connection> findByProviderConnectionId(String providerConnectionId);
}
