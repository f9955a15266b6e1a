package com.questrail.circuit.protocol.nsi;

/**
 * No connection with the given id is known to the repository.
 */
public final class ConnectionNotFoundException extends NsiProtocolException
{
    private final String connectionId;

    public ConnectionNotFoundException(String connectionId) {
        super("Unknown connection " + connectionId);
        this.connectionId = connectionId;
    }

    public String connectionId() {
        return connectionId;
    }
}
