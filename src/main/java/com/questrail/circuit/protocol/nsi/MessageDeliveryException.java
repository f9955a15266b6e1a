package com.questrail.circuit.protocol.nsi;

import com.questrail.circuit.protocol.nsi.model.ProviderRequest;

/**
 * The outbound request could not be handed to the message boundary.
 *
 * <p>When this is thrown the request was never sent: its pending operation
 * and deadline have been withdrawn, the connection's sub-states are the ones
 * it had before the attempt, and a delivery anomaly has been recorded.</p>
 */
public final class MessageDeliveryException extends NsiProtocolException
{
    private final transient ProviderRequest request;

    public MessageDeliveryException(ProviderRequest request, Throwable cause) {
        super("Failed to deliver " + request.kind() + " " + request.correlationId()
                + " for connection " + request.connectionId(), cause);
        this.request = request;
    }

    public ProviderRequest request() {
        return request;
    }
}
