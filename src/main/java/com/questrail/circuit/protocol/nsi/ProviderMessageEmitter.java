package com.questrail.circuit.protocol.nsi;

import com.questrail.circuit.protocol.nsi.model.ProviderRequest;

/**
 * Outbound side of the message boundary: encodes a request into its wire
 * envelope and sends it to the provider.
 *
 * <p>Must not block waiting for the provider's reply. The reply arrives
 * later through {@link NsiProtocolEngine#onProviderMessage}. Any exception
 * thrown here means the request was not sent.</p>
 */
@FunctionalInterface
public interface ProviderMessageEmitter
{
    void emit(ProviderRequest request);
}
