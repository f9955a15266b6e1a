package com.questrail.circuit.protocol.nsi.model;

import com.questrail.circuit.api.OperationKind;
import com.questrail.circuit.api.ServiceParameters;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;

/**
 * ProviderRequest
 * -----------------------------------------------------------------------------
 * Semantic content of one outbound request, ready to be encoded into a wire
 * envelope by the message boundary.
 *
 * <p>Every request carries the correlation id under which the reply is
 * expected and the reply-to address the provider must call back on. A reserve
 * request additionally carries the service parameters; later requests address
 * the connection by the provider-assigned id.</p>
 */
public record ProviderRequest(
        String correlationId,
        OperationKind kind,
        String connectionId,
        String providerConnectionId,
        String requesterNsa,
        String providerNsa,
        URI replyTo,
        String description,
        ServiceParameters parameters
) {
    public ProviderRequest {
        Objects.requireNonNull(correlationId, "correlationId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(requesterNsa, "requesterNsa");
        Objects.requireNonNull(providerNsa, "providerNsa");
        Objects.requireNonNull(replyTo, "replyTo");

        if (kind == OperationKind.RESERVE && parameters == null) {
            throw new IllegalArgumentException("reserve request requires service parameters");
        }
    }

    public Optional<String> providerId() {
        return Optional.ofNullable(providerConnectionId);
    }

    public Optional<ServiceParameters> serviceParameters() {
        return Optional.ofNullable(parameters);
    }
}
