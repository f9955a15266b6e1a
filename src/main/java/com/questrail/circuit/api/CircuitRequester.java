package com.questrail.circuit.api;

import java.util.Optional;

/**
 * CircuitRequester
 * -----------------------------------------------------------------------------
 * Operator-facing surface of a requester agent.
 *
 * <h2>Asynchronous outcomes</h2>
 * Each intent only <em>issues</em> a request. It returns as soon as the request
 * has been handed to the message boundary, with the correlation id that the
 * provider's eventual confirm or fault will carry. The outcome becomes visible
 * later through {@link #status(String)}.
 *
 * <h2>Rejections</h2>
 * An intent that is not legal for the connection's current sub-states, or that
 * collides with an outstanding request of the same family, is rejected
 * synchronously with an exception. It is never queued.
 */
public interface CircuitRequester
{
    /**
     * Creates a connection and requests a reservation for it.
     *
     * @return the correlation id of the reserve request; the new connection id is
     *         available from {@link IssuedRequest#connectionId()}
     */
    IssuedRequest reserve(String description, ServiceParameters parameters);

    /**
     * Requests a new reservation for an existing connection whose reservation is
     * back at its start state, for example after a failed or timed-out
     * reservation was aborted.
     */
    IssuedRequest reserveAgain(String connectionId);

    IssuedRequest reserveCommit(String connectionId);

    IssuedRequest reserveAbort(String connectionId);

    IssuedRequest provision(String connectionId);

    IssuedRequest release(String connectionId);

    IssuedRequest terminate(String connectionId);

    /**
     * Requests a status refresh from the provider. Idempotent; retried with
     * backoff if the provider does not answer.
     */
    IssuedRequest query(String connectionId);

    /**
     * Returns the current projection of a connection, if known.
     */
    Optional<ConnectionStatus> status(String connectionId);

    /**
     * Handle returned for an issued request.
     */
    record IssuedRequest(String connectionId, String correlationId, OperationKind kind) {}
}
