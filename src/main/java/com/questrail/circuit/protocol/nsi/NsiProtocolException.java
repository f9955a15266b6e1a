package com.questrail.circuit.protocol.nsi;

/**
 * Root of the exceptions raised synchronously to callers of the requester.
 *
 * <p>These are recoverable, caller-facing outcomes. Inbound protocol anomalies
 * are recorded on the connection instead of being thrown.</p>
 */
public class NsiProtocolException extends RuntimeException
{
    public NsiProtocolException(String message) {
        super(message);
    }

    public NsiProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
