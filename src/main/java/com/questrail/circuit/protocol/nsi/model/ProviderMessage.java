package com.questrail.circuit.protocol.nsi.model;

import com.questrail.circuit.api.OperationKind;

import java.util.Objects;
import java.util.Optional;

/**
 * ProviderMessage
 * -----------------------------------------------------------------------------
 * Decoded inbound message from a provider agent.
 *
 * <h2>Two addressing modes</h2>
 * <ul>
 *   <li>{@link Reply}s (confirm or fault) answer a request and are matched to
 *       it by correlation id only.</li>
 *   <li>{@link Notification}s are unsolicited and address the connection by
 *       its provider-assigned connection id.</li>
 * </ul>
 *
 * The wire format is the codec's concern; this type is what remains after
 * decoding.
 */
public sealed interface ProviderMessage
        permits ProviderMessage.Reply, ProviderMessage.Notification
{
    /**
     * A reply to an outstanding request.
     */
    sealed interface Reply extends ProviderMessage
            permits Confirmed, Failed
    {
        String correlationId();

        OperationKind kind();
    }

    /**
     * Positive reply. {@code providerConnectionId} is set on reserve confirms;
     * {@code summary} on query confirms.
     */
    record Confirmed(String correlationId,
                     OperationKind kind,
                     String providerConnectionId,
                     ProviderSummary summary) implements Reply {
        public Confirmed {
            Objects.requireNonNull(correlationId, "correlationId");
            Objects.requireNonNull(kind, "kind");
        }

        public Confirmed(String correlationId, OperationKind kind) {
            this(correlationId, kind, null, null);
        }

        public Optional<String> providerId() {
            return Optional.ofNullable(providerConnectionId);
        }

        public Optional<ProviderSummary> providerSummary() {
            return Optional.ofNullable(summary);
        }
    }

    /**
     * Negative reply carrying the provider's service exception.
     *
     * @param errorId provider error identifier, or {@code null} if none was given
     * @param reason  provider-supplied reason text
     */
    record Failed(String correlationId,
                  OperationKind kind,
                  String errorId,
                  String reason) implements Reply {
        public Failed {
            Objects.requireNonNull(correlationId, "correlationId");
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(reason, "reason");
        }
    }

    /**
     * An unsolicited provider notification.
     */
    sealed interface Notification extends ProviderMessage
            permits DataPlaneStateChange, ErrorEvent, ReserveTimeout, PassedEndTime
    {
        String providerConnectionId();
    }

    record DataPlaneStateChange(String providerConnectionId, boolean active) implements Notification {
        public DataPlaneStateChange {
            Objects.requireNonNull(providerConnectionId, "providerConnectionId");
        }
    }

    record ErrorEvent(String providerConnectionId, String errorId, String text) implements Notification {
        public ErrorEvent {
            Objects.requireNonNull(providerConnectionId, "providerConnectionId");
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * The provider let an uncommitted held reservation expire.
     */
    record ReserveTimeout(String providerConnectionId) implements Notification {
        public ReserveTimeout {
            Objects.requireNonNull(providerConnectionId, "providerConnectionId");
        }
    }

    record PassedEndTime(String providerConnectionId) implements Notification {
        public PassedEndTime {
            Objects.requireNonNull(providerConnectionId, "providerConnectionId");
        }
    }
}
