package com.questrail.circuit.protocol.nsi.config;

import com.questrail.circuit.api.OperationKind;
import com.questrail.circuit.protocol.nsi.internal.correlation.CorrelationTracker;
import com.questrail.circuit.protocol.nsi.internal.exec.ConnectionTimingPolicy;
import com.questrail.circuit.protocol.nsi.internal.state.FaultSeverityPolicy;

import java.net.URI;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Aggregated configuration for an NSI requester agent.
 *
 * @param requesterNsa        NSA id of this requester
 * @param providerNsa         NSA id of the provider agent requests are sent to
 * @param replyTo             callback address providers send replies and notifications to
 * @param timingPolicy        reply deadlines, query retry spacing and sweep interval
 * @param faultPolicy         which provider faults are unrecoverable
 * @param autoCommit          commit a reservation as soon as it is held
 * @param autoProvision       provision a reservation as soon as it is committed
 * @param resolvedMemory      number of resolved correlation ids remembered for duplicate detection
 */
public record NsiRequesterConfig(
    String requesterNsa,
    String providerNsa,
    URI replyTo,
    ConnectionTimingPolicy timingPolicy,
    FaultSeverityPolicy faultPolicy,
    boolean autoCommit,
    boolean autoProvision,
    int resolvedMemory
) {
    public static final String DEFAULT_REQUESTER_NSA = "urn:ogf:network:requester.example:2024:nsa";
    public static final String DEFAULT_PROVIDER_NSA = "urn:ogf:network:domain.example:2024:nsa";
    public static final URI DEFAULT_NSA_BASE_URL = URI.create("http://localhost:8000/");
    public static final String CALLBACK_PATH = "api/nsi/callback/";

    public NsiRequesterConfig {
        Objects.requireNonNull(requesterNsa, "requesterNsa");
        Objects.requireNonNull(providerNsa, "providerNsa");
        Objects.requireNonNull(replyTo, "replyTo");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(faultPolicy, "faultPolicy");

        if (requesterNsa.isBlank() || providerNsa.isBlank()) {
            throw new IllegalArgumentException("NSA ids must not be blank");
        }
        if (!replyTo.isAbsolute()) {
            throw new IllegalArgumentException("replyTo must be an absolute URI: " + replyTo);
        }
        if (resolvedMemory < 1) {
            throw new IllegalArgumentException("resolvedMemory must be >= 1");
        }
    }

    public static NsiRequesterConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Properties loading
    // ---------------------------------------------------------------------

    /**
     * Reads the {@code nsi.*} keys of a properties set. Missing keys take their
     * defaults. Durations use ISO-8601 notation ({@code PT30S}); lists are
     * comma separated.
     *
     * <pre>
     * nsi.requester.id                      = urn:ogf:network:...
     * nsi.provider.id                       = urn:ogf:network:...
     * nsi.nsa.base-url                      = https://aura.example.net/
     * nsi.timeout.state-changing            = PT5M
     * nsi.timeout.query                     = PT30S
     * nsi.query.initial-backoff             = PT1S
     * nsi.query.max-backoff                 = PT30S
     * nsi.query.max-attempts                = 3
     * nsi.sweep-interval                    = PT1S
     * nsi.fault.unrecoverable-operations    = RELEASE
     * nsi.fault.unrecoverable-error-ids     = 00500,00501
     * nsi.auto-commit                       = false
     * nsi.auto-provision                    = false
     * nsi.correlation.resolved-memory       = 4096
     * </pre>
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static NsiRequesterConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");

        ConnectionTimingPolicy d = ConnectionTimingPolicy.defaults();
        ConnectionTimingPolicy timing = new ConnectionTimingPolicy(
            duration(props, "nsi.timeout.state-changing", d.stateChangingTimeout()),
            duration(props, "nsi.timeout.query", d.queryTimeout()),
            duration(props, "nsi.query.initial-backoff", d.queryInitialBackoff()),
            duration(props, "nsi.query.max-backoff", d.queryMaxBackoff()),
            integer(props, "nsi.query.max-attempts", d.maxQueryAttempts()),
            duration(props, "nsi.sweep-interval", d.sweepInterval())
        );

        FaultSeverityPolicy fault = FaultSeverityPolicy.defaults();
        String kinds = props.getProperty("nsi.fault.unrecoverable-operations");
        String errorIds = props.getProperty("nsi.fault.unrecoverable-error-ids");
        if (kinds != null || errorIds != null) {
            fault = new FaultSeverityPolicy(
                kinds != null ? operationKinds(kinds) : fault.unrecoverableKinds(),
                errorIds != null ? list(errorIds) : fault.unrecoverableErrorIds()
            );
        }

        URI baseUrl = uri(props, "nsi.nsa.base-url", DEFAULT_NSA_BASE_URL);

        return builder()
            .withRequesterNsa(props.getProperty("nsi.requester.id", DEFAULT_REQUESTER_NSA).trim())
            .withProviderNsa(props.getProperty("nsi.provider.id", DEFAULT_PROVIDER_NSA).trim())
            .withReplyTo(callbackUri(baseUrl))
            .withTimingPolicy(timing)
            .withFaultPolicy(fault)
            .withAutoCommit(bool(props, "nsi.auto-commit", false))
            .withAutoProvision(bool(props, "nsi.auto-provision", false))
            .withResolvedMemory(integer(props, "nsi.correlation.resolved-memory",
                CorrelationTracker.DEFAULT_RESOLVED_MEMORY))
            .build();
    }

    /**
     * The callback address below an NSA base URL.
     */
    public static URI callbackUri(URI baseUrl) {
        String base = baseUrl.toString();
        return URI.create(base.endsWith("/") ? base : base + "/").resolve(CALLBACK_PATH);
    }

    private static Duration duration(Properties props, String key, Duration fallback) {
        String value = props.getProperty(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Duration.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid duration for " + key + ": " + value, e);
        }
    }

    private static int integer(Properties props, String key, int fallback) {
        String value = props.getProperty(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static boolean bool(Properties props, String key, boolean fallback) {
        String value = props.getProperty(key);
        if (value == null) {
            return fallback;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on" -> true;
            case "false", "no", "off" -> false;
            default -> throw new IllegalArgumentException("Invalid boolean for " + key + ": " + value);
        };
    }

    private static URI uri(Properties props, String key, URI fallback) {
        String value = props.getProperty(key);
        if (value == null) {
            return fallback;
        }
        try {
            return URI.create(value.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid URI for " + key + ": " + value, e);
        }
    }

    private static Set<String> list(String value) {
        Set<String> items = new LinkedHashSet<>();
        Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .forEach(items::add);
        return items;
    }

    private static Set<OperationKind> operationKinds(String value) {
        Set<OperationKind> kinds = EnumSet.noneOf(OperationKind.class);
        for (String name : list(value)) {
            try {
                kinds.add(OperationKind.valueOf(name.toUpperCase(Locale.ROOT).replace('-', '_')));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown operation in nsi.fault.unrecoverable-operations: " + name, e);
            }
        }
        return kinds;
    }

    public static final class Builder {
        private String requesterNsa = DEFAULT_REQUESTER_NSA;
        private String providerNsa = DEFAULT_PROVIDER_NSA;
        private URI replyTo = callbackUri(DEFAULT_NSA_BASE_URL);
        private ConnectionTimingPolicy timingPolicy = ConnectionTimingPolicy.defaults();
        private FaultSeverityPolicy faultPolicy = FaultSeverityPolicy.defaults();
        private boolean autoCommit = false;
        private boolean autoProvision = false;
        private int resolvedMemory = CorrelationTracker.DEFAULT_RESOLVED_MEMORY;

        public Builder withRequesterNsa(String requesterNsa) {
            this.requesterNsa = requesterNsa;
            return this;
        }

        public Builder withProviderNsa(String providerNsa) {
            this.providerNsa = providerNsa;
            return this;
        }

        public Builder withReplyTo(URI replyTo) {
            this.replyTo = replyTo;
            return this;
        }

        public Builder withTimingPolicy(ConnectionTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withFaultPolicy(FaultSeverityPolicy faultPolicy) {
            this.faultPolicy = faultPolicy;
            return this;
        }

        public Builder withAutoCommit(boolean autoCommit) {
            this.autoCommit = autoCommit;
            return this;
        }

        public Builder withAutoProvision(boolean autoProvision) {
            this.autoProvision = autoProvision;
            return this;
        }

        public Builder withResolvedMemory(int resolvedMemory) {
            this.resolvedMemory = resolvedMemory;
            return this;
        }

        public NsiRequesterConfig build() {
            return new NsiRequesterConfig(requesterNsa, providerNsa, replyTo, timingPolicy,
                faultPolicy, autoCommit, autoProvision, resolvedMemory);
        }
    }
}
