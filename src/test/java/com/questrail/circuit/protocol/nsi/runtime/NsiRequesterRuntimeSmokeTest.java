package com.questrail.circuit.protocol.nsi.runtime;

import com.questrail.circuit.api.CircuitRequester.IssuedRequest;
import com.questrail.circuit.api.ReservationState;
import com.questrail.circuit.api.ServiceParameters;
import com.questrail.circuit.protocol.nsi.ConnectionRepository;
import com.questrail.circuit.protocol.nsi.RecordingProviderEmitter;
import com.questrail.circuit.protocol.nsi.config.NsiRequesterConfig;
import com.questrail.circuit.protocol.nsi.internal.exec.ConnectionTimingPolicy;
import com.questrail.circuit.protocol.nsi.internal.state.Connection;
import com.questrail.circuit.protocol.nsi.observability.RecordingObservabilitySink;
import com.questrail.circuit.protocol.nsi.persist.InMemoryConnectionRepository;
import com.questrail.circuit.protocol.nsi.time.DeterministicScheduler;
import com.questrail.circuit.protocol.nsi.time.ManualMonotonicClock;
import com.questrail.circuit.protocol.nsi.time.ManualWallClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class NsiRequesterRuntimeSmokeTest {

    private static final ServiceParameters PARAMS = new ServiceParameters(
            "urn:ogf:network:a.example:2024:port-1", "urn:ogf:network:b.example:2024:port-7",
            100, 200, 1000, null, null);

    private static final NsiRequesterConfig CONFIG = NsiRequesterConfig.builder()
            .withTimingPolicy(ConnectionTimingPolicy.withResponseTimeout(Duration.ofSeconds(5)))
            .build();

    @Test
    void periodicSweepFiresDeadlines() {
        ManualMonotonicClock clock = new ManualMonotonicClock();
        DeterministicScheduler scheduler = new DeterministicScheduler(clock);

        NsiRequesterRuntime runtime = NsiRequesterRuntime.builder()
                .withConfig(CONFIG)
                .withEmitter(new RecordingProviderEmitter())
                .withClock(clock)
                .withWallClock(new ManualWallClock(Instant.parse("2026-03-01T10:00:00Z")))
                .withScheduler(scheduler)
                .withConnectionIds(() -> "smoke-1")
                .build();

        runtime.start();
        runtime.start();
        assertTrue(runtime.isRunning());
        assertEquals(1, scheduler.pendingCount(), "start is idempotent");

        IssuedRequest reserve = runtime.engine().reserve("smoke", PARAMS);
        assertEquals("smoke-1", reserve.connectionId());

        clock.advance(Duration.ofSeconds(4));
        scheduler.runDueTasks();
        assertEquals(ReservationState.CHECKING,
                runtime.engine().status(reserve.connectionId()).orElseThrow().reservation());

        clock.advance(Duration.ofSeconds(1));
        scheduler.runDueTasks();
        assertEquals(ReservationState.TIMEOUT,
                runtime.engine().status(reserve.connectionId()).orElseThrow().reservation());

        runtime.stop();
        assertFalse(runtime.isRunning());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void failingSweepIsReportedAndSweepingContinues() {
        ManualMonotonicClock clock = new ManualMonotonicClock();
        DeterministicScheduler scheduler = new DeterministicScheduler(clock);
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        FlakyRepository repository = new FlakyRepository();

        NsiRequesterRuntime runtime = NsiRequesterRuntime.builder()
                .withConfig(CONFIG)
                .withRepository(repository)
                .withEmitter(new RecordingProviderEmitter())
                .withObservabilitySink(sink)
                .withClock(clock)
                .withWallClock(new ManualWallClock(Instant.parse("2026-03-01T10:00:00Z")))
                .withScheduler(scheduler)
                .build();
        runtime.start();

        runtime.engine().reserve("smoke", PARAMS);
        repository.failing = true;

        clock.advance(Duration.ofSeconds(5));
        scheduler.runDueTasks();

        assertEquals(1, sink.getErrors().size());
        assertEquals(1, scheduler.pendingCount(), "sweep re-armed after failure");
        runtime.stop();
    }

    @Test
    void ownedExecutorLifecycle() {
        NsiRequesterRuntime runtime = NsiRequesterRuntime.builder()
                .withEmitter(new RecordingProviderEmitter())
                .build();

        assertNotNull(runtime.engine());
        runtime.start();
        assertTrue(runtime.isRunning());
        runtime.stop();
        assertFalse(runtime.isRunning());
    }

    @Test
    void emitterIsRequired() {
        assertThrows(NullPointerException.class, () -> NsiRequesterRuntime.builder().build());
    }

    private static final class FlakyRepository implements ConnectionRepository {
        private final InMemoryConnectionRepository delegate = new InMemoryConnectionRepository();
        volatile boolean failing;

        @Override
        public Optional<Connection> load(String connectionId) {
            if (failing) {
                throw new IllegalStateException("store unavailable");
            }
            return delegate.load(connectionId);
        }

        @Override
        public void save(Connection connection) {
            delegate.save(connection);
        }

        @Override
        public Optional<Connection> findByProviderConnectionId(String providerConnectionId) {
            return delegate.findByProviderConnectionId(providerConnectionId);
        }
    }
}
