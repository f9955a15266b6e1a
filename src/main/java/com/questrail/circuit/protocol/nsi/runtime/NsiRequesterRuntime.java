package com.questrail.circuit.protocol.nsi.runtime;

import com.questrail.circuit.protocol.nsi.ConnectionRepository;
import com.questrail.circuit.protocol.nsi.NsiProtocolEngine;
import com.questrail.circuit.protocol.nsi.ProviderMessageEmitter;
import com.questrail.circuit.protocol.nsi.config.NsiRequesterConfig;
import com.questrail.circuit.protocol.nsi.internal.correlation.CorrelationTracker;
import com.questrail.circuit.protocol.nsi.internal.exec.TimeoutManager;
import com.questrail.circuit.protocol.nsi.internal.time.Cancellable;
import com.questrail.circuit.protocol.nsi.internal.time.MonotonicClock;
import com.questrail.circuit.protocol.nsi.internal.time.MonotonicScheduler;
import com.questrail.circuit.protocol.nsi.internal.time.ScheduledExecutorScheduler;
import com.questrail.circuit.protocol.nsi.internal.time.SystemMonotonicClock;
import com.questrail.circuit.protocol.nsi.internal.time.SystemWallClock;
import com.questrail.circuit.protocol.nsi.internal.time.WallClock;
import com.questrail.circuit.protocol.nsi.observability.NsiErrorEvent;
import com.questrail.circuit.protocol.nsi.observability.NsiObservabilitySink;
import com.questrail.circuit.protocol.nsi.observability.NullObservabilitySink;
import com.questrail.circuit.protocol.nsi.persist.InMemoryConnectionRepository;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * NsiRequesterRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a requester agent.
 *
 * <p>Wires clocks, scheduler, correlation tracker, timeout table, engine and
 * observability sink. {@link #start()} arms the periodic timeout sweep at the
 * configured interval; {@link #stop()} cancels it and, if the runtime created
 * its own executor, shuts that executor down.</p>
 *
 * <p>The message boundary is supplied from outside: an emitter for outbound
 * requests, and {@link NsiProtocolEngine#onProviderMessage} for what the
 * codec decodes.</p>
 */
public final class NsiRequesterRuntime {
    private final NsiProtocolEngine engine;
    private final NsiRequesterConfig config;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final ScheduledExecutorService ownedExecutor;
    private final NsiObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Cancellable sweepTask;

    private NsiRequesterRuntime(NsiProtocolEngine engine,
                                NsiRequesterConfig config,
                                MonotonicClock clock,
                                WallClock wallClock,
                                MonotonicScheduler scheduler,
                                ScheduledExecutorService ownedExecutor,
                                NsiObservabilitySink observabilitySink) {
        this.engine = engine;
        this.config = config;
        this.clock = clock;
        this.wallClock = wallClock;
        this.scheduler = scheduler;
        this.ownedExecutor = ownedExecutor;
        this.observabilitySink = observabilitySink;
    }

    /**
     * Arms the periodic sweep. Idempotent.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            sweepTask = scheduler.scheduleEvery(config.timingPolicy().sweepInterval(), clock, this::runSweep);
        }
    }

    /**
     * Cancels the periodic sweep and releases the executor the runtime owns.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Cancellable task = sweepTask;
            if (task != null) {
                task.cancel();
                sweepTask = null;
            }
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public NsiProtocolEngine engine() {
        return engine;
    }

    private void runSweep() {
        try {
            engine.sweep();
        } catch (RuntimeException e) {
            // Keep sweeping; a defect on one connection must not stall the others.
            observabilitySink.onError(new NsiErrorEvent(wallClock.now(), "Timeout sweep failed", e));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private NsiRequesterConfig config = NsiRequesterConfig.defaults();
        private ConnectionRepository repository;
        private ProviderMessageEmitter emitter;
        private NsiObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private Supplier<String> connectionIds = CorrelationTracker::newCorrelationId;

        public Builder withConfig(NsiRequesterConfig config) {
            this.config = config;
            return this;
        }

        public Builder withRepository(ConnectionRepository repository) {
            this.repository = repository;
            return this;
        }

        public Builder withEmitter(ProviderMessageEmitter emitter) {
            this.emitter = emitter;
            return this;
        }

        public Builder withObservabilitySink(NsiObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Scheduler for the periodic sweep. When none is given the runtime
         * creates (and owns) a single-threaded scheduled executor.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withConnectionIds(Supplier<String> connectionIds) {
            this.connectionIds = connectionIds;
            return this;
        }

        public NsiRequesterRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(emitter, "emitter");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(connectionIds, "connectionIds");

            NsiObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
            ConnectionRepository repo = repository != null ? repository : new InMemoryConnectionRepository();

            ScheduledExecutorService ownedExecutor = null;
            MonotonicScheduler effectiveScheduler = scheduler;
            if (effectiveScheduler == null) {
                ownedExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "nsi-timeout-sweep");
                    t.setDaemon(true);
                    return t;
                });
                effectiveScheduler = new ScheduledExecutorScheduler(ownedExecutor, clock);
            }

            NsiProtocolEngine engine = new NsiProtocolEngine(
                config,
                repo,
                emitter,
                new CorrelationTracker(config.resolvedMemory()),
                new TimeoutManager(),
                clock,
                wallClock,
                sink,
                connectionIds
            );

            return new NsiRequesterRuntime(engine, config, clock, wallClock, effectiveScheduler, ownedExecutor, sink);
        }
    }
}
