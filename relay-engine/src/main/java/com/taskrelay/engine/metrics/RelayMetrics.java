package com.taskrelay.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics for the relay engine.
 *
 * Metrics exposed:
 * - Dispatch decisions by outcome
 * - Worker runs started and completed, with duration
 * - Active runs (against the concurrency cap)
 * - Fan-in synchronization tasks created
 * - Workspace creation and teardown
 * - Events delivered to the broadcast consumer
 *
 * Recording before {@link #bindTo(MeterRegistry)} is a no-op.
 */
public class RelayMetrics implements MeterBinder {

    // Metric names
    public static final String DISPATCH_DECISIONS = "relay.dispatch.decisions";
    public static final String RUNS_STARTED = "relay.runs.started";
    public static final String RUNS_COMPLETED = "relay.runs.completed";
    public static final String RUN_DURATION = "relay.run.duration";
    public static final String RUNS_ACTIVE = "relay.runs.active";
    public static final String RUNS_CAPACITY = "relay.runs.capacity";
    public static final String FAN_IN_CREATED = "relay.fanin.created";
    public static final String WORKSPACES = "relay.workspaces";
    public static final String EVENTS_BROADCAST = "relay.events.broadcast";

    private volatile MeterRegistry registry;

    private final AtomicInteger activeRuns = new AtomicInteger(0);
    private final AtomicInteger capacity = new AtomicInteger(0);

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(RUNS_ACTIVE, activeRuns, AtomicInteger::get)
            .description("Worker runs currently active")
            .register(registry);
        Gauge.builder(RUNS_CAPACITY, capacity, AtomicInteger::get)
            .description("Configured maximum of simultaneously active runs")
            .register(registry);
    }

    // ========== Dispatch Metrics ==========

    public void dispatchDecision(String decision) {
        MeterRegistry r = registry;
        if (r == null) return;
        Counter.builder(DISPATCH_DECISIONS)
            .tag("decision", decision)
            .description("Dispatch events processed, by decision")
            .register(r)
            .increment();
    }

    public void recordActiveRuns(int active, int cap) {
        activeRuns.set(active);
        capacity.set(cap);
    }

    // ========== Run Metrics ==========

    public void runStarted(String role) {
        MeterRegistry r = registry;
        if (r == null) return;
        Counter.builder(RUNS_STARTED)
            .tag("role", role)
            .description("Total worker runs started")
            .register(r)
            .increment();
    }

    public void runCompleted(String outcome, Duration duration) {
        MeterRegistry r = registry;
        if (r == null) return;
        Counter.builder(RUNS_COMPLETED)
            .tag("outcome", outcome)
            .description("Total worker runs completed")
            .register(r)
            .increment();

        Timer.builder(RUN_DURATION)
            .tag("outcome", outcome)
            .description("Worker run duration")
            .register(r)
            .record(duration);
    }

    // ========== Fan-in Metrics ==========

    public void fanInCreated() {
        MeterRegistry r = registry;
        if (r == null) return;
        Counter.builder(FAN_IN_CREATED)
            .description("Synchronization tasks created by fan-in")
            .register(r)
            .increment();
    }

    // ========== Workspace Metrics ==========

    public void workspaceCreated() {
        workspaceOperation("created");
    }

    public void workspaceRemoved() {
        workspaceOperation("removed");
    }

    private void workspaceOperation(String operation) {
        MeterRegistry r = registry;
        if (r == null) return;
        Counter.builder(WORKSPACES)
            .tag("operation", operation)
            .description("Workspace lifecycle operations")
            .register(r)
            .increment();
    }

    // ========== Outbox Metrics ==========

    public void eventsBroadcast(int count) {
        MeterRegistry r = registry;
        if (r == null) return;
        Counter.builder(EVENTS_BROADCAST)
            .description("Events handed to the broadcast consumer")
            .register(r)
            .increment(count);
    }
}
