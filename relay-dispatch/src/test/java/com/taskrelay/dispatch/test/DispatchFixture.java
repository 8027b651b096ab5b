package com.taskrelay.dispatch.test;

import com.taskrelay.dispatch.DispatchAdmission;
import com.taskrelay.dispatch.DispatchLoop;
import com.taskrelay.dispatch.WorkerSupervisor;
import com.taskrelay.engine.lifecycle.GracefulShutdownHandler;
import com.taskrelay.engine.test.EngineFixture;
import com.taskrelay.worker.WorkerModels;
import com.taskrelay.worker.WorkerProcessRegistry;
import com.taskrelay.worker.context.ContextAssembler;

import java.time.Duration;
import java.util.Map;

/**
 * The dispatcher over an {@link EngineFixture}, with a fake launcher and a same-thread
 * supervision executor so every cycle finishes its launches before returning.
 */
public class DispatchFixture {

    public static final String DEFAULT_MODEL = "test-model";

    public final EngineFixture engine;
    public final FakeWorkerLauncher launcher = new FakeWorkerLauncher();
    public final WorkerProcessRegistry registry = new WorkerProcessRegistry();
    public final GracefulShutdownHandler shutdownHandler = new GracefulShutdownHandler();
    public final DispatchAdmission admission;
    public final WorkerSupervisor supervisor;
    public final DispatchLoop loop;

    public DispatchFixture() {
        this(3);
    }

    public DispatchFixture(int maxParallelAgents) {
        this(new EngineFixture(), maxParallelAgents);
    }

    public DispatchFixture(EngineFixture engine, int maxParallelAgents) {
        this(engine, maxParallelAgents, 100);
    }

    public DispatchFixture(EngineFixture engine, int maxParallelAgents, int batchSize) {
        this.engine = engine;
        admission = new DispatchAdmission(engine.taskRepository, engine.runRepository, engine.workflowCatalog,
            engine.dependencyGraph, engine.runRecorder, engine.outbox, engine.transactionTemplate,
            maxParallelAgents);
        supervisor = new WorkerSupervisor(engine.board, engine.workflowCatalog, engine.runRecorder,
            engine.workspaceManager, new ContextAssembler(), launcher,
            new WorkerModels(DEFAULT_MODEL, Map.of()), registry, shutdownHandler, Runnable::run);
        loop = new DispatchLoop(engine.outbox, admission, supervisor, engine.runRecorder, shutdownHandler,
            engine.metrics, Duration.ofMillis(50), batchSize);
    }

    public int cycle() {
        return loop.runCycle();
    }
}
