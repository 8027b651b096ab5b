package com.taskrelay.dispatch;

import com.taskrelay.core.model.AgentRun;
import com.taskrelay.core.model.Task;
import com.taskrelay.core.model.Workflow;
import com.taskrelay.core.model.WorkflowStep;
import com.taskrelay.engine.lifecycle.GracefulShutdownHandler;
import com.taskrelay.engine.logging.LoggingContext;
import com.taskrelay.engine.run.RunRecorder;
import com.taskrelay.engine.service.BoardService;
import com.taskrelay.engine.workflow.WorkflowCatalog;
import com.taskrelay.engine.workspace.Workspace;
import com.taskrelay.engine.workspace.WorkspaceManager;
import com.taskrelay.worker.WorkerExit;
import com.taskrelay.worker.WorkerHandle;
import com.taskrelay.worker.WorkerInvocation;
import com.taskrelay.worker.WorkerLauncher;
import com.taskrelay.worker.WorkerModels;
import com.taskrelay.worker.WorkerProcessRegistry;
import com.taskrelay.worker.context.ContextAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Carries an admitted run from launch to recorded completion.
 *
 * Runs off the dispatch thread: workspace setup shells out to git and workers run for
 * minutes. Each run is registered with the shutdown handler until its completion is
 * recorded, so a graceful stop waits for it.
 */
public class WorkerSupervisor {

    private static final Logger log = LoggerFactory.getLogger(WorkerSupervisor.class);

    private final BoardService boardService;
    private final WorkflowCatalog workflowCatalog;
    private final RunRecorder runRecorder;
    private final WorkspaceManager workspaceManager;
    private final ContextAssembler contextAssembler;
    private final WorkerLauncher launcher;
    private final WorkerModels models;
    private final WorkerProcessRegistry registry;
    private final GracefulShutdownHandler shutdownHandler;
    private final Executor executor;

    public WorkerSupervisor(
            BoardService boardService,
            WorkflowCatalog workflowCatalog,
            RunRecorder runRecorder,
            WorkspaceManager workspaceManager,
            ContextAssembler contextAssembler,
            WorkerLauncher launcher,
            WorkerModels models,
            WorkerProcessRegistry registry,
            GracefulShutdownHandler shutdownHandler,
            Executor executor) {
        this.boardService = boardService;
        this.workflowCatalog = workflowCatalog;
        this.runRecorder = runRecorder;
        this.workspaceManager = workspaceManager;
        this.contextAssembler = contextAssembler;
        this.launcher = launcher;
        this.models = models;
        this.registry = registry;
        this.shutdownHandler = shutdownHandler;
        this.executor = executor;
    }

    /**
     * Launch a worker for an admitted run. Returns once the launch is handed off.
     */
    public void supervise(Task task, AgentRun run) {
        shutdownHandler.registerActiveRun(run.runId());
        try {
            executor.execute(() -> launch(task, run));
        } catch (RuntimeException e) {
            log.error("Could not schedule launch of run {}", run.runId(), e);
            closeFailed(run, "launch rejected: " + e.getMessage());
        }
    }

    /**
     * Remove the workspace of a task that is done or cancelled.
     * Failures are logged; the workspace is left for a later cleanup.
     */
    public void releaseWorkspace(Task task) {
        try {
            workspaceManager.teardown(task);
        } catch (RuntimeException e) {
            log.warn("Workspace teardown for task {} failed: {}", task.taskId(), e.getMessage());
        }
    }

    // ========== Launch ==========

    private void launch(Task task, AgentRun run) {
        try (LoggingContext ctx = LoggingContext.forRun(task.projectId(), task.taskId(), run.runId())) {
            WorkerHandle handle;
            try {
                handle = launcher.launch(prepare(task, run));
            } catch (RuntimeException e) {
                log.error("Failed to launch worker for run {}", run.runId(), e);
                closeFailed(run, e.getMessage());
                return;
            }

            registry.register(run.runId(), handle);
            handle.sessionId().thenAccept(sessionId -> persistSession(task, sessionId));
            handle.exit().whenComplete((exit, failure) -> onExit(task, run, exit, failure));
        }
    }

    private WorkerInvocation prepare(Task task, AgentRun run) {
        Workspace workspace = workspaceManager.ensureWorkspace(task);
        Task current = boardService.getTask(task.taskId());
        WorkflowStep step = workflowCatalog.step(current.projectId(), run.stepId());
        String prompt = contextAssembler.assemble(current, step, boardService.getComments(current.taskId()));

        return new WorkerInvocation(
            current.taskId(),
            run.runId(),
            prompt,
            workspace.path(),
            workspaceManager.resumeHandle(current).orElse(null),
            step.role(),
            models.resolve(step)
        );
    }

    private void persistSession(Task task, String sessionId) {
        if (sessionId == null) {
            return;
        }
        try {
            boardService.recordSession(task.taskId(), sessionId);
        } catch (RuntimeException e) {
            log.error("Failed to record session {} for task {}", sessionId, task.taskId(), e);
        }
    }

    // ========== Exit ==========

    private void onExit(Task task, AgentRun run, WorkerExit exit, Throwable failure) {
        try (LoggingContext ctx = LoggingContext.forRun(task.projectId(), task.taskId(), run.runId())) {
            registry.unregister(run.runId());
            if (failure != null) {
                runRecorder.fail(run.runId(), "worker lost: " + failure.getMessage());
            } else {
                persistSession(task, exit.sessionId());
                runRecorder.complete(run.runId(), exit.exitCode(), exit.error());
            }
            settle(task.taskId());
        } catch (RuntimeException e) {
            log.error("Failed to record exit of run {}", run.runId(), e);
        } finally {
            shutdownHandler.unregisterActiveRun(run.runId());
        }
    }

    /**
     * Post-run bookkeeping driven by where the worker left the task.
     */
    private void settle(UUID taskId) {
        Task after = boardService.getTask(taskId);
        Workflow workflow = workflowCatalog.get(after.projectId());
        boolean terminal = workflow.isTerminal(after.stepId());

        if (terminal) {
            boardService.synchronizeFanIn(taskId);
        }
        if (terminal || after.cancelled()) {
            releaseWorkspace(after);
        }
    }

    /**
     * Record a run that never got a worker. The task may have been completed or
     * cancelled meanwhile, and its cleanup was left to this run's end.
     */
    private void closeFailed(AgentRun run, String error) {
        try {
            runRecorder.fail(run.runId(), error);
            settle(run.taskId());
        } catch (RuntimeException e) {
            log.error("Failed to record launch failure of run {}", run.runId(), e);
        } finally {
            shutdownHandler.unregisterActiveRun(run.runId());
        }
    }
}
