package com.taskrelay.recovery;

import com.taskrelay.core.model.AgentRun;
import com.taskrelay.core.model.Task;
import com.taskrelay.core.model.Workflow;
import com.taskrelay.core.repository.TaskRepository;
import com.taskrelay.engine.logging.LoggingContext;
import com.taskrelay.engine.run.RunRecorder;
import com.taskrelay.engine.workflow.WorkflowCatalog;
import com.taskrelay.engine.workspace.WorkspaceManager;
import com.taskrelay.worker.WorkerProcessRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Recovery Engine responsible for detecting and recovering from failures.
 *
 * Responsibilities:
 * - Close runs left open by a previous coordinator process (at start)
 * - Reclaim workspaces of finished or cancelled tasks whose teardown never ran (at start)
 * - Optionally terminate workers that run past the configured timeout
 */
public class RecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEngine.class);

    static final String ORPHANED_ERROR = "orphaned by coordinator restart";

    private final RunRecorder runRecorder;
    private final TaskRepository taskRepository;
    private final WorkflowCatalog workflowCatalog;
    private final WorkspaceManager workspaceManager;
    private final WorkerProcessRegistry registry;
    private final Clock clock;
    private final boolean watchdogEnabled;
    private final Duration runTimeout;
    private final Duration checkInterval;

    private ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public RecoveryEngine(
            RunRecorder runRecorder,
            TaskRepository taskRepository,
            WorkflowCatalog workflowCatalog,
            WorkspaceManager workspaceManager,
            WorkerProcessRegistry registry,
            Clock clock,
            boolean watchdogEnabled,
            Duration runTimeout,
            Duration checkInterval) {
        this.runRecorder = runRecorder;
        this.taskRepository = taskRepository;
        this.workflowCatalog = workflowCatalog;
        this.workspaceManager = workspaceManager;
        this.registry = registry;
        this.clock = clock;
        this.watchdogEnabled = watchdogEnabled;
        this.runTimeout = runTimeout;
        this.checkInterval = checkInterval;
    }

    /**
     * Start the recovery engine.
     * Startup recovery runs synchronously so the dispatcher never sees orphaned runs.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Recovery engine already running");
            return;
        }
        running = true;
        log.info("Starting recovery engine");

        recoverOrphanedRuns();
        reclaimSettledWorkspaces();

        if (watchdogEnabled) {
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread thread = new Thread(r, "run-watchdog");
                thread.setDaemon(true);
                return thread;
            });
            scheduler.scheduleWithFixedDelay(
                this::detectStuckRuns,
                checkInterval.toMillis(),
                checkInterval.toMillis(),
                TimeUnit.MILLISECONDS
            );
            log.info("Run watchdog started (timeout {}m, check every {}s)",
                runTimeout.toMinutes(), checkInterval.toSeconds());
        }

        log.info("Recovery engine started");
    }

    /**
     * Stop the recovery engine.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Recovery engine stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Close every active run that no worker in this process supervises.
     * Freed runs no longer count against capacity nor block re-dispatch.
     *
     * @return the number of runs closed
     */
    public int recoverOrphanedRuns() {
        List<AgentRun> active = runRecorder.activeRuns();
        int recovered = 0;
        for (AgentRun run : active) {
            if (registry.isLive(run.runId())) {
                continue;
            }
            try (LoggingContext ctx = LoggingContext.forRun(null, run.taskId(), run.runId())) {
                if (runRecorder.fail(run.runId(), ORPHANED_ERROR).isPresent()) {
                    recovered++;
                    log.warn("Closed orphaned run {} of task {} (started {})",
                        run.runId(), run.taskId(), run.startedAt());
                }
            } catch (Exception e) {
                log.error("Failed to recover run {}", run.runId(), e);
            }
        }
        if (recovered > 0) {
            log.info("Recovered {} orphaned runs", recovered);
        }
        return recovered;
    }

    /**
     * Tear down workspaces still recorded on tasks that are done or cancelled and have
     * no active run.
     *
     * @return the number of workspaces removed
     */
    public int reclaimSettledWorkspaces() {
        int reclaimed = 0;
        try {
            workspaceManager.prune();
        } catch (Exception e) {
            log.warn("Worktree prune failed: {}", e.getMessage());
        }
        for (Task task : taskRepository.findWithWorkspace()) {
            Workflow workflow = workflowCatalog.get(task.projectId());
            boolean settled = task.cancelled() || workflow.isTerminal(task.stepId());
            if (!settled || runRecorder.activeRun(task.taskId()).isPresent()) {
                continue;
            }
            try (LoggingContext ctx = LoggingContext.forTask(task.projectId(), task.taskId())) {
                workspaceManager.teardown(task);
                reclaimed++;
            } catch (Exception e) {
                log.error("Failed to reclaim workspace of task {}", task.taskId(), e);
            }
        }
        if (reclaimed > 0) {
            log.info("Reclaimed {} leftover workspaces", reclaimed);
        }
        return reclaimed;
    }

    private void detectStuckRuns() {
        if (!running) return;

        try {
            timeOutStuckRuns();
        } catch (Exception e) {
            log.error("Error in stuck run detection", e);
        }
    }

    /**
     * Terminate workers active longer than the run timeout and record the runs as timed out.
     *
     * @return the number of runs timed out
     */
    public int timeOutStuckRuns() {
        Instant cutoff = clock.instant().minus(runTimeout);
        int timedOut = 0;
        for (AgentRun run : runRecorder.activeRunsStartedBefore(cutoff)) {
            try (LoggingContext ctx = LoggingContext.forRun(null, run.taskId(), run.runId())) {
                Duration age = run.duration(clock.instant());
                log.warn("Run {} of task {} has been active for {}m, terminating",
                    run.runId(), run.taskId(), age.toMinutes());

                // Record first so the worker's own exit finds the run already closed.
                runRecorder.fail(run.runId(), "timed out after " + age.toMinutes() + " minutes");
                if (!registry.terminate(run.runId())) {
                    log.warn("No live worker for run {}", run.runId());
                }
                timedOut++;
            } catch (Exception e) {
                log.error("Failed to time out run {}", run.runId(), e);
            }
        }
        return timedOut;
    }
}
