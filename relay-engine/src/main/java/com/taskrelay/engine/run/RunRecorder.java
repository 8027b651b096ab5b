package com.taskrelay.engine.run;

import com.taskrelay.core.exception.NotFoundException;
import com.taskrelay.core.model.AgentRun;
import com.taskrelay.core.model.EventType;
import com.taskrelay.core.model.Task;
import com.taskrelay.core.model.WorkflowStep;
import com.taskrelay.core.repository.AgentRunRepository;
import com.taskrelay.core.repository.TaskRepository;
import com.taskrelay.engine.metrics.RelayMetrics;
import com.taskrelay.engine.outbox.EventOutbox;
import com.taskrelay.engine.outbox.EventPayloads;
import com.taskrelay.engine.workflow.WorkflowCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Records the lifecycle of worker runs.
 *
 * A run is opened inside the dispatcher's admission transaction and closed exactly
 * once, by whichever of worker exit, launch failure or recovery gets there first.
 */
@Component
public class RunRecorder {

    private static final Logger log = LoggerFactory.getLogger(RunRecorder.class);

    private final AgentRunRepository runRepository;
    private final TaskRepository taskRepository;
    private final WorkflowCatalog workflowCatalog;
    private final EventOutbox outbox;
    private final EventPayloads payloads;
    private final RelayMetrics metrics;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public RunRecorder(
            AgentRunRepository runRepository,
            TaskRepository taskRepository,
            WorkflowCatalog workflowCatalog,
            EventOutbox outbox,
            EventPayloads payloads,
            RelayMetrics metrics,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        this.runRepository = runRepository;
        this.taskRepository = taskRepository;
        this.workflowCatalog = workflowCatalog;
        this.outbox = outbox;
        this.payloads = payloads;
        this.metrics = metrics;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    /**
     * Open a run for the task at its current step.
     * Must be called inside the transaction that admitted the task.
     */
    public AgentRun start(Task task) {
        AgentRun run = AgentRun.start(task.taskId(), task.stepId(), clock.instant());
        runRepository.save(run);

        WorkflowStep step = workflowCatalog.step(task.projectId(), task.stepId());
        outbox.record(EventType.RUN_STARTED, task.projectId(), task.taskId(), payloads.run(run, step));
        metrics.runStarted(step.role() != null ? step.role().wireName() : "none");

        log.info("Started run {} for task {} at step {}", run.runId(), task.taskId(), step.name());
        return run;
    }

    /**
     * Close a run with the worker's exit status.
     *
     * @return the completed run, or empty if it had already been closed
     */
    public Optional<AgentRun> complete(UUID runId, int exitCode, String error) {
        Optional<AgentRun> completed = transactionTemplate.execute(status -> {
            if (!runRepository.complete(runId, clock.instant(), exitCode, error)) {
                return Optional.<AgentRun>empty();
            }
            AgentRun run = runRepository.findById(runId)
                .orElseThrow(() -> new NotFoundException("AgentRun", runId.toString()));
            Task task = taskRepository.findById(run.taskId())
                .orElseThrow(() -> new NotFoundException("Task", run.taskId().toString()));
            WorkflowStep step = workflowCatalog.step(task.projectId(), run.stepId());
            outbox.record(EventType.RUN_COMPLETED, task.projectId(), task.taskId(), payloads.run(run, step));
            return Optional.of(run);
        });

        if (completed == null || completed.isEmpty()) {
            log.debug("Run {} was already completed", runId);
            return Optional.empty();
        }

        AgentRun run = completed.get();
        metrics.runCompleted(outcomeOf(exitCode), run.duration(clock.instant()));
        if (exitCode == 0) {
            log.info("Run {} for task {} completed", runId, run.taskId());
        } else {
            log.warn("Run {} for task {} ended with exit code {}: {}", runId, run.taskId(), exitCode, error);
        }
        return completed;
    }

    /**
     * Close a run whose worker never started or was killed by the engine.
     */
    public Optional<AgentRun> fail(UUID runId, String error) {
        return complete(runId, AgentRun.LAUNCH_FAILURE_EXIT_CODE, error);
    }

    public Optional<AgentRun> activeRun(UUID taskId) {
        return runRepository.findActiveByTask(taskId);
    }

    public List<AgentRun> activeRuns() {
        return runRepository.findActive();
    }

    /**
     * Get active runs that started before the given instant.
     */
    public List<AgentRun> activeRunsStartedBefore(Instant cutoff) {
        return runRepository.findActiveStartedBefore(cutoff);
    }

    public int countActive() {
        return runRepository.countActive();
    }

    private static String outcomeOf(int exitCode) {
        if (exitCode == 0) {
            return "success";
        }
        return exitCode == AgentRun.LAUNCH_FAILURE_EXIT_CODE ? "aborted" : "failure";
    }
}
