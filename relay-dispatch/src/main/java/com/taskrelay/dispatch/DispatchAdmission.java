package com.taskrelay.dispatch;

import com.taskrelay.core.model.AgentRun;
import com.taskrelay.core.model.ConsumerClass;
import com.taskrelay.core.model.Event;
import com.taskrelay.core.model.EventType;
import com.taskrelay.core.model.Task;
import com.taskrelay.core.model.Workflow;
import com.taskrelay.core.model.WorkflowStep;
import com.taskrelay.core.repository.AgentRunRepository;
import com.taskrelay.core.repository.TaskRepository;
import com.taskrelay.engine.graph.DependencyGraph;
import com.taskrelay.engine.outbox.EventOutbox;
import com.taskrelay.engine.run.RunRecorder;
import com.taskrelay.engine.workflow.WorkflowCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;
import java.util.UUID;

/**
 * Decides, in one transaction, whether a dispatch event launches a worker.
 *
 * Guards run in this order:
 * <ol>
 *   <li>the event names a step the task has since left: stale, consumed</li>
 *   <li>the task's step launches no worker: consumed</li>
 *   <li>the task is cancelled: consumed</li>
 *   <li>the task already has an active run: consumed (no double dispatch)</li>
 *   <li>active runs are at the cap: left unconsumed for a later cycle</li>
 *   <li>a predecessor is unfinished: consumed, a {@code task_ready} event follows</li>
 *   <li>the milestone parent has not approved its plan: consumed, approval re-announces</li>
 * </ol>
 * Checks from the idempotency guard on hold the admission lock, so two dispatchers
 * can never both see room under the cap or both miss an active run.
 */
public class DispatchAdmission {

    private static final Logger log = LoggerFactory.getLogger(DispatchAdmission.class);

    private final TaskRepository taskRepository;
    private final AgentRunRepository runRepository;
    private final WorkflowCatalog workflowCatalog;
    private final DependencyGraph dependencyGraph;
    private final RunRecorder runRecorder;
    private final EventOutbox outbox;
    private final TransactionTemplate transactionTemplate;
    private final int maxParallelAgents;

    public DispatchAdmission(
            TaskRepository taskRepository,
            AgentRunRepository runRepository,
            WorkflowCatalog workflowCatalog,
            DependencyGraph dependencyGraph,
            RunRecorder runRecorder,
            EventOutbox outbox,
            TransactionTemplate transactionTemplate,
            int maxParallelAgents) {
        if (maxParallelAgents < 1) {
            throw new IllegalArgumentException("maxParallelAgents must be at least 1, got " + maxParallelAgents);
        }
        this.taskRepository = taskRepository;
        this.runRepository = runRepository;
        this.workflowCatalog = workflowCatalog;
        this.dependencyGraph = dependencyGraph;
        this.runRecorder = runRecorder;
        this.outbox = outbox;
        this.transactionTemplate = transactionTemplate;
        this.maxParallelAgents = maxParallelAgents;
    }

    public int maxParallelAgents() {
        return maxParallelAgents;
    }

    /**
     * Evaluate the event and, unless capacity defers it, mark it consumed by dispatch
     * in the same transaction.
     */
    public Admission admit(Event event) {
        return transactionTemplate.execute(status -> {
            Admission admission = evaluate(event);
            if (admission.decision().consumesEvent()) {
                outbox.markConsumed(event.eventId(), ConsumerClass.DISPATCH);
            }
            return admission;
        });
    }

    private Admission evaluate(Event event) {
        if (event.taskId() == null || !(event.type().isDispatchCandidate() || event.type() == EventType.TASK_CANCELLED)) {
            return Admission.of(DispatchDecision.IGNORED, null);
        }
        Optional<Task> found = taskRepository.findById(event.taskId());
        if (found.isEmpty()) {
            log.warn("Event {} refers to unknown task {}", event.eventId(), event.taskId());
            return Admission.of(DispatchDecision.IGNORED, null);
        }
        Task task = found.get();
        Workflow workflow = workflowCatalog.get(task.projectId());

        if (isCleanup(event, task, workflow)) {
            boolean active = runRepository.findActiveByTask(task.taskId()).isPresent();
            if (active) {
                log.info("Task {} has an active run; workspace teardown deferred to worker exit", task.taskId());
            }
            return Admission.cleanup(task, !active);
        }
        if (event.type() == EventType.TASK_CANCELLED) {
            // Cancelled and since restored or moved on; the later event decides.
            return Admission.of(DispatchDecision.STALE, task);
        }

        UUID enteredStep = event.enteredStepId().orElse(task.stepId());
        if (!enteredStep.equals(task.stepId())) {
            log.debug("Event {} is stale: task {} has left that step", event.eventId(), task.taskId());
            return Admission.of(DispatchDecision.STALE, task);
        }

        WorkflowStep step = workflow.findById(task.stepId()).orElseThrow();
        if (!step.dispatchable()) {
            return Admission.of(DispatchDecision.NOT_DISPATCHABLE, task);
        }
        if (task.cancelled()) {
            return Admission.of(DispatchDecision.CANCELLED, task);
        }

        runRepository.lockAdmission();

        if (runRepository.findActiveByTask(task.taskId()).isPresent()) {
            log.debug("Task {} already has an active run", task.taskId());
            return Admission.of(DispatchDecision.ALREADY_ACTIVE, task);
        }
        int active = runRepository.countActive();
        if (active >= maxParallelAgents) {
            log.debug("At capacity ({}/{}), deferring task {}", active, maxParallelAgents, task.taskId());
            return Admission.of(DispatchDecision.DEFERRED_CAPACITY, task);
        }
        if (dependencyGraph.isBlocked(task.taskId())) {
            log.info("Task {} is blocked by unfinished predecessors", task.taskId());
            return Admission.of(DispatchDecision.BLOCKED, task);
        }
        if (dependencyGraph.isAwaitingPlanApproval(task)) {
            log.info("Task {} waits for its milestone plan to be approved", task.taskId());
            return Admission.of(DispatchDecision.AWAITING_PLAN_APPROVAL, task);
        }

        AgentRun run = runRecorder.start(task);
        return Admission.launched(task, run);
    }

    /**
     * A cancellation of a still-cancelled task, or a move into the terminal step the
     * task still occupies.
     */
    private static boolean isCleanup(Event event, Task task, Workflow workflow) {
        if (event.type() == EventType.TASK_CANCELLED) {
            return task.cancelled();
        }
        if (event.type() != EventType.TASK_MOVED || !workflow.isTerminal(task.stepId())) {
            return false;
        }
        return event.enteredStepId().map(task.stepId()::equals).orElse(false);
    }
}
