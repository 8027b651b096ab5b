package com.taskrelay.engine.fanin;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskrelay.core.exception.NotFoundException;
import com.taskrelay.core.model.EventType;
import com.taskrelay.core.model.Task;
import com.taskrelay.core.model.Workflow;
import com.taskrelay.core.model.WorkflowStep;
import com.taskrelay.core.repository.TaskRepository;
import com.taskrelay.engine.metrics.RelayMetrics;
import com.taskrelay.engine.outbox.EventOutbox;
import com.taskrelay.engine.outbox.EventPayloads;
import com.taskrelay.engine.workflow.WorkflowCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Synchronizes sibling tasks into one follow-up task.
 *
 * When the last child of a parent settles (reaches the terminal step or is cancelled)
 * and at least one child actually finished, exactly one synchronization task is created
 * under the parent at the project's first dispatchable step.
 *
 * Duplicate suppression: the parent row is locked for the rest of the caller's
 * transaction before the sibling scan, so two siblings finishing together are
 * serialized and the second sees the first's synchronization task. The store's
 * unique constraint on fan_in_parent_id backs this up.
 *
 * Must be called inside the transaction that settled the child.
 */
@Component
public class FanInSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(FanInSynchronizer.class);

    static final String TITLE_PREFIX = "Synchronize: ";

    private final TaskRepository taskRepository;
    private final WorkflowCatalog workflowCatalog;
    private final EventOutbox outbox;
    private final EventPayloads payloads;
    private final RelayMetrics metrics;

    public FanInSynchronizer(
            TaskRepository taskRepository,
            WorkflowCatalog workflowCatalog,
            EventOutbox outbox,
            EventPayloads payloads,
            RelayMetrics metrics) {
        this.taskRepository = taskRepository;
        this.workflowCatalog = workflowCatalog;
        this.outbox = outbox;
        this.payloads = payloads;
        this.metrics = metrics;
    }

    /**
     * Run the fan-in check for a child that just settled.
     *
     * @return the synchronization task if this call created it
     */
    public Optional<Task> onChildSettled(Task child) {
        if (!child.hasParent() || child.isSynchronization()) {
            return Optional.empty();
        }

        Task parent = taskRepository.findByIdForUpdate(child.parentTaskId())
            .orElseThrow(() -> new NotFoundException("Task", child.parentTaskId().toString()));

        if (taskRepository.findSynchronizationTask(parent.taskId()).isPresent()) {
            log.debug("Parent {} already has a synchronization task", parent.taskId());
            return Optional.empty();
        }

        Workflow workflow = workflowCatalog.get(parent.projectId());
        List<Task> siblings = taskRepository.findChildren(parent.taskId()).stream()
            .filter(t -> !t.isSynchronization())
            .toList();

        boolean allSettled = siblings.stream()
            .allMatch(t -> t.cancelled() || workflow.isTerminal(t.stepId()));
        boolean anyFinished = siblings.stream()
            .anyMatch(t -> !t.cancelled() && workflow.isTerminal(t.stepId()));

        if (!allSettled || !anyFinished) {
            return Optional.empty();
        }

        WorkflowStep step = workflow.firstDispatchable().orElse(workflow.first());
        Task sync = Task.createSynchronization(
            parent, TITLE_PREFIX + parent.title(), describe(siblings), step.stepId());
        taskRepository.save(sync);

        ObjectNode payload = payloads.task(sync, step);
        ArrayNode synchronizes = payload.putArray("synchronizes");
        siblings.forEach(s -> synchronizes.add(s.taskId().toString()));
        outbox.record(EventType.TASK_CREATED, sync.projectId(), sync.taskId(), payload);

        metrics.fanInCreated();
        log.info("Created synchronization task {} for parent {} after {} children settled",
            sync.taskId(), parent.taskId(), siblings.size());
        return Optional.of(sync);
    }

    private static String describe(List<Task> siblings) {
        StringBuilder description = new StringBuilder("All subtasks have settled:\n");
        for (Task sibling : siblings) {
            description.append("- ").append(sibling.title())
                .append(sibling.cancelled() ? " (cancelled)" : " (done)");
            if (sibling.output() != null && !sibling.output().isBlank()) {
                description.append("\n  Output: ").append(sibling.output());
            }
            description.append('\n');
        }
        return description.toString();
    }
}
