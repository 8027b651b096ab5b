package com.taskrelay.engine.graph;

import com.taskrelay.core.exception.NotFoundException;
import com.taskrelay.core.model.Task;
import com.taskrelay.core.model.Workflow;
import com.taskrelay.core.repository.DependencyRepository;
import com.taskrelay.core.repository.TaskRepository;
import com.taskrelay.engine.workflow.WorkflowCatalog;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Derived views over the stored dependency edges.
 *
 * Nothing here is persisted: blocked state is computed from the edges and the
 * predecessors' current steps on every call, so it is never stale.
 *
 * Policy: a cancelled predecessor counts as satisfied.
 */
@Component
public class DependencyGraph {

    private final DependencyRepository dependencyRepository;
    private final TaskRepository taskRepository;
    private final WorkflowCatalog workflowCatalog;

    public DependencyGraph(
            DependencyRepository dependencyRepository,
            TaskRepository taskRepository,
            WorkflowCatalog workflowCatalog) {
        this.dependencyRepository = dependencyRepository;
        this.taskRepository = taskRepository;
        this.workflowCatalog = workflowCatalog;
    }

    /**
     * Check if any predecessor of the task is neither cancelled nor at its project's terminal step.
     */
    public boolean isBlocked(UUID taskId) {
        return !blockingPredecessors(taskId).isEmpty();
    }

    /**
     * Get the predecessors currently holding the task back.
     */
    public List<Task> blockingPredecessors(UUID taskId) {
        List<Task> blocking = new ArrayList<>();
        for (UUID predecessorId : dependencyRepository.findPredecessorIds(taskId)) {
            Task predecessor = taskRepository.findById(predecessorId)
                .orElseThrow(() -> new NotFoundException("Task", predecessorId.toString()));
            if (!isSatisfied(predecessor)) {
                blocking.add(predecessor);
            }
        }
        return blocking;
    }

    /**
     * Check if the task's milestone parent still has to approve its plan.
     * Synchronization tasks are exempt: their siblings have already run.
     */
    public boolean isAwaitingPlanApproval(Task task) {
        if (!task.hasParent() || task.isSynchronization()) {
            return false;
        }
        Optional<Task> parent = taskRepository.findById(task.parentTaskId());
        return parent.isPresent() && parent.get().isMilestone() && !parent.get().planApproved();
    }

    /**
     * Check if a task may dispatch as far as the graph is concerned:
     * not cancelled, not blocked, not waiting on plan approval.
     */
    public boolean isReady(Task task) {
        return !task.cancelled() && !isAwaitingPlanApproval(task) && !isBlocked(task.taskId());
    }

    /**
     * Get the successors of a task that are ready now.
     * Called after the task finished or was cancelled.
     */
    public List<Task> readySuccessors(UUID taskId) {
        List<Task> ready = new ArrayList<>();
        for (UUID successorId : dependencyRepository.findSuccessorIds(taskId)) {
            taskRepository.findById(successorId)
                .filter(this::isReady)
                .ifPresent(ready::add);
        }
        return ready;
    }

    /**
     * Check if adding {@code predecessor -> successor} would close a cycle,
     * i.e. the predecessor is already reachable from the successor.
     */
    public boolean wouldCreateCycle(UUID predecessorId, UUID successorId) {
        if (predecessorId.equals(successorId)) {
            return true;
        }
        Set<UUID> visited = new HashSet<>();
        Deque<UUID> queue = new ArrayDeque<>();
        queue.add(successorId);
        while (!queue.isEmpty()) {
            UUID current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            for (UUID next : dependencyRepository.findSuccessorIds(current)) {
                if (next.equals(predecessorId)) {
                    return true;
                }
                queue.add(next);
            }
        }
        return false;
    }

    private boolean isSatisfied(Task predecessor) {
        if (predecessor.cancelled()) {
            return true;
        }
        Workflow workflow = workflowCatalog.get(predecessor.projectId());
        return workflow.isTerminal(predecessor.stepId());
    }
}
