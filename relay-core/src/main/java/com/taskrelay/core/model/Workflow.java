package com.taskrelay.core.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ordered steps of one project and the rules for moving a task between them.
 *
 * Transition rules:
 * - exactly one step forward (linear progress)
 * - any earlier step (send back for rework)
 * - the same step, or skipping forward, is invalid
 * - the terminal step (highest position) has no forward transition
 *
 * Cancellation is a flag on the task, not a step move, so it is not modelled here.
 */
public record Workflow(UUID projectId, List<WorkflowStep> steps) {

    public Workflow {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Workflow for project " + projectId + " has no steps");
        }
        steps = steps.stream()
            .sorted(Comparator.comparingInt(WorkflowStep::position))
            .toList();
    }

    public WorkflowStep first() {
        return steps.get(0);
    }

    public WorkflowStep terminal() {
        return steps.get(steps.size() - 1);
    }

    public boolean isTerminal(UUID stepId) {
        return terminal().stepId().equals(stepId);
    }

    public Optional<WorkflowStep> findById(UUID stepId) {
        return steps.stream().filter(s -> s.stepId().equals(stepId)).findFirst();
    }

    public Optional<WorkflowStep> findByName(String name) {
        return steps.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    /**
     * Get the step immediately after the given one, if any.
     */
    public Optional<WorkflowStep> next(WorkflowStep step) {
        int index = indexOf(step);
        return index + 1 < steps.size() ? Optional.of(steps.get(index + 1)) : Optional.empty();
    }

    /**
     * Get the lowest-positioned step that launches a worker.
     */
    public Optional<WorkflowStep> firstDispatchable() {
        return steps.stream().filter(WorkflowStep::dispatchable).findFirst();
    }

    /**
     * Check if a task sitting at {@code from} may move to {@code to}.
     */
    public boolean canTransition(WorkflowStep from, WorkflowStep to) {
        int fromIndex = indexOf(from);
        int toIndex = indexOf(to);
        return toIndex == fromIndex + 1 || toIndex < fromIndex;
    }

    /**
     * Get all steps a task at {@code from} may move to, in position order.
     */
    public List<WorkflowStep> validTargets(WorkflowStep from) {
        List<WorkflowStep> targets = new ArrayList<>();
        for (WorkflowStep candidate : steps) {
            if (canTransition(from, candidate)) {
                targets.add(candidate);
            }
        }
        return targets;
    }

    private int indexOf(WorkflowStep step) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).stepId().equals(step.stepId())) {
                return i;
            }
        }
        throw new IllegalArgumentException(
            "Step " + step.name() + " does not belong to project " + projectId);
    }
}
