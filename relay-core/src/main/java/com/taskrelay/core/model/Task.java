package com.taskrelay.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A unit of work on the board.
 *
 * Primary Key: taskId
 * Foreign keys: projectId, stepId (a step of the same project), parentTaskId
 *
 * Invariants:
 * - never hard-deleted, only cancelled
 * - planApproved is only meaningful for MILESTONE tasks
 * - workspacePath/branch/sessionId are set on first dispatch and cleared on teardown
 * - fanInParentId is set only on the synchronization task created when a parent's
 *   children all finish; the store keeps it unique
 */
public record Task(
    // Identity
    UUID taskId,
    UUID projectId,
    UUID parentTaskId,

    // Content
    String title,
    String description,
    TaskKind kind,

    // Position and flags
    UUID stepId,
    boolean cancelled,
    boolean planApproved,
    String output,

    // Workspace and session
    String workspacePath,
    String branch,
    String sessionId,

    // Fan-in marker
    UUID fanInParentId,

    // Timestamps
    Instant createdAt,
    Instant updatedAt
) {
    /**
     * Create a new task at the given step.
     */
    public static Task create(
            UUID projectId,
            UUID parentTaskId,
            String title,
            String description,
            TaskKind kind,
            UUID stepId) {
        Instant now = Instant.now();
        return new Task(
            UUID.randomUUID(),
            projectId,
            parentTaskId,
            title,
            description,
            kind != null ? kind : TaskKind.UNIT,
            stepId,
            false,
            false,
            null,
            null,
            null,
            null,
            null,
            now,
            now
        );
    }

    /**
     * Create the synchronization task that follows all children of {@code parent}.
     */
    public static Task createSynchronization(Task parent, String title, String description, UUID stepId) {
        Task task = create(parent.projectId(), parent.taskId(), title, description, TaskKind.UNIT, stepId);
        return new Task(
            task.taskId, task.projectId, task.parentTaskId, task.title, task.description, task.kind,
            task.stepId, false, false, null, null, null, null,
            parent.taskId(),
            task.createdAt, task.updatedAt
        );
    }

    public Task withStep(UUID newStepId) {
        return new Task(taskId, projectId, parentTaskId, title, description, kind,
            newStepId, cancelled, planApproved, output, workspacePath, branch, sessionId,
            fanInParentId, createdAt, Instant.now());
    }

    public Task withCancelled(boolean newCancelled) {
        return new Task(taskId, projectId, parentTaskId, title, description, kind,
            stepId, newCancelled, planApproved, output, workspacePath, branch, sessionId,
            fanInParentId, createdAt, Instant.now());
    }

    public Task withPlanApproved() {
        return new Task(taskId, projectId, parentTaskId, title, description, kind,
            stepId, cancelled, true, output, workspacePath, branch, sessionId,
            fanInParentId, createdAt, Instant.now());
    }

    public Task withOutput(String newOutput) {
        return new Task(taskId, projectId, parentTaskId, title, description, kind,
            stepId, cancelled, planApproved, newOutput, workspacePath, branch, sessionId,
            fanInParentId, createdAt, Instant.now());
    }

    public Task withWorkspace(String newWorkspacePath, String newBranch) {
        return new Task(taskId, projectId, parentTaskId, title, description, kind,
            stepId, cancelled, planApproved, output, newWorkspacePath, newBranch, sessionId,
            fanInParentId, createdAt, Instant.now());
    }

    public Task withSessionId(String newSessionId) {
        return new Task(taskId, projectId, parentTaskId, title, description, kind,
            stepId, cancelled, planApproved, output, workspacePath, branch, newSessionId,
            fanInParentId, createdAt, Instant.now());
    }

    /**
     * Clear workspace, branch and session after teardown.
     */
    public Task withoutWorkspace() {
        return new Task(taskId, projectId, parentTaskId, title, description, kind,
            stepId, cancelled, planApproved, output, null, null, null,
            fanInParentId, createdAt, Instant.now());
    }

    public boolean hasParent() {
        return parentTaskId != null;
    }

    public boolean hasWorkspace() {
        return workspacePath != null && !workspacePath.isEmpty();
    }

    public boolean isSynchronization() {
        return fanInParentId != null;
    }

    public boolean isMilestone() {
        return kind == TaskKind.MILESTONE;
    }
}
