package com.taskrelay.core.model;

import java.util.UUID;

/**
 * Request to create a task.
 * A null stepName places the task in the project's first step.
 */
public record NewTask(
    String title,
    String description,
    TaskKind kind,
    UUID parentTaskId,
    String stepName
) {
    public static NewTask of(String title, String description) {
        return new NewTask(title, description, TaskKind.UNIT, null, null);
    }

    public NewTask atStep(String newStepName) {
        return new NewTask(title, description, kind, parentTaskId, newStepName);
    }

    public NewTask underParent(UUID newParentTaskId) {
        return new NewTask(title, description, kind, newParentTaskId, stepName);
    }

    public NewTask ofKind(TaskKind newKind) {
        return new NewTask(title, description, newKind, parentTaskId, stepName);
    }
}
