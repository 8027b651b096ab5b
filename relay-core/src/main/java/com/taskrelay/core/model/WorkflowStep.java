package com.taskrelay.core.model;

import java.util.UUID;

/**
 * One column of a project's workflow.
 * Immutable after project creation.
 *
 * Primary Key: stepId
 * Unique: (projectId, position), (projectId, name)
 *
 * Instructions are opaque text handed to the worker; the engine never interprets them.
 */
public record WorkflowStep(
    UUID stepId,
    UUID projectId,
    int position,
    String name,
    boolean dispatchable,
    WorkerRole role,
    String model,
    String instructions
) {
    public WorkflowStep {
        if (dispatchable && role == null) {
            throw new IllegalArgumentException("Dispatchable step '" + name + "' must declare a worker role");
        }
    }

    public static WorkflowStep create(UUID projectId, int position, StepDefinition definition) {
        return new WorkflowStep(
            UUID.randomUUID(),
            projectId,
            position,
            definition.name(),
            definition.dispatchable(),
            definition.role(),
            definition.model(),
            definition.instructions()
        );
    }

    /**
     * Get the model to run, falling back to the configured default.
     */
    public String effectiveModel(String defaultModel) {
        return model != null && !model.isBlank() ? model : defaultModel;
    }
}
