package com.taskrelay.core.model;

/**
 * Definition of a workflow step supplied when a project is created.
 * Describes the column, not its identity or position.
 *
 * Invariants:
 * - name is non-empty
 * - a dispatchable step names the worker role it launches
 */
public record StepDefinition(
    String name,
    boolean dispatchable,
    WorkerRole role,
    String model,
    String instructions
) {
    /**
     * A step humans (or workers) move tasks through without launching anything.
     */
    public static StepDefinition manual(String name) {
        return new StepDefinition(name, false, null, null, null);
    }

    /**
     * A step that launches a worker in the given role when a task arrives.
     */
    public static StepDefinition dispatch(String name, WorkerRole role) {
        return new StepDefinition(name, true, role, null, null);
    }

    public StepDefinition withModel(String newModel) {
        return new StepDefinition(name, dispatchable, role, newModel, instructions);
    }

    public StepDefinition withInstructions(String newInstructions) {
        return new StepDefinition(name, dispatchable, role, model, newInstructions);
    }
}
