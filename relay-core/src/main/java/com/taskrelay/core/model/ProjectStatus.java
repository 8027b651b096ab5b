package com.taskrelay.core.model;

/**
 * Lifecycle states for a project.
 */
public enum ProjectStatus {
    /**
     * Accepting tasks and dispatching workers.
     * Transitions: -> CANCELLED
     */
    ACTIVE,

    /**
     * Closed. Terminal state.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == CANCELLED;
    }

    public boolean canTransitionTo(ProjectStatus target) {
        return switch (this) {
            case ACTIVE -> target == CANCELLED;
            case CANCELLED -> false;
        };
    }
}
