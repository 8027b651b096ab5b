package com.taskrelay.core.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Types of board mutation recorded in the event outbox.
 * Closed set: every externally observable mutation maps to exactly one of these.
 */
public enum EventType {
    // Project events
    PROJECT_CREATED,
    PROJECT_CANCELLED,

    // Task lifecycle events
    TASK_CREATED,
    TASK_MOVED,
    TASK_CANCELLED,
    TASK_UNCANCELLED,
    TASK_UPDATED,
    TASK_READY,
    PLAN_APPROVED,

    // Comment events
    COMMENT_ADDED,

    // Dependency events
    DEPENDENCY_CREATED,
    DEPENDENCY_REMOVED,

    // Run events
    RUN_STARTED,
    RUN_COMPLETED;

    private static final Set<EventType> DISPATCH_CANDIDATES =
        EnumSet.of(TASK_CREATED, TASK_MOVED, TASK_READY, TASK_UNCANCELLED);

    /**
     * Lower-case name used on the wire, e.g. {@code task_created}.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Check if this event may announce a task entering a step that launches a worker.
     * Whether it actually does depends on the task's current step.
     */
    public boolean isDispatchCandidate() {
        return DISPATCH_CANDIDATES.contains(this);
    }
}
