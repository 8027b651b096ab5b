package com.taskrelay.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One worker invocation for a task.
 *
 * Primary Key: runId
 *
 * Invariants:
 * - a run is active while completedAt is null
 * - once completedAt is set the row is immutable
 * - at most one active run per task (enforced by dispatch admission)
 */
public record AgentRun(
    UUID runId,
    UUID taskId,
    UUID stepId,
    Instant startedAt,
    Instant completedAt,
    Integer exitCode,
    String error
) {
    /**
     * Exit code recorded when the worker could not be started or was killed by the engine.
     */
    public static final int LAUNCH_FAILURE_EXIT_CODE = -1;

    /**
     * Start a new run at the task's current step.
     */
    public static AgentRun start(UUID taskId, UUID stepId) {
        return start(taskId, stepId, Instant.now());
    }

    public static AgentRun start(UUID taskId, UUID stepId, Instant startedAt) {
        return new AgentRun(UUID.randomUUID(), taskId, stepId, startedAt, null, null, null);
    }

    public AgentRun withCompleted(Instant at, int code, String errorMessage) {
        return new AgentRun(runId, taskId, stepId, startedAt, at, code, errorMessage);
    }

    public boolean isActive() {
        return completedAt == null;
    }

    public boolean isSuccessful() {
        return completedAt != null && exitCode != null && exitCode == 0;
    }

    /**
     * Get the run duration, measured up to {@code now} for an active run.
     */
    public Duration duration(Instant now) {
        return Duration.between(startedAt, completedAt != null ? completedAt : now);
    }
}
