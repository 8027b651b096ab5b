package com.taskrelay.core.repository;

import com.taskrelay.core.model.AgentRun;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for worker run records.
 * A run is active while completed_at is null and immutable once it is set.
 */
public interface AgentRunRepository {

    void save(AgentRun run);

    /**
     * Complete an active run.
     *
     * @return true if the run was active and is now completed; false if it had
     *         already been completed (the first completion wins)
     */
    boolean complete(UUID runId, Instant completedAt, int exitCode, String error);

    Optional<AgentRun> findById(UUID runId);

    /**
     * Find the active run of a task, if any.
     */
    Optional<AgentRun> findActiveByTask(UUID taskId);

    /**
     * Count active runs across the whole system.
     */
    int countActive();

    /**
     * Get all active runs, oldest first.
     */
    List<AgentRun> findActive();

    /**
     * Get active runs started before the given time.
     */
    List<AgentRun> findActiveStartedBefore(Instant cutoff);

    /**
     * Get every run of a task, oldest first.
     */
    List<AgentRun> findByTask(UUID taskId);

    /**
     * Take the system-wide admission lock for the rest of the current transaction.
     * Serializes the capacity count with the run insert.
     */
    void lockAdmission();
}
