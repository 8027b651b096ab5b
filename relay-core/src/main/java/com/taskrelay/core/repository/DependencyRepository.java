package com.taskrelay.core.repository;

import com.taskrelay.core.model.Dependency;
import java.util.List;
import java.util.UUID;

/**
 * Repository for directed task dependencies.
 * Only edges are stored; blocked state is always derived.
 */
public interface DependencyRepository {

    void save(Dependency dependency);

    /**
     * Remove an edge.
     *
     * @return true if an edge was removed
     */
    boolean delete(UUID predecessorId, UUID successorId);

    boolean exists(UUID predecessorId, UUID successorId);

    /**
     * Get the tasks the given task depends on.
     */
    List<UUID> findPredecessorIds(UUID taskId);

    /**
     * Get the tasks that depend on the given task.
     */
    List<UUID> findSuccessorIds(UUID taskId);

    /**
     * Get all edges whose successor belongs to the project.
     */
    List<Dependency> findByProject(UUID projectId);
}
