package com.taskrelay.core.repository;

import com.taskrelay.core.model.Task;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Task persistence.
 * Tasks are never deleted; cancellation is a flag.
 */
public interface TaskRepository {

    /**
     * Insert a new task.
     * The store rejects a second synchronization task for the same parent.
     */
    void save(Task task);

    /**
     * Write every mutable column of an existing task.
     */
    void update(Task task);

    Optional<Task> findById(UUID taskId);

    /**
     * Find a task and hold a row lock on it until the surrounding transaction ends.
     * Used to serialize fan-in decisions per parent.
     */
    Optional<Task> findByIdForUpdate(UUID taskId);

    /**
     * Get all tasks of a project, oldest first.
     */
    List<Task> findByProject(UUID projectId);

    /**
     * Get the direct children of a task, oldest first.
     */
    List<Task> findChildren(UUID parentTaskId);

    /**
     * Find the synchronization task created for a parent, if any.
     */
    Optional<Task> findSynchronizationTask(UUID parentTaskId);

    /**
     * Get all tasks with a recorded workspace.
     */
    List<Task> findWithWorkspace();
}
