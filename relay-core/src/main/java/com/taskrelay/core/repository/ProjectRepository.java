package com.taskrelay.core.repository;

import com.taskrelay.core.model.Project;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Project persistence.
 */
public interface ProjectRepository {

    void save(Project project);

    void update(Project project);

    Optional<Project> findById(UUID projectId);

    /**
     * Get all projects, oldest first.
     */
    List<Project> findAll();
}
