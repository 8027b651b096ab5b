package com.taskrelay.core.repository;

import com.taskrelay.core.model.WorkflowStep;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for the steps of a project's workflow.
 * Steps are written once with their project and never reordered.
 */
public interface WorkflowStepRepository {

    /**
     * Insert all steps of a project.
     */
    void saveAll(List<WorkflowStep> steps);

    /**
     * Get the steps of a project ordered by position.
     */
    List<WorkflowStep> findByProject(UUID projectId);

    Optional<WorkflowStep> findById(UUID stepId);
}
