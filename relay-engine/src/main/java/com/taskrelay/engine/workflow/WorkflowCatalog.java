package com.taskrelay.engine.workflow;

import com.taskrelay.core.exception.NotFoundException;
import com.taskrelay.core.model.Workflow;
import com.taskrelay.core.model.WorkflowStep;
import com.taskrelay.core.repository.WorkflowStepRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read access to project workflows.
 * Steps never change after project creation, so loaded workflows are cached for the
 * life of the process.
 */
@Component
public class WorkflowCatalog {

    private final WorkflowStepRepository stepRepository;
    private final Map<UUID, Workflow> cache = new ConcurrentHashMap<>();

    public WorkflowCatalog(WorkflowStepRepository stepRepository) {
        this.stepRepository = stepRepository;
    }

    /**
     * Get the workflow of a project.
     *
     * @throws NotFoundException if the project has no steps
     */
    public Workflow get(UUID projectId) {
        Workflow cached = cache.get(projectId);
        if (cached != null) {
            return cached;
        }
        List<WorkflowStep> steps = stepRepository.findByProject(projectId);
        if (steps.isEmpty()) {
            throw new NotFoundException("Workflow", projectId.toString());
        }
        Workflow workflow = new Workflow(projectId, steps);
        cache.putIfAbsent(projectId, workflow);
        return workflow;
    }

    /**
     * Get the step a task currently sits at.
     */
    public WorkflowStep step(UUID projectId, UUID stepId) {
        return get(projectId).findById(stepId)
            .orElseThrow(() -> new NotFoundException("WorkflowStep", stepId.toString()));
    }
}
