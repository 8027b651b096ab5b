package com.taskrelay.worker;

import com.taskrelay.core.model.WorkerRole;
import com.taskrelay.core.model.WorkflowStep;

import java.util.EnumMap;
import java.util.Map;

/**
 * Picks the model for a run: the step's own model, else the model configured for the
 * step's role, else the default.
 */
public class WorkerModels {

    private final String defaultModel;
    private final Map<WorkerRole, String> roleModels;

    public WorkerModels(String defaultModel, Map<WorkerRole, String> roleModels) {
        this.defaultModel = defaultModel;
        this.roleModels = roleModels.isEmpty() ? new EnumMap<>(WorkerRole.class) : new EnumMap<>(roleModels);
    }

    public String resolve(WorkflowStep step) {
        String roleModel = step.role() != null ? roleModels.get(step.role()) : null;
        return step.effectiveModel(roleModel != null && !roleModel.isBlank() ? roleModel : defaultModel);
    }

    public String defaultModel() {
        return defaultModel;
    }
}
