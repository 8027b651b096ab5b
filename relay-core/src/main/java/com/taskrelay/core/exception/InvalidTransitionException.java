package com.taskrelay.core.exception;

import java.util.List;

/**
 * Thrown when a task move or flag change is not allowed from its current state.
 * Reports the current step and the steps the task could move to instead.
 */
public class InvalidTransitionException extends RelayException {
    
    public static final String ERROR_CODE = "INVALID_TRANSITION";

    private final String currentStep;
    private final List<String> validTargets;
    
    public InvalidTransitionException(String taskId, String currentStep, String targetStep, List<String> validTargets) {
        super(ERROR_CODE, String.format(
            "Cannot move task %s from '%s' to '%s'. Valid next steps: %s",
            taskId, currentStep, targetStep, validTargets
        ));
        this.currentStep = currentStep;
        this.validTargets = List.copyOf(validTargets);
    }
    
    public InvalidTransitionException(String taskId, String currentStep, String reason) {
        super(ERROR_CODE, String.format(
            "Task %s at '%s': %s",
            taskId, currentStep, reason
        ));
        this.currentStep = currentStep;
        this.validTargets = List.of();
    }

    public String getCurrentStep() {
        return currentStep;
    }

    public List<String> getValidTargets() {
        return validTargets;
    }
}
