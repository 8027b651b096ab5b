package com.taskrelay.core.exception;

import java.util.UUID;

/**
 * Thrown when a task is made to depend on itself.
 */
public class SelfDependencyException extends RelayException {
    
    public static final String ERROR_CODE = "SELF_DEPENDENCY";
    
    public SelfDependencyException(UUID taskId) {
        super(ERROR_CODE, "Task cannot depend on itself: " + taskId);
    }
}
