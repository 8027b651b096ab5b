package com.taskrelay.core.exception;

/**
 * Thrown when a project, step, task or run is not found.
 */
public class NotFoundException extends RelayException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
