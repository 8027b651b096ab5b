package com.taskrelay.core.exception;

import java.util.UUID;

/**
 * Thrown when the same dependency edge is added twice.
 */
public class DuplicateDependencyException extends RelayException {
    
    public static final String ERROR_CODE = "DUPLICATE_DEPENDENCY";
    
    public DuplicateDependencyException(UUID predecessorId, UUID successorId) {
        super(ERROR_CODE, String.format(
            "Dependency already exists: %s -> %s",
            predecessorId, successorId
        ));
    }
}
