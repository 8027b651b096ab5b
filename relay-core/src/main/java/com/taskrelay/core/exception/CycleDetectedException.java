package com.taskrelay.core.exception;

import java.util.UUID;

/**
 * Thrown when a dependency edge would close a cycle in the task graph.
 */
public class CycleDetectedException extends RelayException {
    
    public static final String ERROR_CODE = "CYCLE_DETECTED";
    
    public CycleDetectedException(UUID predecessorId, UUID successorId) {
        super(ERROR_CODE, String.format(
            "Dependency %s -> %s would create a cycle: %s already depends on %s",
            predecessorId, successorId, predecessorId, successorId
        ));
    }
}
