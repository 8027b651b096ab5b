package com.taskrelay.core.exception;

/**
 * Thrown when a git worktree operation fails.
 */
public class WorkspaceException extends RelayException {
    
    public static final String ERROR_CODE = "WORKSPACE_FAILURE";
    
    public WorkspaceException(String message) {
        super(ERROR_CODE, message);
    }
    
    public WorkspaceException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
