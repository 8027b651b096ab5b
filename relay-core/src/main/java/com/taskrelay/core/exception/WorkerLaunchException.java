package com.taskrelay.core.exception;

import java.util.UUID;

/**
 * Thrown when a worker process cannot be started: executable missing, spawn error,
 * workspace unavailable. The run is recorded as failed and the task stays where it is.
 */
public class WorkerLaunchException extends RelayException {
    
    public static final String ERROR_CODE = "WORKER_LAUNCH_FAILURE";
    
    public WorkerLaunchException(UUID taskId, String reason) {
        super(ERROR_CODE, String.format(
            "Failed to launch worker for task %s: %s",
            taskId, reason
        ));
    }
    
    public WorkerLaunchException(UUID taskId, String reason, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Failed to launch worker for task %s: %s",
            taskId, reason
        ), cause);
    }
}
