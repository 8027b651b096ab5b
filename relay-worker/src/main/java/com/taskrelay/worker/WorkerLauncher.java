package com.taskrelay.worker;

import com.taskrelay.core.exception.WorkerLaunchException;

/**
 * Starts worker runs.
 * The engine only ever talks to workers through this boundary.
 */
@FunctionalInterface
public interface WorkerLauncher {

    /**
     * Start a worker and return without waiting for it.
     *
     * @throws WorkerLaunchException if the worker could not be started at all
     */
    WorkerHandle launch(WorkerInvocation invocation);
}
