package com.taskrelay.worker;

import java.util.concurrent.CompletableFuture;

/**
 * A running worker.
 *
 * The session future completes as soon as the worker reports its session id, which
 * is always before the exit future completes. If the worker exits without reporting
 * one, the session future completes with null.
 */
public interface WorkerHandle {

    CompletableFuture<String> sessionId();

    CompletableFuture<WorkerExit> exit();

    /**
     * Ask the worker to stop. Returns immediately.
     */
    void terminate();

    /**
     * Stop the worker without giving it a chance to clean up.
     */
    void kill();
}
