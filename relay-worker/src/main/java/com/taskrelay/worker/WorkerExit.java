package com.taskrelay.worker;

/**
 * How a worker process ended.
 *
 * @param error stderr text or a description of the failure, null on success
 * @param sessionId session the worker reported, null if it never reported one
 */
public record WorkerExit(int exitCode, String error, String sessionId) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
