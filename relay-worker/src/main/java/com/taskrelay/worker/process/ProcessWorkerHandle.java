package com.taskrelay.worker.process;

import com.taskrelay.worker.WorkerExit;
import com.taskrelay.worker.WorkerHandle;

import java.util.concurrent.CompletableFuture;

/**
 * {@link WorkerHandle} over an OS process. Signals reach the process and its descendants.
 */
class ProcessWorkerHandle implements WorkerHandle {

    private final Process process;
    private final CompletableFuture<String> sessionId = new CompletableFuture<>();
    private final CompletableFuture<WorkerExit> exit = new CompletableFuture<>();

    ProcessWorkerHandle(Process process) {
        this.process = process;
    }

    @Override
    public CompletableFuture<String> sessionId() {
        return sessionId;
    }

    @Override
    public CompletableFuture<WorkerExit> exit() {
        return exit;
    }

    @Override
    public void terminate() {
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
    }

    @Override
    public void kill() {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    long pid() {
        return process.pid();
    }

    void reportSession(String id) {
        sessionId.complete(id);
    }

    void finish(WorkerExit result) {
        // A worker that never reported a session still unblocks anyone waiting on it.
        sessionId.complete(null);
        exit.complete(result);
    }

    void fail(Throwable failure) {
        sessionId.complete(null);
        exit.completeExceptionally(failure);
    }
}
