package com.taskrelay.worker.process;

import com.taskrelay.core.exception.WorkerLaunchException;
import com.taskrelay.worker.WorkerExit;
import com.taskrelay.worker.WorkerHandle;
import com.taskrelay.worker.WorkerInvocation;
import com.taskrelay.worker.WorkerLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Launches workers as child processes.
 *
 * Stdout is read line by line as NDJSON so the session id is known while the worker is
 * still running. Stderr is collected separately and becomes the error of a failed run.
 */
public class ProcessWorkerLauncher implements WorkerLauncher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerLauncher.class);

    private static final int MAX_ERROR_LENGTH = 4000;

    private final WorkerCommand command;
    private final StreamMessages messages;
    private final ExecutorService streamReaders;

    public ProcessWorkerLauncher(WorkerCommand command, StreamMessages messages) {
        this.command = command;
        this.messages = messages;
        this.streamReaders = Executors.newCachedThreadPool(daemonThreads());
    }

    @Override
    public WorkerHandle launch(WorkerInvocation invocation) {
        if (invocation.workspacePath() == null || !Files.isDirectory(invocation.workspacePath())) {
            throw new WorkerLaunchException(invocation.taskId(),
                "workspace " + invocation.workspacePath() + " does not exist");
        }

        List<String> arguments = command.arguments(invocation);
        ProcessBuilder builder = new ProcessBuilder(arguments)
            .directory(invocation.workspacePath().toFile())
            .redirectInput(ProcessBuilder.Redirect.PIPE);
        WorkerCommand.stripInheritedSession(builder.environment());

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new WorkerLaunchException(invocation.taskId(),
                "cannot start '" + command.executable() + "': " + e.getMessage(), e);
        }
        closeQuietly(process);

        ProcessWorkerHandle handle = new ProcessWorkerHandle(process);
        log.info("Launched worker pid {} for task {} run {} (model {}, {})",
            handle.pid(), invocation.taskId(), invocation.runId(), invocation.model(),
            invocation.isResume() ? "resuming " + invocation.sessionId() : "new session");

        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(
            () -> readAll(process.getErrorStream()), streamReaders);
        CompletableFuture<String> session = CompletableFuture.supplyAsync(
            () -> pumpOutput(process.getInputStream(), handle, invocation), streamReaders);

        session.thenCombine(stderr, StreamsDrained::new)
            .thenCompose(streams -> process.onExit().thenApply(p ->
                toExit(p.exitValue(), streams.stderr(), streams.sessionId(), invocation)))
            .whenComplete((exit, failure) -> {
                if (failure != null) {
                    log.error("Lost track of worker for run {}", invocation.runId(), failure);
                    handle.fail(failure);
                } else {
                    handle.finish(exit);
                }
            });

        return handle;
    }

    /**
     * Read stdout to the end, completing the session future on the init message.
     *
     * @return the reported session id, or the resumed one if the worker never reported
     */
    private String pumpOutput(InputStream stdout, ProcessWorkerHandle handle, WorkerInvocation invocation) {
        String sessionId = null;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stdout, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (sessionId == null) {
                    sessionId = messages.sessionId(line).orElse(null);
                    if (sessionId != null) {
                        log.debug("Worker for run {} reported session {}", invocation.runId(), sessionId);
                        handle.reportSession(sessionId);
                    }
                } else if (log.isTraceEnabled()) {
                    log.trace("[run {}] {}", invocation.runId(), line);
                }
            }
        } catch (IOException e) {
            log.warn("Stopped reading output of run {}: {}", invocation.runId(), e.getMessage());
        }
        return sessionId != null ? sessionId : invocation.sessionId();
    }

    private static WorkerExit toExit(int exitCode, String stderr, String sessionId, WorkerInvocation invocation) {
        if (exitCode == 0) {
            log.info("Worker for run {} exited cleanly", invocation.runId());
            return new WorkerExit(0, null, sessionId);
        }
        String error = stderr != null && !stderr.isBlank()
            ? truncate(stderr.trim())
            : "worker exited with code " + exitCode;
        log.warn("Worker for run {} exited with code {}", invocation.runId(), exitCode);
        return new WorkerExit(exitCode, error, sessionId);
    }

    private static String readAll(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "failed to read stderr: " + e.getMessage();
        }
    }

    /**
     * The prompt travels as an argument; closing stdin tells the worker there is nothing more.
     */
    private static void closeQuietly(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close worker stdin", e);
        }
    }

    private static String truncate(String text) {
        return text.length() <= MAX_ERROR_LENGTH ? text : text.substring(text.length() - MAX_ERROR_LENGTH);
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "worker-stream-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record StreamsDrained(String sessionId, String stderr) {
    }

    @Override
    public void close() {
        streamReaders.shutdown();
        try {
            if (!streamReaders.awaitTermination(5, TimeUnit.SECONDS)) {
                streamReaders.shutdownNow();
            }
        } catch (InterruptedException e) {
            streamReaders.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
