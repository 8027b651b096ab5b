package com.taskrelay.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tracks live workers by run id so they can be stopped individually (watchdog) or all
 * together (shutdown).
 */
public class WorkerProcessRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkerProcessRegistry.class);

    public static final Duration DEFAULT_GRACE = Duration.ofSeconds(5);

    private final Map<UUID, WorkerHandle> handles = new ConcurrentHashMap<>();

    public void register(UUID runId, WorkerHandle handle) {
        handles.put(runId, handle);
    }

    public void unregister(UUID runId) {
        handles.remove(runId);
    }

    public boolean isLive(UUID runId) {
        return handles.containsKey(runId);
    }

    public int size() {
        return handles.size();
    }

    /**
     * Ask one worker to stop.
     *
     * @return false if no live worker is registered for the run
     */
    public boolean terminate(UUID runId) {
        WorkerHandle handle = handles.get(runId);
        if (handle == null) {
            return false;
        }
        log.info("Terminating worker for run {}", runId);
        handle.terminate();
        return true;
    }

    public int terminateAll() {
        return terminateAll(DEFAULT_GRACE);
    }

    /**
     * Terminate every live worker, then kill those still running once the grace period ends.
     *
     * @return the number of workers that were signalled
     */
    public int terminateAll(Duration grace) {
        List<Map.Entry<UUID, WorkerHandle>> live = new ArrayList<>(handles.entrySet());
        if (live.isEmpty()) {
            return 0;
        }
        log.info("Terminating {} live workers", live.size());
        live.forEach(entry -> entry.getValue().terminate());

        long deadline = System.nanoTime() + grace.toNanos();
        for (Map.Entry<UUID, WorkerHandle> entry : live) {
            long remaining = deadline - System.nanoTime();
            try {
                entry.getValue().exit().get(Math.max(remaining, 0), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                log.warn("Worker for run {} did not stop within {}s, killing it", entry.getKey(), grace.toSeconds());
                entry.getValue().kill();
            } catch (ExecutionException e) {
                log.debug("Worker for run {} ended with an error", entry.getKey(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for workers, killing the rest");
                live.forEach(remainingEntry -> remainingEntry.getValue().kill());
                break;
            }
        }
        return live.size();
    }
}
