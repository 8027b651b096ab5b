package com.taskrelay.engine.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Manages graceful shutdown for the relay.
 *
 * On shutdown:
 * 1. Stops accepting new dispatches
 * 2. Runs registered hooks in registration order (stop loops, terminate workers)
 * 3. Waits for supervised runs to record their completion (with timeout)
 *
 * Runs still open after the timeout are closed by orphan recovery on the next start.
 */
@Component
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final Set<UUID> activeRuns = ConcurrentHashMap.newKeySet();
    private final List<NamedHook> hooks = new CopyOnWriteArrayList<>();
    private volatile Duration timeout = DEFAULT_TIMEOUT;

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * Register an action to run when the application context closes.
     */
    public void registerHook(String name, Runnable hook) {
        hooks.add(new NamedHook(name, hook));
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Check if new worker runs may be admitted.
     */
    public boolean canAcceptWork() {
        return !shuttingDown.get();
    }

    /**
     * Register a run as supervised by this process.
     */
    public void registerActiveRun(UUID runId) {
        activeRuns.add(runId);
        log.debug("Registered active run: {}", runId);
    }

    /**
     * Unregister a run once its completion has been recorded.
     */
    public void unregisterActiveRun(UUID runId) {
        activeRuns.remove(runId);
        log.debug("Unregistered active run: {}", runId);
    }

    public int getActiveRunCount() {
        return activeRuns.size();
    }

    /**
     * Handle application shutdown event.
     * This runs before the Spring context is fully closed.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        shutdown();
    }

    /**
     * Run the shutdown sequence once; later calls are ignored.
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Initiating graceful shutdown ({} hooks, {} active runs)", hooks.size(), activeRuns.size());

        runHooks();
        waitForActiveRuns();

        log.info("Graceful shutdown complete");
    }

    private void runHooks() {
        for (NamedHook hook : hooks) {
            try {
                log.debug("Running shutdown hook: {}", hook.name());
                hook.action().run();
            } catch (Exception e) {
                log.error("Shutdown hook {} failed", hook.name(), e);
            }
        }
    }

    private void waitForActiveRuns() {
        if (activeRuns.isEmpty()) {
            log.info("No active runs to wait for");
            return;
        }

        log.info("Waiting for {} active runs to finish (timeout: {}s)", activeRuns.size(), timeout.toSeconds());

        long deadline = System.currentTimeMillis() + timeout.toMillis();
        while (!activeRuns.isEmpty() && System.currentTimeMillis() < deadline) {
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for runs to finish");
                break;
            }
        }

        if (!activeRuns.isEmpty()) {
            log.warn("Shutdown timeout reached with {} runs still active: {}", activeRuns.size(), activeRuns);
        } else {
            log.info("All active runs finished");
        }
    }

    private record NamedHook(String name, Runnable action) {
    }
}
