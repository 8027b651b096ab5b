package com.taskrelay.server.config;

import com.taskrelay.dispatch.DispatchLoop;
import com.taskrelay.engine.lifecycle.GracefulShutdownHandler;
import com.taskrelay.engine.outbox.BroadcastRelay;
import com.taskrelay.recovery.RecoveryEngine;
import com.taskrelay.worker.WorkerProcessRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the background loops once the application is ready and registers their
 * shutdown in order: stop admitting, stop workers, then stop the relays.
 */
@Component
public class RelayLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RelayLifecycle.class);

    private final RecoveryEngine recoveryEngine;
    private final DispatchLoop dispatchLoop;
    private final BroadcastRelay broadcastRelay;
    private final WorkerProcessRegistry registry;
    private final GracefulShutdownHandler shutdownHandler;
    private final RelayProperties properties;

    public RelayLifecycle(
            RecoveryEngine recoveryEngine,
            DispatchLoop dispatchLoop,
            BroadcastRelay broadcastRelay,
            WorkerProcessRegistry registry,
            GracefulShutdownHandler shutdownHandler,
            RelayProperties properties) {
        this.recoveryEngine = recoveryEngine;
        this.dispatchLoop = dispatchLoop;
        this.broadcastRelay = broadcastRelay;
        this.registry = registry;
        this.shutdownHandler = shutdownHandler;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        shutdownHandler.setTimeout(properties.getShutdownTimeout());
        shutdownHandler.registerHook("dispatch-loop", dispatchLoop::stop);
        shutdownHandler.registerHook("workers", registry::terminateAll);
        shutdownHandler.registerHook("recovery", recoveryEngine::stop);
        shutdownHandler.registerHook("broadcast-relay", broadcastRelay::stop);

        // Recovery first: orphaned runs must not count against capacity.
        recoveryEngine.start();

        if (properties.getBroadcast().isEnabled()) {
            broadcastRelay.start();
        } else {
            log.info("Broadcast relay disabled");
        }
        if (properties.getDispatch().isEnabled()) {
            dispatchLoop.start();
        } else {
            log.info("Dispatch loop disabled");
        }
    }
}
