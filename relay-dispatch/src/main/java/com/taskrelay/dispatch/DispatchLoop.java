package com.taskrelay.dispatch;

import com.taskrelay.core.model.ConsumerClass;
import com.taskrelay.core.model.Event;
import com.taskrelay.engine.lifecycle.GracefulShutdownHandler;
import com.taskrelay.engine.logging.LoggingContext;
import com.taskrelay.engine.metrics.RelayMetrics;
import com.taskrelay.engine.outbox.EventOutbox;
import com.taskrelay.engine.run.RunRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls the outbox for undispatched events and turns them into worker runs.
 *
 * Each cycle reads pages in sequence order. Every event is admitted in its own
 * transaction; a failure is logged and the cycle moves on, leaving that event
 * unconsumed for the next cycle.
 */
public class DispatchLoop {

    private static final Logger log = LoggerFactory.getLogger(DispatchLoop.class);

    private final EventOutbox outbox;
    private final DispatchAdmission admission;
    private final WorkerSupervisor supervisor;
    private final RunRecorder runRecorder;
    private final GracefulShutdownHandler shutdownHandler;
    private final RelayMetrics metrics;
    private final Duration interval;
    private final int batchSize;

    private ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public DispatchLoop(
            EventOutbox outbox,
            DispatchAdmission admission,
            WorkerSupervisor supervisor,
            RunRecorder runRecorder,
            GracefulShutdownHandler shutdownHandler,
            RelayMetrics metrics,
            Duration interval,
            int batchSize) {
        this.outbox = outbox;
        this.admission = admission;
        this.supervisor = supervisor;
        this.runRecorder = runRecorder;
        this.shutdownHandler = shutdownHandler;
        this.metrics = metrics;
        this.interval = interval;
        this.batchSize = batchSize;
    }

    /**
     * Start the dispatch loop.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Dispatch loop already running");
            return;
        }
        running = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "dispatch-loop");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::cycle, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Dispatch loop started (interval {}ms, batch {}, max {} parallel agents)",
            interval.toMillis(), batchSize, admission.maxParallelAgents());
    }

    /**
     * Stop the dispatch loop. Running workers are not touched.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Dispatch loop stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void cycle() {
        if (!running) return;

        try {
            runCycle();
        } catch (Exception e) {
            log.error("Error in dispatch cycle", e);
        }
    }

    /**
     * Process every pending dispatch event, one page at a time.
     *
     * Events deferred for capacity stay unconsumed at the head of the outbox, so each
     * page starts after the last sequence number seen rather than at the oldest
     * unconsumed event. The cycle ends on a short page.
     *
     * @return the number of events handled, whether or not they launched
     */
    public int runCycle() {
        if (!shutdownHandler.canAcceptWork()) {
            return 0;
        }

        int handled = 0;
        long lastSequence = 0L;
        List<Event> page;
        do {
            page = outbox.pollUnconsumed(ConsumerClass.DISPATCH, lastSequence, batchSize);
            for (Event event : page) {
                if (!shutdownHandler.canAcceptWork()) {
                    return handled;
                }
                lastSequence = event.sequenceNumber();
                try (LoggingContext ctx = LoggingContext.forEvent(
                        event.eventId(), event.type().wireName(), event.projectId(), event.taskId())) {
                    handle(event);
                    handled++;
                } catch (Exception e) {
                    log.error("Failed to dispatch event {} ({})", event.eventId(), event.type().wireName(), e);
                }
            }
        } while (page.size() == batchSize);

        metrics.recordActiveRuns(runRecorder.countActive(), admission.maxParallelAgents());
        return handled;
    }

    private void handle(Event event) {
        Admission result = admission.admit(event);
        metrics.dispatchDecision(result.decision().metricName());

        if (result.isLaunch()) {
            log.info("Dispatching task {} (run {})", result.task().taskId(), result.run().runId());
            supervisor.supervise(result.task(), result.run());
        } else if (result.teardownNow()) {
            supervisor.releaseWorkspace(result.task());
        } else {
            log.debug("Event {} not dispatched: {}", event.eventId(), result.decision());
        }
    }
}
