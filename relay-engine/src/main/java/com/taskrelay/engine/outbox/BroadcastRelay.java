package com.taskrelay.engine.outbox;

import com.taskrelay.core.model.ConsumerClass;
import com.taskrelay.core.model.Event;
import com.taskrelay.engine.logging.LoggingContext;
import com.taskrelay.engine.metrics.RelayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls the outbox for the broadcast consumer and hands each event to the
 * {@link BoardBroadcaster}, oldest first.
 *
 * Consumes only the broadcast flag; dispatch progress is never touched. When a publish
 * fails the rest of the batch is left for the next cycle so viewers see events in order.
 */
public class BroadcastRelay {

    private static final Logger log = LoggerFactory.getLogger(BroadcastRelay.class);

    private final EventOutbox outbox;
    private final BoardBroadcaster broadcaster;
    private final RelayMetrics metrics;
    private final Duration interval;
    private final int batchSize;

    private ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public BroadcastRelay(
            EventOutbox outbox,
            BoardBroadcaster broadcaster,
            RelayMetrics metrics,
            Duration interval,
            int batchSize) {
        this.outbox = outbox;
        this.broadcaster = broadcaster;
        this.metrics = metrics;
        this.interval = interval;
        this.batchSize = batchSize;
    }

    /**
     * Start the relay loop.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Broadcast relay already running");
            return;
        }
        running = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "broadcast-relay");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::safeRelay,
            interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Broadcast relay started (interval: {}ms)", interval.toMillis());
    }

    /**
     * Stop the relay loop.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Broadcast relay stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Deliver one batch of pending events.
     *
     * @return the number of events delivered and consumed
     */
    public int relayOnce() {
        List<Event> events = outbox.pollUnconsumed(ConsumerClass.BROADCAST, batchSize);
        int delivered = 0;
        for (Event event : events) {
            try (LoggingContext ctx = LoggingContext.forEvent(
                    event.eventId(), event.type().wireName(), event.projectId(), event.taskId())) {
                try {
                    broadcaster.publish(event);
                } catch (Exception e) {
                    log.warn("Broadcast of event {} failed, will retry next cycle", event.eventId(), e);
                    break;
                }
                outbox.markConsumed(event.eventId(), ConsumerClass.BROADCAST);
                delivered++;
            }
        }
        if (delivered > 0) {
            metrics.eventsBroadcast(delivered);
        }
        return delivered;
    }

    private void safeRelay() {
        if (!running) return;

        try {
            relayOnce();
        } catch (Exception e) {
            log.error("Error in broadcast relay", e);
        }
    }
}
