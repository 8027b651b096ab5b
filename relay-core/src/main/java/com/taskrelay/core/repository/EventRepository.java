package com.taskrelay.core.repository;

import com.taskrelay.core.model.ConsumerClass;
import com.taskrelay.core.model.Event;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for the event outbox.
 * Events are append-only; each consumer class tracks consumption with its own flag.
 */
public interface EventRepository {

    /**
     * Append an event. Must run inside the transaction of the mutation it describes.
     */
    void append(Event event);

    Optional<Event> findById(UUID eventId);

    /**
     * Get events the consumer has not processed, in sequence order.
     *
     * @param consumer The consumer class
     * @param afterSequence Only events with a higher sequence number; 0 for all
     * @param limit Maximum number of events
     */
    List<Event> findUnconsumed(ConsumerClass consumer, long afterSequence, int limit);

    /**
     * Set the consumer's flag. Safe to call more than once.
     *
     * @return true if the flag changed
     */
    boolean markConsumed(UUID eventId, ConsumerClass consumer);

    /**
     * Get all events about a task in sequence order.
     */
    List<Event> findByTask(UUID taskId);

    /**
     * Count unprocessed events per consumer class.
     */
    Map<ConsumerClass, Long> countUnconsumed();
}
