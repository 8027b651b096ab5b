package com.taskrelay.engine.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskrelay.core.model.ConsumerClass;
import com.taskrelay.core.model.Event;
import com.taskrelay.core.model.EventType;
import com.taskrelay.core.repository.EventRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.UUID;

/**
 * Write and read side of the event outbox.
 *
 * Writes must happen inside the transaction of the mutation they describe: a
 * mutation without its event is never committed. Each consumer class reads and
 * marks its own flag only.
 */
@Component
public class EventOutbox {

    private final EventRepository eventRepository;

    public EventOutbox(EventRepository eventRepository) {
        this.eventRepository = eventRepository;
    }

    /**
     * Record an event in the current transaction.
     *
     * @throws IllegalStateException if no transaction is active
     */
    public Event record(EventType type, UUID projectId, UUID taskId, JsonNode payload) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException(
                "Event " + type.wireName() + " must be recorded inside the mutation's transaction");
        }
        Event event = Event.create(type, projectId, taskId, payload);
        eventRepository.append(event);
        return event;
    }

    /**
     * Get events the consumer has not yet processed, oldest first.
     */
    public List<Event> pollUnconsumed(ConsumerClass consumer, int limit) {
        return pollUnconsumed(consumer, 0L, limit);
    }

    /**
     * Get unprocessed events that come after a sequence number, oldest first.
     * Lets a consumer page past events it chose to leave unconsumed.
     */
    public List<Event> pollUnconsumed(ConsumerClass consumer, long afterSequence, int limit) {
        return eventRepository.findUnconsumed(consumer, afterSequence, limit);
    }

    /**
     * Mark an event processed for one consumer. Idempotent.
     */
    public boolean markConsumed(UUID eventId, ConsumerClass consumer) {
        return eventRepository.markConsumed(eventId, consumer);
    }

    /**
     * Get the event history of a task.
     */
    public List<Event> history(UUID taskId) {
        return eventRepository.findByTask(taskId);
    }
}
