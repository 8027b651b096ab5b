package com.taskrelay.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable record of a board mutation, written in the same transaction as the mutation.
 *
 * Primary Key: sequenceNumber (assigned by the store, FIFO order)
 * Unique: eventId
 *
 * Invariants:
 * - payload is fully resolved (whole entities, not only ids)
 * - one consumption flag per consumer class; marking one never touches another
 * - rows are never deleted; only the consumption flags change
 */
public record Event(
    // Identity and ordering
    UUID eventId,
    long sequenceNumber,

    // Event data
    EventType type,
    UUID projectId,
    UUID taskId,
    JsonNode payload,
    Instant createdAt,

    // Consumption flags
    boolean broadcastConsumed,
    boolean dispatchConsumed
) {
    /**
     * Create a new unconsumed event. The sequence number is assigned on append.
     */
    public static Event create(EventType type, UUID projectId, UUID taskId, JsonNode payload) {
        return new Event(
            UUID.randomUUID(),
            0L,
            type,
            projectId,
            taskId,
            payload,
            Instant.now(),
            false,
            false
        );
    }

    /**
     * Check if the given consumer has already processed this event.
     */
    public boolean isConsumedBy(ConsumerClass consumer) {
        return switch (consumer) {
            case BROADCAST -> broadcastConsumed;
            case DISPATCH -> dispatchConsumed;
        };
    }

    /**
     * Get the step the event says the task entered, if the payload names one.
     */
    public Optional<UUID> enteredStepId() {
        if (payload == null) {
            return Optional.empty();
        }
        JsonNode step = payload.path("task").path("stepId");
        if (step.isMissingNode() || step.isNull()) {
            return Optional.empty();
        }
        return Optional.of(UUID.fromString(step.asText()));
    }

    public boolean isTaskEvent() {
        return type.name().startsWith("TASK_");
    }
}
