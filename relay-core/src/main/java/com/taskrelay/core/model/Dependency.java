package com.taskrelay.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Directed edge: the successor may not dispatch until the predecessor is done.
 *
 * Primary Key: (predecessorId, successorId)
 *
 * Invariants:
 * - predecessorId != successorId
 * - the edge set stays acyclic (checked before insert)
 * - blocked state is derived from edges on every read and never stored
 */
public record Dependency(
    UUID predecessorId,
    UUID successorId,
    Instant createdAt
) {
    public static Dependency create(UUID predecessorId, UUID successorId) {
        return new Dependency(predecessorId, successorId, Instant.now());
    }
}
