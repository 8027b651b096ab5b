package com.taskrelay.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only note on a task. Never mutated or deleted.
 */
public record Comment(
    UUID commentId,
    UUID taskId,
    AuthorRole authorRole,
    String content,
    Instant createdAt
) {
    public static Comment create(UUID taskId, AuthorRole authorRole, String content) {
        return new Comment(UUID.randomUUID(), taskId, authorRole, content, Instant.now());
    }
}
