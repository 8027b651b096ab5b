package com.taskrelay.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A board: owns an ordered workflow and the tasks moving through it.
 *
 * Primary Key: projectId
 */
public record Project(
    UUID projectId,
    String title,
    String description,
    ProjectStatus status,
    Instant createdAt,
    Instant updatedAt
) {
    public static Project create(String title, String description) {
        Instant now = Instant.now();
        return new Project(
            UUID.randomUUID(),
            title,
            description,
            ProjectStatus.ACTIVE,
            now,
            now
        );
    }

    public Project withStatus(ProjectStatus newStatus) {
        return new Project(projectId, title, description, newStatus, createdAt, Instant.now());
    }

    public boolean isActive() {
        return status == ProjectStatus.ACTIVE;
    }
}
