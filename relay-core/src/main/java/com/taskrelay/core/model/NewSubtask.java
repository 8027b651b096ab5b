package com.taskrelay.core.model;

import java.util.List;

/**
 * One entry of a batch subtask request.
 *
 * dependsOn holds indexes into the same batch: entry {@code i} listing {@code j}
 * means batch task {@code j} must finish before batch task {@code i} may dispatch.
 */
public record NewSubtask(
    String title,
    String description,
    TaskKind kind,
    String stepName,
    List<Integer> dependsOn
) {
    public NewSubtask {
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
    }

    public static NewSubtask of(String title, String description, Integer... dependsOn) {
        return new NewSubtask(title, description, TaskKind.UNIT, null, List.of(dependsOn));
    }
}
