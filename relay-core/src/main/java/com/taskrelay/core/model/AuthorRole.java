package com.taskrelay.core.model;

import java.util.Locale;

/**
 * Who wrote a comment: one tag per worker role plus a human.
 */
public enum AuthorRole {
    PLANNER,
    CODER,
    REVIEWER,
    ORCHESTRATOR,
    HUMAN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AuthorRole fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Author role must not be null");
        }
        return AuthorRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Author tag for comments written by a worker in the given role.
     */
    public static AuthorRole of(WorkerRole role) {
        return switch (role) {
            case PLANNER -> PLANNER;
            case CODER -> CODER;
            case REVIEWER -> REVIEWER;
            case ORCHESTRATOR -> ORCHESTRATOR;
        };
    }
}
