package com.taskrelay.core.model;

import java.util.Locale;

/**
 * Roles a worker can be launched in.
 * Closed set, validated at the store boundary so a typo'd role cannot silently never dispatch.
 */
public enum WorkerRole {
    PLANNER,
    CODER,
    REVIEWER,
    ORCHESTRATOR;

    /**
     * Lower-case name used in payloads, prompts and configuration.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a wire name.
     *
     * @throws IllegalArgumentException if the value is not a known role
     */
    public static WorkerRole fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Worker role must not be null");
        }
        return WorkerRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
