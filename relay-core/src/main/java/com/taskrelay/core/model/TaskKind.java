package com.taskrelay.core.model;

import java.util.Locale;

/**
 * Kinds of task on the board.
 */
public enum TaskKind {
    /**
     * Ordinary unit of work.
     */
    UNIT,

    /**
     * Investigation whose result lands in the task's output field.
     */
    RESEARCH,

    /**
     * Parent of a group of tasks. Its children may only dispatch once the plan is approved.
     */
    MILESTONE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Check if this kind gates its children behind plan approval.
     */
    public boolean gatesChildren() {
        return this == MILESTONE;
    }
}
