package com.taskrelay.core.model;

/**
 * Independent consumers of the event outbox.
 * Each owns its own consumption flag; they never share one, or one would starve the other.
 */
public enum ConsumerClass {
    /**
     * Push transport that forwards board changes to viewers.
     */
    BROADCAST("broadcast_consumed"),

    /**
     * Dispatch loop that turns transitions into worker launches.
     */
    DISPATCH("dispatch_consumed");

    private final String flagColumn;

    ConsumerClass(String flagColumn) {
        this.flagColumn = flagColumn;
    }

    /**
     * Name of the store column holding this consumer's flag.
     */
    public String flagColumn() {
        return flagColumn;
    }
}
