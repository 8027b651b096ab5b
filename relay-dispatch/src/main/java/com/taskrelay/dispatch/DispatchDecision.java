package com.taskrelay.dispatch;

import java.util.Locale;

/**
 * What the dispatcher did with one event.
 */
public enum DispatchDecision {
    LAUNCHED(true),
    ALREADY_ACTIVE(true),
    DEFERRED_CAPACITY(false),
    BLOCKED(true),
    AWAITING_PLAN_APPROVAL(true),
    NOT_DISPATCHABLE(true),
    STALE(true),
    CANCELLED(true),
    CLEANUP(true),
    IGNORED(true);

    private final boolean consumesEvent;

    DispatchDecision(boolean consumesEvent) {
        this.consumesEvent = consumesEvent;
    }

    /**
     * Capacity deferral leaves the event in place so the next cycle retries it.
     */
    public boolean consumesEvent() {
        return consumesEvent;
    }

    public String metricName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
