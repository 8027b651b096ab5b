package com.taskrelay.engine.outbox;

import com.taskrelay.core.model.Event;

/**
 * Push transport that forwards board changes to connected viewers.
 *
 * A publish that throws leaves the event unconsumed for the broadcast consumer,
 * so it is offered again on the next relay cycle.
 */
@FunctionalInterface
public interface BoardBroadcaster {

    void publish(Event event);
}
