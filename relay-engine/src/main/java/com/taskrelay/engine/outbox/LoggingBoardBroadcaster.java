package com.taskrelay.engine.outbox;

import com.taskrelay.core.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Broadcaster used when no push transport is attached: writes each event to the log.
 */
public class LoggingBoardBroadcaster implements BoardBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(LoggingBoardBroadcaster.class);

    @Override
    public void publish(Event event) {
        log.debug("Broadcast #{} {} project={} task={}: {}",
            event.sequenceNumber(), event.type().wireName(), event.projectId(), event.taskId(), event.payload());
    }
}
