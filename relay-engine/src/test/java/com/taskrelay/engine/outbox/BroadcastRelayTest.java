package com.taskrelay.engine.outbox;

import com.taskrelay.core.model.ConsumerClass;
import com.taskrelay.core.model.Event;
import com.taskrelay.core.model.EventType;
import com.taskrelay.core.model.Project;
import com.taskrelay.engine.metrics.RelayMetrics;
import com.taskrelay.engine.test.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

class BroadcastRelayTest {

    private EngineFixture fixture;
    private List<Event> published;
    private Project project;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        published = new ArrayList<>();
        project = fixture.createStandardProject();
        fixture.createTask(project.projectId(), "T");
    }

    private BroadcastRelay relay(BoardBroadcaster broadcaster) {
        return new BroadcastRelay(fixture.outbox, broadcaster, fixture.metrics, Duration.ofMillis(100), 50);
    }

    @Test
    void relayOnce_shouldPublishInOrderAndConsumeBroadcastOnly() {
        int delivered = relay(published::add).relayOnce();

        assertEquals(2, delivered);
        assertThat(published).extracting(Event::type)
            .containsExactly(EventType.PROJECT_CREATED, EventType.TASK_CREATED);
        assertThat(fixture.unconsumed(ConsumerClass.BROADCAST)).isEmpty();
        assertThat(fixture.unconsumed(ConsumerClass.DISPATCH)).hasSize(2);
        assertEquals(2.0, fixture.meterRegistry.counter(RelayMetrics.EVENTS_BROADCAST).count());
    }

    @Test
    void relayOnce_shouldStopAtFailedPublishAndRetryLater() {
        BoardBroadcaster failingOnTask = event -> {
            if (event.type() == EventType.TASK_CREATED) {
                throw new IllegalStateException("viewer gone");
            }
            published.add(event);
        };

        assertEquals(1, relay(failingOnTask).relayOnce());
        assertThat(fixture.unconsumed(ConsumerClass.BROADCAST)).extracting(Event::type)
            .containsExactly(EventType.TASK_CREATED);

        assertEquals(1, relay(published::add).relayOnce());
        assertThat(published).extracting(Event::type)
            .containsExactly(EventType.PROJECT_CREATED, EventType.TASK_CREATED);
    }

    @Test
    void startAndStop_shouldToggleRunning() {
        BroadcastRelay relay = relay(new LoggingBoardBroadcaster());

        relay.start();
        assertTrue(relay.isRunning());
        relay.stop();
        assertFalse(relay.isRunning());
    }
}
