package com.taskrelay.engine.health;

import com.taskrelay.core.model.ConsumerClass;
import com.taskrelay.core.repository.AgentRunRepository;
import com.taskrelay.core.repository.EventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Health indicator for the relay.
 * Reports health status based on:
 * - Database connectivity
 * - Active worker runs
 * - Undelivered event backlog per consumer
 */
@Component
public class RelayHealthIndicator implements HealthIndicator {

    static final long BACKLOG_WARNING_THRESHOLD = 1000;

    private final JdbcTemplate jdbcTemplate;
    private final AgentRunRepository runRepository;
    private final EventRepository eventRepository;

    public RelayHealthIndicator(
            JdbcTemplate jdbcTemplate,
            AgentRunRepository runRepository,
            EventRepository eventRepository) {
        this.jdbcTemplate = jdbcTemplate;
        this.runRepository = runRepository;
        this.eventRepository = eventRepository;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        try {
            if (!checkDatabase(details)) {
                return Health.down()
                    .withDetails(details)
                    .build();
            }

            details.put("activeRuns", runRepository.countActive());
            checkBacklog(details);

            return Health.up()
                .withDetails(details)
                .build();

        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }

    private boolean checkDatabase(Map<String, Object> details) {
        try {
            Integer result = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            boolean connected = result != null && result == 1;
            details.put("database", connected ? "connected" : "unexpected response");
            return connected;
        } catch (Exception e) {
            details.put("database", "disconnected");
            details.put("databaseError", e.getMessage());
            return false;
        }
    }

    private void checkBacklog(Map<String, Object> details) {
        Map<ConsumerClass, Long> counts = eventRepository.countUnconsumed();
        Map<String, Long> backlog = new HashMap<>();
        counts.forEach((consumer, count) -> backlog.put(consumer.name().toLowerCase(Locale.ROOT), count));
        details.put("unconsumedEvents", backlog);

        long dispatchBacklog = counts.getOrDefault(ConsumerClass.DISPATCH, 0L);
        if (dispatchBacklog > BACKLOG_WARNING_THRESHOLD) {
            details.put("backlogWarning", "Dispatch backlog is high; the loop may be stopped or at capacity");
        }
    }
}
