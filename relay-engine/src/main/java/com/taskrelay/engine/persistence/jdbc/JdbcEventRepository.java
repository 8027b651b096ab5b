package com.taskrelay.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskrelay.core.model.ConsumerClass;
import com.taskrelay.core.model.Event;
import com.taskrelay.core.model.EventType;
import com.taskrelay.core.repository.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-backed event outbox.
 *
 * Events are ordered by the store-assigned sequence number. Each consumer class
 * owns one boolean column; marking consumed is a single-column update, so one
 * consumer's progress can never touch another's.
 */
@Repository
public class JdbcEventRepository implements EventRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final EventRowMapper rowMapper;

    public JdbcEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new EventRowMapper();
    }

    @Override
    public void append(Event event) {
        String sql = """
            INSERT INTO events (
                event_id, event_type, project_id, task_id, payload, created_at,
                broadcast_consumed, dispatch_consumed
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
            event.eventId(),
            event.type().name(),
            event.projectId(),
            event.taskId(),
            serializePayload(event.payload()),
            Timestamp.from(event.createdAt()),
            event.broadcastConsumed(),
            event.dispatchConsumed()
        );

        log.debug("Appended event {} ({}) for task {}", event.eventId(), event.type().wireName(), event.taskId());
    }

    @Override
    public Optional<Event> findById(UUID eventId) {
        String sql = "SELECT * FROM events WHERE event_id = ?";
        List<Event> results = jdbcTemplate.query(sql, rowMapper, eventId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Event> findUnconsumed(ConsumerClass consumer, long afterSequence, int limit) {
        String sql = """
            SELECT * FROM events
            WHERE %s = FALSE AND sequence_number > ?
            ORDER BY sequence_number ASC
            LIMIT ?
            """.formatted(consumer.flagColumn());
        return jdbcTemplate.query(sql, rowMapper, afterSequence, limit);
    }

    @Override
    public boolean markConsumed(UUID eventId, ConsumerClass consumer) {
        String sql = "UPDATE events SET %s = TRUE WHERE event_id = ? AND %s = FALSE"
            .formatted(consumer.flagColumn(), consumer.flagColumn());
        return jdbcTemplate.update(sql, eventId) > 0;
    }

    @Override
    public List<Event> findByTask(UUID taskId) {
        String sql = """
            SELECT * FROM events
            WHERE task_id = ?
            ORDER BY sequence_number ASC
            """;
        return jdbcTemplate.query(sql, rowMapper, taskId);
    }

    @Override
    public Map<ConsumerClass, Long> countUnconsumed() {
        Map<ConsumerClass, Long> result = new EnumMap<>(ConsumerClass.class);
        for (ConsumerClass consumer : ConsumerClass.values()) {
            Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM events WHERE %s = FALSE".formatted(consumer.flagColumn()),
                Long.class);
            result.put(consumer, count != null ? count : 0L);
        }
        return result;
    }

    private String serializePayload(JsonNode payload) {
        if (payload == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event payload", e);
        }
    }

    private class EventRowMapper implements RowMapper<Event> {
        @Override
        public Event mapRow(ResultSet rs, int rowNum) throws SQLException {
            String projectId = rs.getString("project_id");
            String taskId = rs.getString("task_id");
            return new Event(
                UUID.fromString(rs.getString("event_id")),
                rs.getLong("sequence_number"),
                EventType.valueOf(rs.getString("event_type")),
                projectId != null ? UUID.fromString(projectId) : null,
                taskId != null ? UUID.fromString(taskId) : null,
                deserializePayload(rs.getString("payload")),
                rs.getTimestamp("created_at").toInstant(),
                rs.getBoolean("broadcast_consumed"),
                rs.getBoolean("dispatch_consumed")
            );
        }

        private JsonNode deserializePayload(String json) {
            if (json == null || json.isBlank()) {
                return objectMapper.createObjectNode();
            }
            try {
                return objectMapper.readTree(json);
            } catch (JsonProcessingException e) {
                log.warn("Failed to deserialize event payload: {}", e.getMessage());
                return objectMapper.createObjectNode();
            }
        }
    }
}
