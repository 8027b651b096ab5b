package com.taskrelay.worker.process;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Reads the worker's newline-delimited JSON output.
 *
 * Only the init message matters to the engine; everything else is passed through to
 * the debug log. Lines that are not JSON objects are skipped.
 */
public class StreamMessages {

    private static final Logger log = LoggerFactory.getLogger(StreamMessages.class);

    private final ObjectMapper objectMapper;

    public StreamMessages(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<JsonNode> parse(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(line);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.trace("Skipping non-JSON worker output: {}", line);
            return Optional.empty();
        }
    }

    /**
     * Extract the session id from a {@code {"type":"system","subtype":"init"}} message.
     */
    public Optional<String> sessionId(JsonNode message) {
        if (!"system".equals(message.path("type").asText())
                || !"init".equals(message.path("subtype").asText())) {
            return Optional.empty();
        }
        String sessionId = message.path("session_id").asText("");
        return sessionId.isEmpty() ? Optional.empty() : Optional.of(sessionId);
    }

    public Optional<String> sessionId(String line) {
        return parse(line).flatMap(this::sessionId);
    }
}
