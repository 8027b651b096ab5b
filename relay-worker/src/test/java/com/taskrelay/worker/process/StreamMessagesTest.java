package com.taskrelay.worker.process;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class StreamMessagesTest {

    private final StreamMessages messages = new StreamMessages(new ObjectMapper());

    @Test
    void initMessage_shouldYieldSessionId() {
        String line = "{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"abc-123\",\"tools\":[]}";

        assertThat(messages.sessionId(line)).contains("abc-123");
    }

    @Test
    void otherMessages_shouldYieldNothing() {
        assertThat(messages.sessionId("{\"type\":\"assistant\",\"session_id\":\"abc\"}")).isEmpty();
        assertThat(messages.sessionId("{\"type\":\"system\",\"subtype\":\"init\"}")).isEmpty();
        assertThat(messages.sessionId("{\"type\":\"result\",\"subtype\":\"success\"}")).isEmpty();
    }

    @Test
    void nonJsonLines_shouldBeSkipped() {
        assertThat(messages.parse("Loading...")).isEmpty();
        assertThat(messages.parse("")).isEmpty();
        assertThat(messages.parse("[1,2,3]")).isEmpty();
        assertThat(messages.sessionId("{not json")).isEmpty();
    }
}
