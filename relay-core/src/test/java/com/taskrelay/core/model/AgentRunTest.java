package com.taskrelay.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class AgentRunTest {

    @Test
    void start_shouldCreateActiveRun() {
        AgentRun run = AgentRun.start(UUID.randomUUID(), UUID.randomUUID());

        assertThat(run.isActive()).isTrue();
        assertThat(run.isSuccessful()).isFalse();
        assertThat(run.exitCode()).isNull();
        assertThat(run.startedAt()).isNotNull();
    }

    @Test
    void withCompleted_shouldCloseRun() {
        AgentRun run = AgentRun.start(UUID.randomUUID(), UUID.randomUUID());
        AgentRun completed = run.withCompleted(run.startedAt().plusSeconds(90), 0, null);

        assertThat(completed.isActive()).isFalse();
        assertThat(completed.isSuccessful()).isTrue();
        assertThat(completed.duration(Instant.now())).isEqualTo(Duration.ofSeconds(90));
    }

    @Test
    void nonZeroExit_shouldNotBeSuccessful() {
        AgentRun run = AgentRun.start(UUID.randomUUID(), UUID.randomUUID())
            .withCompleted(Instant.now(), AgentRun.LAUNCH_FAILURE_EXIT_CODE, "claude not found");

        assertThat(run.isSuccessful()).isFalse();
        assertThat(run.error()).isEqualTo("claude not found");
    }

    @Test
    void duration_ofActiveRun_shouldMeasureUpToNow() {
        AgentRun run = AgentRun.start(UUID.randomUUID(), UUID.randomUUID());

        assertThat(run.duration(run.startedAt().plusSeconds(5))).isEqualTo(Duration.ofSeconds(5));
    }
}
