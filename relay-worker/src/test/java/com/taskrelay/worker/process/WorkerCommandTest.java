package com.taskrelay.worker.process;

import com.taskrelay.core.model.WorkerRole;
import com.taskrelay.worker.WorkerInvocation;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class WorkerCommandTest {

    private static WorkerInvocation invocation(String sessionId) {
        return new WorkerInvocation(UUID.randomUUID(), UUID.randomUUID(), "do the thing",
            Path.of("/tmp/ws"), sessionId, WorkerRole.CODER, "claude-sonnet-4-5");
    }

    @Test
    void arguments_forNewSession_shouldNotResume() {
        WorkerCommand command = new WorkerCommand("claude", List.of());

        assertThat(command.arguments(invocation(null))).containsExactly(
            "claude", "--output-format", "stream-json", "--verbose",
            "--model", "claude-sonnet-4-5", "-p", "do the thing");
    }

    @Test
    void arguments_withSession_shouldResumeAndKeepPromptLast() {
        WorkerCommand command = new WorkerCommand("/usr/local/bin/claude",
            List.of("--dangerously-skip-permissions"));

        List<String> args = command.arguments(invocation("sess-1"));

        assertThat(args).containsSubsequence("--resume", "sess-1");
        assertThat(args).contains("--dangerously-skip-permissions");
        assertThat(args.subList(args.size() - 2, args.size())).containsExactly("-p", "do the thing");
    }

    @Test
    void blankSession_shouldStartFresh() {
        assertThat(new WorkerCommand("claude", null).arguments(invocation("  "))).doesNotContain("--resume");
    }

    @Test
    void stripInheritedSession_shouldDropClaudeVariablesOnly() {
        Map<String, String> env = new HashMap<>(Map.of(
            "CLAUDECODE", "1",
            "CLAUDE_CODE_ENTRYPOINT", "cli",
            "PATH", "/usr/bin",
            "HOME", "/home/relay"));

        WorkerCommand.stripInheritedSession(env);

        assertThat(env).containsOnlyKeys("PATH", "HOME");
    }
}
