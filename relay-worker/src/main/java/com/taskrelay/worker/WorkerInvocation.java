package com.taskrelay.worker;

import com.taskrelay.core.model.WorkerRole;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Everything needed to start one worker run.
 *
 * @param sessionId session to resume, or null for a fresh conversation
 */
public record WorkerInvocation(
    UUID taskId,
    UUID runId,
    String prompt,
    Path workspacePath,
    String sessionId,
    WorkerRole role,
    String model
) {
    public boolean isResume() {
        return sessionId != null && !sessionId.isBlank();
    }
}
