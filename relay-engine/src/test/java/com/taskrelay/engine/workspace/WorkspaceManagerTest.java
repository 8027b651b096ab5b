package com.taskrelay.engine.workspace;

import com.taskrelay.core.exception.WorkspaceException;
import com.taskrelay.core.model.Project;
import com.taskrelay.core.model.Task;
import com.taskrelay.engine.metrics.RelayMetrics;
import com.taskrelay.engine.test.EngineFixture;
import com.taskrelay.engine.test.FakeWorktreeOperations;
import com.taskrelay.engine.test.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

class WorkspaceManagerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private EngineFixture fixture;
    private WorkspaceManager manager;
    private FakeWorktreeOperations worktrees;
    private Project project;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(TimeController.frozenAt(NOW));
        manager = fixture.workspaceManager;
        worktrees = fixture.worktrees;
        project = fixture.createStandardProject();
    }

    @Test
    void ensureWorkspace_shouldCreateAndRecordWorktree() {
        Task task = fixture.createTaskAt(project.projectId(), "T", "Build");

        Workspace workspace = manager.ensureWorkspace(task);

        Path expected = fixture.worktreesPath.resolve(project.projectId().toString()).resolve(task.taskId().toString());
        assertEquals(expected, workspace.path());
        assertEquals("task-" + task.taskId().toString().substring(0, 8) + "-" + NOW.getEpochSecond(), workspace.branch());

        Task stored = fixture.reload(task.taskId());
        assertEquals(expected.toString(), stored.workspacePath());
        assertEquals(workspace.branch(), stored.branch());
        assertThat(worktrees.worktrees()).containsKey(expected);
        assertEquals(1.0, fixture.meterRegistry.counter(RelayMetrics.WORKSPACES, "operation", "created").count());
    }

    @Test
    void ensureWorkspace_shouldReuseRecordedWorkspace() {
        Task task = fixture.createTaskAt(project.projectId(), "T", "Build");
        Workspace first = manager.ensureWorkspace(task);
        fixture.clock.advanceMinutes(10);

        Workspace second = manager.ensureWorkspace(fixture.reload(task.taskId()));

        assertEquals(first, second);
        assertThat(worktrees.worktrees()).hasSize(1);
    }

    @Test
    void ensureWorkspace_shouldAdoptExistingWorktreeAtExpectedPath() {
        Task task = fixture.createTaskAt(project.projectId(), "T", "Build");
        worktrees.register(manager.pathFor(task), "task-old-1");

        Workspace workspace = manager.ensureWorkspace(task);

        assertEquals("task-old-1", workspace.branch());
        assertEquals("task-old-1", fixture.reload(task.taskId()).branch());
    }

    @Test
    void ensureWorkspace_shouldRecreateWhenRecordedPathVanished() {
        Task task = fixture.createTaskAt(project.projectId(), "T", "Build");
        fixture.board.attachWorkspace(task.taskId(), "/nowhere/gone", "task-gone");

        Workspace workspace = manager.ensureWorkspace(fixture.reload(task.taskId()));

        assertEquals(manager.pathFor(task), workspace.path());
        assertNotEquals("task-gone", workspace.branch());
    }

    @Test
    void ensureWorkspace_shouldPropagateGitFailure() {
        Task task = fixture.createTaskAt(project.projectId(), "T", "Build");
        worktrees.failCreateWith("fatal: invalid reference: main");

        assertThrows(WorkspaceException.class, () -> manager.ensureWorkspace(task));
        assertNull(fixture.reload(task.taskId()).workspacePath());
    }

    @Test
    void resumeHandle_shouldReturnStoredSession() {
        Task task = fixture.createTask(project.projectId(), "T");
        assertThat(manager.resumeHandle(task)).isEmpty();

        fixture.board.recordSession(task.taskId(), "sess-42");

        assertThat(manager.resumeHandle(fixture.reload(task.taskId()))).contains("sess-42");
    }

    @Test
    void teardown_shouldRemoveWorktreeBranchAndTaskFields() {
        Task task = fixture.createTaskAt(project.projectId(), "T", "Build");
        Workspace workspace = manager.ensureWorkspace(task);
        fixture.board.recordSession(task.taskId(), "sess-1");
        fixture.board.completeTask(task.taskId());

        manager.teardown(task);

        assertThat(worktrees.worktrees()).isEmpty();
        assertThat(worktrees.deletedBranches()).containsExactly(workspace.branch());
        Task stored = fixture.reload(task.taskId());
        assertNull(stored.workspacePath());
        assertNull(stored.branch());
        assertNull(stored.sessionId());
    }

    @Test
    void teardown_shouldBeNoOpWithoutWorkspace() {
        Task task = fixture.createTaskAt(project.projectId(), "T", "Done");

        assertDoesNotThrow(() -> manager.teardown(task));
        assertThat(worktrees.deletedBranches()).isEmpty();
    }

    @Test
    void teardown_shouldRefuseTaskStillInProgress() {
        Task task = fixture.createTaskAt(project.projectId(), "T", "Build");
        manager.ensureWorkspace(task);

        assertThrows(WorkspaceException.class, () -> manager.teardown(task));
        assertThat(worktrees.worktrees()).hasSize(1);
    }

    @Test
    void teardown_shouldAcceptCancelledTask() {
        Task task = fixture.createTaskAt(project.projectId(), "T", "Build");
        manager.ensureWorkspace(task);
        fixture.board.cancelTask(task.taskId());

        manager.teardown(task);

        assertThat(worktrees.worktrees()).isEmpty();
    }

    @Test
    void rebaseAndPrune_shouldDelegate() {
        Task task = fixture.createTaskAt(project.projectId(), "T", "Build");
        Workspace workspace = manager.ensureWorkspace(task);

        manager.rebase(workspace);
        manager.prune();

        assertThat(worktrees.rebased()).containsExactly(workspace.path());
        assertEquals(1, worktrees.pruneCount());
    }
}
