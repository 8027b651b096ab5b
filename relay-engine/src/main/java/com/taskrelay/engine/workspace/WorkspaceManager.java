package com.taskrelay.engine.workspace;

import com.taskrelay.core.exception.WorkspaceException;
import com.taskrelay.core.model.Task;
import com.taskrelay.core.model.Workflow;
import com.taskrelay.engine.metrics.RelayMetrics;
import com.taskrelay.engine.service.BoardService;
import com.taskrelay.engine.workflow.WorkflowCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;

/**
 * Owns the per-task workspace: one worktree and one branch per task, created on first
 * dispatch, reused across retries and removed once the task is done or cancelled.
 *
 * Layout: {@code {worktreesPath}/{projectId}/{taskId}}, branch {@code task-{id prefix}-{epoch seconds}}.
 */
public class WorkspaceManager {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceManager.class);

    private static final String BRANCH_PREFIX = "task-";

    private final WorktreeOperations operations;
    private final BoardService boardService;
    private final WorkflowCatalog workflowCatalog;
    private final RelayMetrics metrics;
    private final Clock clock;
    private final Path repoPath;
    private final Path worktreesPath;
    private final String configuredBaseBranch;

    private volatile String baseBranch;

    public WorkspaceManager(
            WorktreeOperations operations,
            BoardService boardService,
            WorkflowCatalog workflowCatalog,
            RelayMetrics metrics,
            Clock clock,
            Path repoPath,
            Path worktreesPath,
            String baseBranch) {
        this.operations = operations;
        this.boardService = boardService;
        this.workflowCatalog = workflowCatalog;
        this.metrics = metrics;
        this.clock = clock;
        this.repoPath = repoPath;
        this.worktreesPath = worktreesPath;
        this.configuredBaseBranch = baseBranch;
    }

    /**
     * Return the task's workspace, creating and recording it if needed.
     *
     * A recorded workspace that still exists on disk is returned unchanged. Otherwise
     * a fresh worktree is created (or an existing one at the expected path adopted)
     * and stored on the task.
     */
    public Workspace ensureWorkspace(Task task) {
        if (task.hasWorkspace()) {
            Path recorded = Path.of(task.workspacePath());
            if (operations.exists(recorded)) {
                return new Workspace(recorded, task.branch());
            }
            log.warn("Recorded workspace {} for task {} is gone, creating a new one", recorded, task.taskId());
        }

        Path path = pathFor(task);
        String branch;
        if (operations.exists(path)) {
            branch = operations.currentBranch(path);
            log.info("Adopting existing worktree {} on branch '{}' for task {}", path, branch, task.taskId());
        } else {
            branch = branchName(task);
            createParentDirectories(path);
            operations.create(repoPath, path, branch, baseBranch());
            metrics.workspaceCreated();
            log.info("Created workspace {} on branch '{}' for task {}", path, branch, task.taskId());
        }

        boardService.attachWorkspace(task.taskId(), path.toString(), branch);
        return new Workspace(path, branch);
    }

    /**
     * Get the stored session handle for resuming the worker conversation.
     */
    public Optional<String> resumeHandle(Task task) {
        return Optional.ofNullable(task.sessionId()).filter(s -> !s.isBlank());
    }

    /**
     * Remove the task's worktree and branch and clear them from the task.
     * Safe to call when the task has no workspace.
     *
     * @throws WorkspaceException if the task is neither at its terminal step nor cancelled
     */
    public void teardown(Task task) {
        Task current = boardService.getTask(task.taskId());
        if (!current.hasWorkspace()) {
            log.debug("Task {} has no workspace to tear down", current.taskId());
            return;
        }

        Workflow workflow = workflowCatalog.get(current.projectId());
        if (!current.cancelled() && !workflow.isTerminal(current.stepId())) {
            throw new WorkspaceException("Task " + current.taskId() + " is still in progress; workspace kept");
        }

        Path path = Path.of(current.workspacePath());
        if (operations.exists(path)) {
            operations.remove(repoPath, path);
        } else {
            log.debug("Workspace {} for task {} is already gone", path, current.taskId());
        }
        if (current.branch() != null && !current.branch().isBlank()) {
            operations.deleteBranch(repoPath, current.branch());
        }

        boardService.detachWorkspace(current.taskId());
        metrics.workspaceRemoved();
        log.info("Tore down workspace {} for task {}", path, current.taskId());
    }

    /**
     * Drop worktree registrations whose directories were removed outside the engine.
     */
    public void prune() {
        operations.prune(repoPath);
    }

    /**
     * Rebase the workspace branch onto the base branch from {@code origin}. Skipped when
     * the repository has no {@code origin} remote; a conflict aborts the rebase and throws.
     * Not part of the dispatch path: callers decide when a branch should be refreshed.
     */
    public void rebase(Workspace workspace) {
        operations.rebase(workspace.path(), baseBranch());
    }

    public Path pathFor(Task task) {
        return worktreesPath
            .resolve(task.projectId().toString())
            .resolve(task.taskId().toString());
    }

    String branchName(Task task) {
        return BRANCH_PREFIX + task.taskId().toString().substring(0, 8) + "-" + clock.instant().getEpochSecond();
    }

    String baseBranch() {
        String branch = baseBranch;
        if (branch == null) {
            branch = configuredBaseBranch != null && !configuredBaseBranch.isBlank()
                ? configuredBaseBranch
                : operations.defaultBranch(repoPath);
            baseBranch = branch;
        }
        return branch;
    }

    private static void createParentDirectories(Path path) {
        try {
            Files.createDirectories(path.getParent());
        } catch (IOException e) {
            throw new WorkspaceException("Cannot create workspace directory " + path.getParent(), e);
        }
    }
}
