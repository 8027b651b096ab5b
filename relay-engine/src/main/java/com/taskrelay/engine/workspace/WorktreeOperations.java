package com.taskrelay.engine.workspace;

import java.nio.file.Path;

/**
 * Version-control primitives behind per-task workspaces.
 *
 * Implementations throw {@link com.taskrelay.core.exception.WorkspaceException}
 * when an operation that must succeed fails.
 */
public interface WorktreeOperations {

    /**
     * Check if a registered worktree lives at the path.
     */
    boolean exists(Path worktreePath);

    /**
     * Create a worktree at the path on a new branch started from the base branch.
     */
    void create(Path repoPath, Path worktreePath, String branch, String baseBranch);

    /**
     * Get the branch checked out in a worktree, or an empty string if it cannot be read.
     */
    String currentBranch(Path worktreePath);

    /**
     * Remove a worktree and its registration, discarding local changes.
     */
    void remove(Path repoPath, Path worktreePath);

    /**
     * Delete a local branch.
     *
     * @return false if the branch could not be deleted (usually because it is already gone)
     */
    boolean deleteBranch(Path repoPath, String branch);

    /**
     * Drop registrations of worktrees whose directories no longer exist.
     */
    void prune(Path repoPath);

    /**
     * Rebase a worktree onto the latest base branch from {@code origin}.
     * Does nothing when the repository has no {@code origin} remote.
     * Aborts the rebase and fails on conflict.
     */
    void rebase(Path worktreePath, String baseBranch);

    /**
     * Detect the default branch of a repository.
     */
    String defaultBranch(Path repoPath);
}
