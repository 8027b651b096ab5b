package com.taskrelay.engine.workspace;

import com.taskrelay.core.exception.WorkspaceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link WorktreeOperations} backed by {@code git worktree}.
 *
 * <p>Shells out to the {@code git} CLI via {@link ProcessBuilder} rather than
 * depending on JGit. Each task gets its own worktree and branch, so workers never
 * share a checkout.
 */
public class GitWorktreeOperations implements WorktreeOperations {

    private static final Logger log = LoggerFactory.getLogger(GitWorktreeOperations.class);

    private static final String FALLBACK_BRANCH = "main";

    private final String gitExecutable;

    public GitWorktreeOperations() {
        this("git");
    }

    public GitWorktreeOperations(String gitExecutable) {
        this.gitExecutable = gitExecutable;
    }

    /**
     * A worktree directory holds a {@code .git} file, not a {@code .git} directory.
     */
    @Override
    public boolean exists(Path worktreePath) {
        return Files.isDirectory(worktreePath) && Files.isRegularFile(worktreePath.resolve(".git"));
    }

    @Override
    public void create(Path repoPath, Path worktreePath, String branch, String baseBranch) {
        log.info("Creating worktree {} on branch '{}' from '{}'", worktreePath, branch, baseBranch);

        GitResult result = runGit(repoPath, "worktree", "add", "-b", branch, worktreePath.toString(), baseBranch);
        if (!result.succeeded()) {
            throw new WorkspaceException(
                "Failed to create worktree at %s: %s".formatted(worktreePath, result.output()));
        }
    }

    @Override
    public String currentBranch(Path worktreePath) {
        GitResult result = runGit(worktreePath, "rev-parse", "--abbrev-ref", "HEAD");
        return result.succeeded() ? result.output() : "";
    }

    @Override
    public void remove(Path repoPath, Path worktreePath) {
        log.info("Removing worktree {}", worktreePath);

        GitResult result = runGit(repoPath, "worktree", "remove", "--force", worktreePath.toString());
        if (!result.succeeded()) {
            throw new WorkspaceException(
                "Failed to remove worktree at %s: %s".formatted(worktreePath, result.output()));
        }
    }

    @Override
    public boolean deleteBranch(Path repoPath, String branch) {
        GitResult result = runGit(repoPath, "branch", "-D", branch);
        if (!result.succeeded()) {
            log.debug("Could not delete branch '{}': {}", branch, result.output());
        }
        return result.succeeded();
    }

    @Override
    public void prune(Path repoPath) {
        GitResult result = runGit(repoPath, "worktree", "prune");
        if (!result.succeeded()) {
            throw new WorkspaceException("Failed to prune worktrees: " + result.output());
        }
    }

    @Override
    public void rebase(Path worktreePath, String baseBranch) {
        if (!runGit(worktreePath, "remote", "get-url", "origin").succeeded()) {
            log.debug("No origin remote for {}, skipping rebase", worktreePath);
            return;
        }

        GitResult fetch = runGit(worktreePath, "fetch", "origin", baseBranch);
        if (!fetch.succeeded()) {
            throw new WorkspaceException(
                "Failed to fetch origin/%s: %s".formatted(baseBranch, fetch.output()));
        }

        GitResult rebase = runGit(worktreePath, "rebase", "origin/" + baseBranch);
        if (!rebase.succeeded()) {
            runGit(worktreePath, "rebase", "--abort");
            throw new WorkspaceException(
                "Rebase conflict on origin/%s: %s".formatted(baseBranch, truncate(rebase.output(), 500)));
        }
        log.info("Rebased {} onto origin/{}", worktreePath, baseBranch);
    }

    /**
     * Try the remote HEAD, then a local {@code main} or {@code master}, then fall back to {@code main}.
     */
    @Override
    public String defaultBranch(Path repoPath) {
        GitResult remoteHead = runGit(repoPath, "symbolic-ref", "refs/remotes/origin/HEAD");
        if (remoteHead.succeeded() && !remoteHead.output().isEmpty()) {
            String ref = remoteHead.output();
            return ref.substring(ref.lastIndexOf('/') + 1);
        }

        GitResult branches = runGit(repoPath, "branch", "--list");
        if (branches.succeeded()) {
            List<String> names = branches.output().lines()
                .map(line -> line.replace("*", "").trim())
                .toList();
            if (names.contains("main")) {
                return "main";
            }
            if (names.contains("master")) {
                return "master";
            }
        }
        return FALLBACK_BRANCH;
    }

    /**
     * Check if a path is inside a git working tree.
     */
    public boolean isRepository(Path path) {
        if (!Files.isDirectory(path)) {
            return false;
        }
        GitResult result = runGit(path, "rev-parse", "--is-inside-work-tree");
        return result.succeeded() && "true".equals(result.output());
    }

    /**
     * Runs a git command, capturing combined stdout and stderr.
     */
    GitResult runGit(Path workDir, String... args) {
        List<String> command = new ArrayList<>();
        command.add(gitExecutable);
        command.addAll(List.of(args));
        log.debug("Running: {} (in {})", String.join(" ", command), workDir);

        try {
            Process process = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true)
                .start();

            StringBuilder output = new StringBuilder();
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (output.length() > 0) {
                        output.append('\n');
                    }
                    output.append(line);
                }
            }

            return new GitResult(process.waitFor(), output.toString().trim());
        } catch (IOException e) {
            throw new WorkspaceException("Git command failed: " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkspaceException("Interrupted while running: " + String.join(" ", command), e);
        }
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }

    record GitResult(int exitCode, String output) {
        boolean succeeded() {
            return exitCode == 0;
        }
    }
}
