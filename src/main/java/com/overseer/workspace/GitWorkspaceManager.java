package com.overseer.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Manages task branches and their git worktrees in the local project repository.
 *
 * <p>This class shells out to the {@code git} CLI via {@link ProcessBuilder}
 * rather than depending on JGit. Branches are never deleted and never merged here:
 * merging task results is a separate, explicit step.
 */
public class GitWorkspaceManager {

    private static final Logger log = LoggerFactory.getLogger(GitWorkspaceManager.class);

    /**
     * Pattern to parse a single line of {@code git diff --stat} output.
     * Examples:
     * <pre>
     *   src/main/Foo.java           | 15 +++---
     *   src/main/Bar.java (new)     |  3 +++
     *   src/old/Baz.java (gone)     |  7 -------
     * </pre>
     */
    static final Pattern DIFF_STAT_LINE = Pattern.compile(
            "^\\s*(.+?)\\s*\\|\\s*(\\d+)\\s*[+\\-]*\\s*$"
    );

    private final String gitBinary;

    public GitWorkspaceManager(String gitBinary) {
        this.gitBinary = gitBinary;
    }

    /**
     * One changed file from {@code git diff --stat}.
     *
     * @param path         file path relative to the worktree
     * @param action       "created", "modified" or "deleted"
     * @param linesChanged number of lines changed
     */
    public record FileChange(String path, String action, int linesChanged) {}

    /**
     * Result of a worktree operation.
     */
    public record WorktreeResult(boolean success, Path worktreePath, String error) {
        public static WorktreeResult success(Path path) {
            return new WorktreeResult(true, path, null);
        }
        public static WorktreeResult failure(String error) {
            return new WorktreeResult(false, null, error);
        }
    }

    // ══════════════════════════════════════════════════════════════════════════
    // REPOSITORY QUERIES
    // ══════════════════════════════════════════════════════════════════════════

    /** Whether the git binary can be executed. */
    public boolean isGitAvailable(Path workDir) {
        try {
            return runGit(workDir, "--version") == 0;
        } catch (GitCommandException e) {
            log.debug("git is not runnable: {}", e.getMessage());
            return false;
        }
    }

    public boolean isGitRepository(Path path) {
        if (path == null || !Files.isDirectory(path)) {
            return false;
        }
        return "true".equals(runGitOutput(path, "rev-parse", "--is-inside-work-tree").trim());
    }

    /**
     * Whether {@code path} is the top level of a git working tree (the main checkout or a
     * linked worktree), as opposed to a plain directory or a subdirectory of another checkout.
     */
    public boolean isWorktree(Path path) {
        if (!isGitRepository(path)) {
            return false;
        }
        String topLevel = runGitOutput(path, "rev-parse", "--show-toplevel").trim();
        if (topLevel.isEmpty()) {
            return false;
        }
        try {
            return Path.of(topLevel).toRealPath().equals(path.toRealPath());
        } catch (IOException e) {
            log.debug("Cannot resolve {} or {}: {}", topLevel, path, e.getMessage());
            return false;
        }
    }

    /** Branch checked out in a working tree, or null for a detached HEAD. */
    public String currentBranch(Path worktree) {
        String branch = runGitOutput(worktree, "rev-parse", "--abbrev-ref", "HEAD").trim();
        return branch.isEmpty() || "HEAD".equals(branch) ? null : branch;
    }

    /** Full commit id a reference points to, or null when it does not resolve. */
    public String resolveCommit(Path repo, String ref) {
        String sha = runGitOutput(repo, "rev-parse", "--verify", "--quiet", ref + "^{commit}").trim();
        return sha.isEmpty() ? null : sha;
    }

    /** Commit time of the newest commit on {@code branch}. */
    public Optional<Instant> lastCommitTime(Path repo, String branch) {
        String epoch = runGitOutput(repo, "log", "-1", "--format=%ct", branch).trim();
        if (epoch.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.ofEpochSecond(Long.parseLong(epoch)));
        } catch (NumberFormatException e) {
            log.debug("Unexpected commit time '{}' for {}", epoch, branch);
            return Optional.empty();
        }
    }

    /** One-line log of commits on HEAD since {@code baseCommit}. */
    public String commitLog(Path worktree, String baseCommit) {
        String range = baseCommit == null ? "-20" : baseCommit + "..HEAD";
        return runGitOutput(worktree, "log", "--oneline", "--no-decorate", range);
    }

    public String statusPorcelain(Path worktree) {
        return runGitOutput(worktree, "status", "--porcelain");
    }

    /** Working tree diff against {@code baseCommit} (or HEAD), including uncommitted changes. */
    public String diff(Path worktree, String baseCommit) {
        return runGitOutput(worktree, "diff", baseCommit == null ? "HEAD" : baseCommit);
    }

    public List<FileChange> diffStat(Path worktree, String baseCommit) {
        return parseDiffStat(runGitOutput(worktree, "diff", "--stat", baseCommit == null ? "HEAD" : baseCommit));
    }

    // ══════════════════════════════════════════════════════════════════════════
    // GIT WORKTREE OPERATIONS
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Adds a worktree at {@code worktreePath} on {@code branch}, creating the branch from
     * {@code baseRef}. When the branch already exists (a previous attempt or run), the existing
     * branch is checked out instead so earlier commits are kept.
     *
     * @param repoRoot     main checkout of the project repository
     * @param worktreePath directory to create
     * @param branch       task branch
     * @param baseRef      reference a new branch starts from
     * @return result containing the worktree path on success, or error on failure
     */
    public WorktreeResult addWorktree(Path repoRoot, Path worktreePath, String branch, String baseRef) {
        if (repoRoot == null || !Files.isDirectory(repoRoot)) {
            return WorktreeResult.failure("Repository does not exist: " + repoRoot);
        }

        log.info("Adding worktree at {} (branch: {}, base: {})", worktreePath, branch, baseRef);

        int exitCode = runGit(repoRoot, "worktree", "add", "-b", branch, worktreePath.toString(), baseRef);

        if (exitCode != 0) {
            // Branch may already exist from a previous attempt - try without -b
            log.info("Branch {} may already exist, trying to check out existing branch", branch);
            exitCode = runGit(repoRoot, "worktree", "add", worktreePath.toString(), branch);

            if (exitCode != 0) {
                String error = "Failed to create worktree " + worktreePath + " on " + branch
                        + " (exit code " + exitCode + ")";
                log.error(error);
                return WorktreeResult.failure(error);
            }
        }

        log.info("Worktree created at {}", worktreePath);
        return WorktreeResult.success(worktreePath);
    }

    /**
     * Removes a worktree. The branch is preserved.
     *
     * @return true if removal succeeded (or the worktree didn't exist), false on error
     */
    public boolean removeWorktree(Path repoRoot, Path worktreePath) {
        if (repoRoot == null || !Files.isDirectory(repoRoot)) {
            log.warn("Cannot remove worktree: repository {} does not exist", repoRoot);
            return false;
        }

        log.info("Removing worktree at {}", worktreePath);

        // --force: the snapshot commit may have been skipped or failed
        int exitCode = runGit(repoRoot, "worktree", "remove", "--force", worktreePath.toString());

        if (exitCode != 0) {
            log.warn("git worktree remove failed for {}, attempting manual cleanup", worktreePath);
            deleteDirectory(worktreePath);
            runGit(repoRoot, "worktree", "prune");
        }

        return !Files.exists(worktreePath);
    }

    /**
     * Commits every change in the worktree onto its branch.
     *
     * @return true if a commit was made, false when there was nothing to commit or the commit failed
     */
    public boolean commitAll(Path worktreePath, String message) {
        if (worktreePath == null || !Files.isDirectory(worktreePath)) {
            log.warn("Cannot commit: worktree does not exist at {}", worktreePath);
            return false;
        }

        runGit(worktreePath, "add", "-A");

        int diffExit = runGit(worktreePath, "diff", "--cached", "--quiet");
        if (diffExit == 0) {
            log.debug("No changes to commit in {}", worktreePath);
            return false;
        }

        int commitExit = runGit(worktreePath, "commit", "--no-verify", "-m", message);
        if (commitExit != 0) {
            log.warn("Failed to commit changes in {} (exit code {})", worktreePath, commitExit);
            return false;
        }

        log.info("Committed pending changes in {}", worktreePath);
        return true;
    }

    // ══════════════════════════════════════════════════════════════════════════
    // PROCESS PLUMBING
    // ══════════════════════════════════════════════════════════════════════════

    /**
     * Runs a git command and returns the exit code.
     *
     * @param workDir working directory for the git command
     * @param args    git arguments (e.g. "worktree", "add", path)
     * @return process exit code
     */
    int runGit(Path workDir, String... args) {
        var command = buildCommand(args);
        log.debug("Running: {}", String.join(" ", command));

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();

            // Consume output to prevent blocking
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("git: {}", line);
                }
            }

            return process.waitFor();
        } catch (IOException e) {
            throw new GitCommandException("Git command failed: " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitCommandException("Interrupted running: " + String.join(" ", command), e);
        }
    }

    /**
     * Runs a git command and captures stdout. A failing command yields whatever it printed
     * (usually nothing).
     *
     * @param workDir working directory for the git command
     * @param args    git arguments
     * @return captured stdout as a single string
     */
    String runGitOutput(Path workDir, String... args) {
        var command = buildCommand(args);
        log.debug("Running (capture): {}", String.join(" ", command));

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(false)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();

            String output;
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.debug("Git command exited with code {}: {}", exitCode, String.join(" ", command));
            }

            return output;
        } catch (IOException e) {
            throw new GitCommandException("Git command failed: " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitCommandException("Interrupted running: " + String.join(" ", command), e);
        }
    }

    private List<String> buildCommand(String... args) {
        var command = new ArrayList<String>(args.length + 1);
        command.add(gitBinary);
        command.addAll(List.of(args));
        return command;
    }

    /**
     * Parses {@code git diff --stat} output into a list of {@link FileChange}.
     *
     * <p>Lines containing {@code (new)} are marked as "created", lines with
     * {@code (gone)} as "deleted", and everything else as "modified".
     * The summary line (e.g., "3 files changed, 10 insertions(+)") is ignored.
     */
    List<FileChange> parseDiffStat(String diffStatOutput) {
        if (diffStatOutput == null || diffStatOutput.isBlank()) {
            return List.of();
        }

        var results = new ArrayList<FileChange>();
        for (var line : diffStatOutput.split("\n")) {
            Matcher matcher = DIFF_STAT_LINE.matcher(line);
            if (!matcher.matches()) {
                continue;
            }

            var rawPath = matcher.group(1).trim();
            int linesChanged = Integer.parseInt(matcher.group(2));

            String action;
            String path;
            if (rawPath.contains("(new)")) {
                action = "created";
                path = rawPath.replace("(new)", "").trim();
            } else if (rawPath.contains("(gone)")) {
                action = "deleted";
                path = rawPath.replace("(gone)", "").trim();
            } else {
                action = "modified";
                path = rawPath;
            }

            results.add(new FileChange(path, action, linesChanged));
        }

        return results;
    }

    void deleteDirectory(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("Failed to delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Failed to delete directory {}: {}", dir, e.getMessage());
        }
    }
}
