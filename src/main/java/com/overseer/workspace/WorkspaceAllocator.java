package com.overseer.workspace;

import com.overseer.core.metrics.OverseerMetrics;
import com.overseer.core.model.ReleaseOutcome;
import com.overseer.core.model.Task;
import com.overseer.core.model.WorkspaceAllocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out isolated, exclusively-owned workspaces (a branch plus a git worktree) to tasks.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #allocate} reserves the path, then creates the branch from the task's base
 *       reference and materializes the worktree</li>
 *   <li>{@link #release} snapshot-commits pending work onto the branch and removes the
 *       worktree directory; the branch is always kept</li>
 *   <li>{@link #releaseAll} releases whatever is still live when a run ends</li>
 * </ol>
 *
 * <p>A path is reserved before any git command runs, so two tasks can never hold the same path
 * at once. Allocate and release may be called from any thread.
 */
public class WorkspaceAllocator {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceAllocator.class);

    private final Path repoRoot;
    private final GitWorkspaceManager git;
    private final boolean snapshotOnRelease;
    private final Clock clock;
    private final OverseerMetrics metrics;

    /** Paths reserved or allocated; a reservation exists from the start of allocate until release. */
    private final Set<Path> reserved = ConcurrentHashMap.newKeySet();

    /** Live allocations keyed by normalized workspace path. */
    private final ConcurrentHashMap<Path, WorkspaceAllocation> live = new ConcurrentHashMap<>();

    public WorkspaceAllocator(Path repoRoot, GitWorkspaceManager git, boolean snapshotOnRelease,
                              Clock clock, OverseerMetrics metrics) {
        this.repoRoot = repoRoot;
        this.git = git;
        this.snapshotOnRelease = snapshotOnRelease;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Creates the task's branch and worktree.
     *
     * @throws WorkspaceConflictException when the path is already allocated, exists but is not
     *                                    a worktree of the task branch, is not writable, or git
     *                                    fails to create the worktree
     */
    public WorkspaceAllocation allocate(Task task) {
        Path path = task.workspacePath().toAbsolutePath().normalize();
        if (!reserved.add(path)) {
            metrics.recordWorktreeOperation("allocate", false);
            WorkspaceAllocation holder = live.get(path);
            throw new WorkspaceConflictException(path, "Workspace " + path + " is already allocated"
                    + (holder != null ? " to task " + holder.taskId() : ""));
        }

        try {
            String baseCommit = git.resolveCommit(repoRoot, task.baseRef());
            if (Files.exists(path)) {
                adoptExisting(task, path);
            } else {
                createWorktree(task, path);
            }
            var allocation = new WorkspaceAllocation(path, task.branch(), task.id(), baseCommit, clock.instant());
            live.put(path, allocation);
            metrics.recordWorktreeOperation("allocate", true);
            log.info("Allocated workspace {} on {} for {}", path, task.branch(), task.id());
            return allocation;
        } catch (RuntimeException e) {
            reserved.remove(path);
            metrics.recordWorktreeOperation("allocate", false);
            throw e;
        }
    }

    private void adoptExisting(Task task, Path path) {
        if (!git.isWorktree(path)) {
            throw new WorkspaceConflictException(path,
                    "Workspace path exists but is not a git worktree: " + path);
        }
        String branch = git.currentBranch(path);
        if (!task.branch().equals(branch)) {
            throw new WorkspaceConflictException(path, "Workspace " + path + " is a worktree of "
                    + (branch == null ? "a detached HEAD" : "branch " + branch) + ", not " + task.branch());
        }
        if (!Files.isWritable(path)) {
            throw new WorkspaceConflictException(path, "Workspace " + path + " is not writable");
        }
        log.info("Reusing existing worktree {} for {}", path, task.id());
    }

    private void createWorktree(Task task, Path path) {
        Path parent = path.getParent();
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new WorkspaceConflictException(path,
                    "Cannot create parent directory for workspace " + path + ": " + e.getMessage());
        }
        if (!Files.isWritable(parent)) {
            throw new WorkspaceConflictException(path, "Workspace parent " + parent + " is not writable");
        }
        var result = git.addWorktree(repoRoot, path, task.branch(), task.baseRef());
        if (!result.success()) {
            throw new WorkspaceConflictException(path, result.error());
        }
    }

    /**
     * Releases a workspace: commits pending work onto the branch (when configured) and removes
     * the worktree directory. Calling it again for the same allocation does nothing.
     *
     * @return true if this call released the workspace
     */
    public boolean release(WorkspaceAllocation allocation, ReleaseOutcome outcome) {
        if (!allocation.markReleased(clock.instant())) {
            log.debug("Workspace {} already released", allocation.path());
            return false;
        }
        boolean removed = false;
        try {
            if (snapshotOnRelease) {
                git.commitAll(allocation.path(),
                        "overseer: snapshot of " + allocation.taskId() + " (" + outcome.name().toLowerCase(Locale.ROOT) + ")");
            }
            removed = git.removeWorktree(repoRoot, allocation.path());
            if (!removed) {
                log.warn("Worktree {} of {} could not be removed", allocation.path(), allocation.taskId());
            }
        } catch (GitCommandException e) {
            log.error("Releasing workspace {} of {} failed: {}", allocation.path(), allocation.taskId(),
                    e.getMessage(), e);
        } finally {
            live.remove(allocation.path(), allocation);
            reserved.remove(allocation.path());
            metrics.recordWorktreeOperation("release", removed);
        }
        log.info("Released workspace {} ({}, branch {} kept)", allocation.path(), outcome, allocation.branch());
        return true;
    }

    /** Releases every live allocation. */
    public void releaseAll(ReleaseOutcome outcome) {
        for (WorkspaceAllocation allocation : List.copyOf(live.values())) {
            release(allocation, outcome);
        }
    }

    public Map<Path, WorkspaceAllocation> liveAllocations() {
        return Map.copyOf(live);
    }

    public GitWorkspaceManager git() {
        return git;
    }
}
