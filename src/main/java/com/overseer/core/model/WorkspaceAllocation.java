package com.overseer.core.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An exclusively-owned worktree handed to one task. Released at most once.
 */
public final class WorkspaceAllocation {

    private final Path path;
    private final String branch;
    private final String taskId;
    private final String baseCommit;
    private final Instant createdAt;
    private final AtomicReference<Instant> releasedAt = new AtomicReference<>();

    public WorkspaceAllocation(Path path, String branch, String taskId, String baseCommit, Instant createdAt) {
        this.path = path;
        this.branch = branch;
        this.taskId = taskId;
        this.baseCommit = baseCommit;
        this.createdAt = createdAt;
    }

    public Path path() { return path; }
    public String branch() { return branch; }
    public String taskId() { return taskId; }
    public String baseCommit() { return baseCommit; }
    public Instant createdAt() { return createdAt; }
    public Optional<Instant> releasedAt() { return Optional.ofNullable(releasedAt.get()); }

    public boolean isLive() {
        return releasedAt.get() == null;
    }

    /**
     * Marks the allocation released.
     *
     * @return true for the first call only
     */
    public boolean markReleased(Instant at) {
        return releasedAt.compareAndSet(null, at);
    }

    @Override
    public String toString() {
        return "WorkspaceAllocation[" + taskId + " @ " + path + " (" + branch + ")]";
    }
}
