package com.overseer.workspace;

import com.overseer.core.OverseerException;

import java.nio.file.Path;

/**
 * A workspace cannot be allocated: the path is taken, is not a worktree of the task branch,
 * or cannot be written. Fails only the affected task.
 */
public class WorkspaceConflictException extends OverseerException {

    private final Path path;

    public WorkspaceConflictException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
