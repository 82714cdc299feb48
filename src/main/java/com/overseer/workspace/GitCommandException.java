package com.overseer.workspace;

import com.overseer.core.OverseerException;

/**
 * A git command could not be run at all (missing binary, missing working directory, interrupted).
 * Non-zero exit codes are reported through return values instead.
 */
public class GitCommandException extends OverseerException {
    public GitCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
