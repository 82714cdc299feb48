package com.overseer.core.lock;

import com.overseer.core.OverseerException;
import com.overseer.core.model.PhaseLock;

import java.nio.file.Path;

/**
 * A privileged phase is already held by another run. Raised before any task starts.
 */
public class PhaseLockHeldException extends OverseerException {

    private final Path lockFile;
    private final PhaseLock holder;

    public PhaseLockHeldException(Path lockFile, PhaseLock holder) {
        super(describe(lockFile, holder));
        this.lockFile = lockFile;
        this.holder = holder;
    }

    private static String describe(Path lockFile, PhaseLock holder) {
        if (holder == null) {
            return "Active run lock detected at " + lockFile + " (holder unknown)";
        }
        return "Active run lock detected at " + lockFile + ": phase " + holder.phase()
                + " held by run " + holder.holderRunId() + " since " + holder.acquiredAt();
    }

    public Path lockFile() {
        return lockFile;
    }

    /** Holder recorded in the lock file, or null when the file could not be read. */
    public PhaseLock holder() {
        return holder;
    }
}
