package com.overseer.supervisor;

import com.overseer.core.OverseerException;

/**
 * The worker command could not be spawned. The supervisor never retries a failed launch.
 */
public class ProcessLaunchException extends OverseerException {
    public ProcessLaunchException(String message) {
        super(message);
    }

    public ProcessLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
