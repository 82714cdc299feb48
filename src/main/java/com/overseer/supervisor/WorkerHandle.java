package com.overseer.supervisor;

/**
 * Backend-specific reference to a started worker.
 */
public interface WorkerHandle {

    /** Operating system process id, or -1 when the backend runs no process. */
    long pid();
}
