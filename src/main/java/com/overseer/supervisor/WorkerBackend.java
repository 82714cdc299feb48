package com.overseer.supervisor;

import com.overseer.core.model.ExitStatus;

import java.time.Duration;
import java.util.Optional;

/**
 * Capability to launch and control worker processes.
 * Implementations: {@link ShellWorkerBackend} (default), {@link NoopWorkerBackend}.
 */
public interface WorkerBackend {

    /** Name referenced by runner definitions ("shell", "noop"). */
    String name();

    /**
     * Starts the worker without waiting for it.
     *
     * @throws ProcessLaunchException when the command cannot be spawned
     */
    WorkerHandle start(LaunchRequest request);

    /** Sends a stop request of the given tier to the worker and its descendants. */
    void signal(WorkerHandle handle, SignalTier tier);

    /** Exit status if the worker has finished; never blocks. */
    Optional<ExitStatus> poll(WorkerHandle handle);

    /**
     * Whether an exit status means the worker command never started, e.g. its executable was
     * missing when the backend tried to run it.
     */
    default boolean isLaunchFailure(ExitStatus status) {
        return false;
    }

    /**
     * Waits up to {@code timeout} for the worker to finish.
     *
     * @return the exit status, or empty if the worker is still running
     */
    default Optional<ExitStatus> awaitExit(WorkerHandle handle, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        Optional<ExitStatus> status = poll(handle);
        while (status.isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(50);
            status = poll(handle);
        }
        return status;
    }
}
