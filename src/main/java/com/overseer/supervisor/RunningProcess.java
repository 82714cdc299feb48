package com.overseer.supervisor;

import com.overseer.core.model.ExitStatus;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A launched worker. Owned by the {@link ProcessSupervisor}; other components only read it.
 */
public final class RunningProcess {

    private final String taskId;
    private final int attempt;
    private final String backend;
    private final WorkerHandle handle;
    private final Instant startedAt;
    private final Path logPath;
    private final String command;
    private final AtomicReference<ExitStatus> exitStatus = new AtomicReference<>();

    RunningProcess(String taskId, int attempt, String backend, WorkerHandle handle,
                   Instant startedAt, Path logPath, String command) {
        this.taskId = taskId;
        this.attempt = attempt;
        this.backend = backend;
        this.handle = handle;
        this.startedAt = startedAt;
        this.logPath = logPath;
        this.command = command;
    }

    public String taskId() { return taskId; }
    public int attempt() { return attempt; }
    public String backend() { return backend; }
    public long pid() { return handle.pid(); }
    public Instant startedAt() { return startedAt; }
    public Path logPath() { return logPath; }
    public String command() { return command; }

    WorkerHandle handle() {
        return handle;
    }

    /** Exit status once the process has finished; absent while it runs. */
    public Optional<ExitStatus> exitStatus() {
        return Optional.ofNullable(exitStatus.get());
    }

    void recordExit(ExitStatus status) {
        exitStatus.compareAndSet(null, status);
    }

    @Override
    public String toString() {
        return "RunningProcess[" + taskId + " #" + attempt + " pid=" + pid() + "]";
    }
}
