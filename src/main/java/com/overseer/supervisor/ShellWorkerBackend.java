package com.overseer.supervisor;

import com.overseer.core.model.ExitStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs worker commands through {@code /bin/sh -c} with the workspace as working directory.
 * Standard output and error are combined and appended to the task log. The shell reports a
 * command it cannot find or execute as exit 127 or 126; those count as launch failures.
 */
@Component
public class ShellWorkerBackend implements WorkerBackend {

    private static final Logger log = LoggerFactory.getLogger(ShellWorkerBackend.class);

    public static final String NAME = "shell";

    static final int EXIT_NOT_EXECUTABLE = 126;
    static final int EXIT_NOT_FOUND = 127;

    private final String shell;

    public ShellWorkerBackend() {
        this("/bin/sh");
    }

    public ShellWorkerBackend(String shell) {
        this.shell = shell;
    }

    record ShellHandle(Process process) implements WorkerHandle {
        @Override
        public long pid() {
            return process.pid();
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public WorkerHandle start(LaunchRequest request) {
        if (!Files.isDirectory(request.workingDirectory())) {
            throw new ProcessLaunchException("Working directory does not exist: " + request.workingDirectory());
        }
        var builder = new ProcessBuilder(shell, "-c", request.command())
                .directory(request.workingDirectory().toFile())
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.appendTo(request.logPath().toFile()))
                .redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")));
        builder.environment().putAll(request.environment());
        try {
            Process process = builder.start();
            log.debug("Started pid {} for {}: {}", process.pid(), request.taskId(), request.command());
            return new ShellHandle(process);
        } catch (IOException e) {
            throw new ProcessLaunchException("Cannot start worker for " + request.taskId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isLaunchFailure(ExitStatus status) {
        return status.code() == EXIT_NOT_EXECUTABLE || status.code() == EXIT_NOT_FOUND;
    }

    @Override
    public void signal(WorkerHandle handle, SignalTier tier) {
        Process process = ((ShellHandle) handle).process();
        // Collect descendants first: once the shell exits they are re-parented and unreachable
        List<ProcessHandle> tree = new ArrayList<>(process.descendants().toList());
        tree.add(process.toHandle());

        switch (tier) {
            case COOPERATIVE -> sendInterrupt(tree);
            case GRACEFUL -> tree.forEach(ProcessHandle::destroy);
            case FORCEFUL -> tree.forEach(ProcessHandle::destroyForcibly);
        }
        log.debug("Sent {} to pid {} and {} descendant(s)", tier, process.pid(), tree.size() - 1);
    }

    private void sendInterrupt(List<ProcessHandle> tree) {
        var command = new ArrayList<String>();
        command.add("kill");
        command.add("-INT");
        for (ProcessHandle ph : tree) {
            if (ph.isAlive()) {
                command.add(String.valueOf(ph.pid()));
            }
        }
        if (command.size() == 2) {
            return;
        }
        try {
            var kill = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            if (!kill.waitFor(5, TimeUnit.SECONDS)) {
                kill.destroyForcibly();
                log.warn("kill -INT did not finish for pids {}", command.subList(2, command.size()));
            }
        } catch (IOException e) {
            log.warn("Cannot send SIGINT to {}: {}", command.subList(2, command.size()), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while sending SIGINT to {}", command.subList(2, command.size()));
        }
    }

    @Override
    public Optional<ExitStatus> poll(WorkerHandle handle) {
        Process process = ((ShellHandle) handle).process();
        if (process.isAlive()) {
            return Optional.empty();
        }
        return Optional.of(new ExitStatus(process.exitValue()));
    }

    @Override
    public Optional<ExitStatus> awaitExit(WorkerHandle handle, Duration timeout) throws InterruptedException {
        Process process = ((ShellHandle) handle).process();
        if (process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            return Optional.of(new ExitStatus(process.exitValue()));
        }
        return Optional.empty();
    }
}
