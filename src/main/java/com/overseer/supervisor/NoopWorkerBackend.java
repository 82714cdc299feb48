package com.overseer.supervisor;

import com.overseer.core.model.ExitStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * Backend that runs nothing: it records the command it would have run in the task log and
 * reports an immediate successful exit. Used for rehearsals ({@code OVERSEER_RUNNER_NOOP=1}).
 */
@Component
public class NoopWorkerBackend implements WorkerBackend {

    private static final Logger log = LoggerFactory.getLogger(NoopWorkerBackend.class);

    public static final String NAME = "noop";

    record NoopHandle(String taskId) implements WorkerHandle {
        @Override
        public long pid() {
            return -1;
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public WorkerHandle start(LaunchRequest request) {
        String line = "[noop] would run in " + request.workingDirectory() + ": " + request.command() + "\n";
        try {
            Files.writeString(request.logPath(), line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new ProcessLaunchException("Cannot write log for " + request.taskId() + ": " + e.getMessage(), e);
        }
        log.debug("No-op launch for {}", request.taskId());
        return new NoopHandle(request.taskId());
    }

    @Override
    public void signal(WorkerHandle handle, SignalTier tier) {
        log.debug("Ignoring {} for no-op worker {}", tier, ((NoopHandle) handle).taskId());
    }

    @Override
    public Optional<ExitStatus> poll(WorkerHandle handle) {
        return Optional.of(new ExitStatus(0));
    }
}
