package com.overseer.supervisor;

import com.overseer.core.config.OverseerProperties;
import com.overseer.core.config.TemplateExpander;
import com.overseer.core.metrics.OverseerMetrics;
import com.overseer.core.model.ExitStatus;
import com.overseer.core.model.Task;
import com.overseer.core.model.WorkspaceAllocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Launches and controls worker processes through the configured {@link WorkerBackend}s.
 *
 * <p>This class is backend-agnostic: the task's runner names the backend, and everything
 * backend-specific (how a command is spawned, how signals are delivered) stays behind the
 * {@link WorkerBackend} capability.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Expands the runner's command template for one attempt</li>
 *   <li>Opens the per-task log in append mode and marks each attempt in it</li>
 *   <li>Polls for exit without blocking</li>
 *   <li>Terminates graceful-then-forceful, process tree included</li>
 * </ul>
 */
@Service
public class ProcessSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);

    private final Map<String, WorkerBackend> backends = new LinkedHashMap<>();
    private final Duration terminateGrace;
    private final Clock clock;
    private final OverseerMetrics metrics;

    public ProcessSupervisor(List<WorkerBackend> backends, OverseerProperties properties,
                             Clock clock, OverseerMetrics metrics) {
        for (WorkerBackend backend : backends) {
            this.backends.put(backend.name(), backend);
        }
        this.terminateGrace = properties.getSupervisor().getTerminateGrace();
        this.clock = clock;
        this.metrics = metrics;
    }

    public Set<String> backendNames() {
        return backends.keySet();
    }

    /**
     * Starts one attempt of a task in its workspace. Returns as soon as the process is spawned.
     *
     * @param runId the current run, exported to the worker environment
     * @throws ProcessLaunchException when the backend is unknown, the log cannot be opened or
     *                                the command cannot be spawned
     */
    public RunningProcess start(Task task, WorkspaceAllocation allocation, LaunchPlan plan, String runId) {
        WorkerBackend backend = backends.get(plan.runner().backend());
        if (backend == null) {
            throw new ProcessLaunchException("Unknown worker backend '" + plan.runner().backend()
                    + "' for task " + task.id());
        }

        String command = renderCommand(task, allocation, plan, runId);
        var env = new HashMap<String, String>();
        env.put("OVERSEER_TASK_ID", task.id());
        env.put("OVERSEER_RUN_ID", runId);
        env.put("OVERSEER_PHASE", task.phase().wireName());
        env.put("OVERSEER_ATTEMPT", String.valueOf(plan.attempt()));
        env.put("OVERSEER_WORKSPACE", allocation.path().toString());
        env.put("OVERSEER_BRANCH", allocation.branch());
        if (plan.prompt() != null) {
            env.put("OVERSEER_PROMPT", plan.prompt().toString());
        }
        if (plan.handoff() != null) {
            env.put("OVERSEER_HANDOFF", plan.handoff().toString());
        }

        var startedAt = clock.instant();
        writeAttemptHeader(task, plan, command, startedAt.toString());
        var request = new LaunchRequest(task.id(), plan.attempt(), command, allocation.path(), task.logPath(), env);
        WorkerHandle handle;
        try {
            handle = backend.start(request);
        } catch (ProcessLaunchException e) {
            metrics.recordProcessLaunch(backend.name(), false);
            throw e;
        }
        metrics.recordProcessLaunch(backend.name(), true);
        log.info("Started {} attempt {} (pid {}, backend {})", task.id(), plan.attempt(), handle.pid(), backend.name());
        return new RunningProcess(task.id(), plan.attempt(), backend.name(), handle, startedAt, task.logPath(), command);
    }

    String renderCommand(Task task, WorkspaceAllocation allocation, LaunchPlan plan, String runId) {
        var values = new HashMap<String, String>();
        values.put("prompt", plan.prompt() == null ? "" : plan.prompt().toString());
        values.put("handoff", plan.handoff() == null ? "" : plan.handoff().toString());
        values.put("task", task.id());
        values.put("workspace", allocation.path().toString());
        values.put("branch", allocation.branch());
        values.put("run_id", runId);
        values.put("phase", task.phase().wireName());
        return TemplateExpander.expand(plan.runner().command(), values);
    }

    private void writeAttemptHeader(Task task, LaunchPlan plan, String command, String startedAt) {
        String header = "=== overseer: " + task.id() + " attempt " + plan.attempt()
                + " (" + plan.runner().name() + ") started " + startedAt + " ===\n$ " + command + "\n";
        try {
            Files.createDirectories(task.logPath().toAbsolutePath().getParent());
            Files.writeString(task.logPath(), header, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new ProcessLaunchException("Cannot open log " + task.logPath() + ": " + e.getMessage(), e);
        }
    }

    /** Non-blocking exit check. */
    public Optional<ExitStatus> poll(RunningProcess process) {
        Optional<ExitStatus> known = process.exitStatus();
        if (known.isPresent()) {
            return known;
        }
        Optional<ExitStatus> status = backend(process).poll(process.handle());
        status.ifPresent(process::recordExit);
        return status;
    }

    /** Whether the backend that ran {@code process} reports {@code status} as a failed launch. */
    public boolean isLaunchFailure(RunningProcess process, ExitStatus status) {
        return backend(process).isLaunchFailure(status);
    }

    /** Sends the cooperative stop request (SIGINT) used by the interrupt strategy. */
    public void interrupt(RunningProcess process) {
        log.info("Interrupting {} (pid {})", process.taskId(), process.pid());
        backend(process).signal(process.handle(), SignalTier.COOPERATIVE);
    }

    /**
     * Stops a worker: graceful signal first, then a forceful kill if it is still running after the
     * grace window. Blocks until the process has exited or the forceful kill was sent.
     *
     * @return the exit status, or empty if the process did not report one after the forceful kill
     */
    public Optional<ExitStatus> terminate(RunningProcess process) {
        WorkerBackend backend = backend(process);
        if (poll(process).isPresent()) {
            return process.exitStatus();
        }
        try {
            log.info("Terminating {} (pid {})", process.taskId(), process.pid());
            backend.signal(process.handle(), SignalTier.GRACEFUL);
            Optional<ExitStatus> status = backend.awaitExit(process.handle(), terminateGrace);
            if (status.isEmpty()) {
                log.warn("{} (pid {}) ignored SIGTERM for {}s, killing", process.taskId(), process.pid(),
                        terminateGrace.toSeconds());
                backend.signal(process.handle(), SignalTier.FORCEFUL);
                status = backend.awaitExit(process.handle(), terminateGrace);
            }
            status.ifPresent(process::recordExit);
            return status;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            backend.signal(process.handle(), SignalTier.FORCEFUL);
            log.warn("Interrupted while terminating {}, sent SIGKILL", process.taskId());
            return Optional.empty();
        }
    }

    private WorkerBackend backend(RunningProcess process) {
        WorkerBackend backend = backends.get(process.backend());
        if (backend == null) {
            throw new IllegalStateException("Backend " + process.backend() + " disappeared");
        }
        return backend;
    }
}
