package com.overseer.core.engine;

import com.overseer.core.config.OverseerProperties;
import com.overseer.core.escalation.EscalationEngine;
import com.overseer.core.escalation.HandoffWriter;
import com.overseer.core.escalation.RecoveryActions;
import com.overseer.core.events.EventLog;
import com.overseer.core.events.EventType;
import com.overseer.core.events.ProtocolLog;
import com.overseer.core.logging.MdcContext;
import com.overseer.core.metrics.OverseerMetrics;
import com.overseer.core.model.EscalationRecord;
import com.overseer.core.model.EscalationStrategy;
import com.overseer.core.model.ExitStatus;
import com.overseer.core.model.FailureReason;
import com.overseer.core.model.Liveness;
import com.overseer.core.model.ReleaseOutcome;
import com.overseer.core.model.RunnerSpec;
import com.overseer.core.model.Task;
import com.overseer.core.model.TaskStatus;
import com.overseer.core.model.WorkspaceAllocation;
import com.overseer.core.scheduler.ReadySetCalculator;
import com.overseer.core.watchdog.TaskMonitor;
import com.overseer.core.watchdog.WatchdogVerdict;
import com.overseer.supervisor.LaunchPlan;
import com.overseer.supervisor.ProcessLaunchException;
import com.overseer.supervisor.ProcessSupervisor;
import com.overseer.supervisor.RunningProcess;
import com.overseer.workspace.WorkspaceAllocator;
import com.overseer.workspace.WorkspaceConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The single coordinating loop of a run.
 *
 * <p>Each iteration:
 * <ol>
 *   <li>drains the inbox (launch results, watchdog verdicts, finished releases)</li>
 *   <li>lets the escalation engine act on expired grace periods</li>
 *   <li>blocks tasks whose dependencies failed and starts ready tasks up to the parallel limit</li>
 *   <li>polls running workers for exit</li>
 *   <li>emits the status heartbeat</li>
 * </ol>
 *
 * <p>Only this loop changes task status. Allocation, spawning, termination and release run as
 * jobs on a small pool and report back through the inbox; monitoring tasks report the same way.
 * A task's terminal record is appended only after its worker is gone and its workspace released,
 * so a dependent never branches from a task whose final snapshot is still being written.
 */
public class Conductor implements RecoveryActions {

    private static final Logger log = LoggerFactory.getLogger(Conductor.class);

    private final RunContext context;
    private final RunState state;
    private final EventLog events;
    private final WorkspaceAllocator allocator;
    private final ProcessSupervisor supervisor;
    private final ReadySetCalculator readySet;
    private final OverseerMetrics metrics;
    private final OverseerProperties properties;
    private final Clock clock;
    private final ProtocolLog alerts;
    private final ProtocolLog statusLog;
    private final HandoffWriter handoff;

    private final BlockingQueue<ConductorSignal> inbox = new LinkedBlockingQueue<>();
    private final ExecutorService pool;
    private final TaskMonitor monitor;
    private final EscalationEngine escalation;
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile boolean abortRequested;
    private volatile String abortReason;
    private boolean aborting;
    private String failure;

    public Conductor(RunContext context, WorkspaceAllocator allocator, ProcessSupervisor supervisor,
                     ReadySetCalculator readySet, OverseerMetrics metrics, OverseerProperties properties,
                     Clock clock) {
        this.context = context;
        this.state = new RunState(context.runId(), context.scheduled());
        this.events = context.events();
        this.allocator = allocator;
        this.supervisor = supervisor;
        this.readySet = readySet;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
        this.alerts = new ProtocolLog(context.logsDir().resolve(ProtocolLog.ALERTS_FILE), clock);
        this.statusLog = new ProtocolLog(context.logsDir().resolve(ProtocolLog.STATUS_FILE), clock);
        this.handoff = new HandoffWriter(context.logsDir().resolve("handoff"), allocator.git(), clock);
        this.pool = newPool(properties.getSupervisor().getLaunchThreads());
        this.monitor = new TaskMonitor(properties.getSupervisor().getMonitorThreads(), events, alerts, metrics,
                allocator.git(), properties.getWatchdog(), clock, v -> inbox.add(new ConductorSignal.Verdict(v)));
        this.escalation = new EscalationEngine(events, this, metrics);
    }

    private static ExecutorService newPool(int threads) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "overseer-job-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public RunState state() {
        return state;
    }

    public EscalationEngine escalation() {
        return escalation;
    }

    /** Error that stopped the loop early, or empty when it ran to quiescence. */
    public Optional<String> failure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Asks the loop to stop: pending tasks are blocked, running workers terminated and their
     * workspaces released. Callable from any thread.
     */
    public void requestAbort(String reason) {
        abortReason = reason;
        abortRequested = true;
    }

    /** Waits for {@link #run} to return. */
    public boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Runs until every scheduled task is terminal and no job is in flight.
     */
    public RunState run() {
        MdcContext.setRun(context.runId(), context.phaseNames());
        var heartbeat = new StatusHeartbeat(context.phaseNames(), properties.getStatusInterval(), statusLog,
                clock.instant());
        for (RunState.TaskState ts : state.tasks()) {
            escalation.register(ts.task());
        }
        log.info("Run {}: {} task(s) scheduled, up to {} in parallel", context.runId(), state.size(),
                properties.getMaxParallel());
        try {
            while (true) {
                drainInbox();
                if (abortRequested && !aborting) {
                    beginAbort(abortReason);
                }
                Instant now = clock.instant();
                if (!aborting) {
                    escalation.onTick(now);
                    schedule(now);
                }
                pollProcesses(now);
                heartbeat.maybeBeat(now, state);
                if (state.allTerminal() && !state.hasJobsInFlight()) {
                    break;
                }
                awaitSignal();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = "interrupted";
            emergencyStop(failure);
        } catch (RuntimeException e) {
            log.error("Coordinator loop failed: {}", e.getMessage(), e);
            failure = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            emergencyStop(failure);
        } finally {
            monitor.close();
            shutdownPool();
            finished.countDown();
        }
        if (aborting && failure == null) {
            failure = abortReason;
        }
        log.info("Run {} finished: {} succeeded, {} failed, {} blocked", context.runId(),
                state.count(TaskStatus.SUCCEEDED), state.count(TaskStatus.FAILED), state.count(TaskStatus.BLOCKED));
        return state;
    }

    // ── Inbox ────────────────────────────────────────────────────────────

    private void drainInbox() {
        ConductorSignal signal;
        while ((signal = inbox.poll()) != null) {
            handle(signal);
        }
    }

    private void awaitSignal() throws InterruptedException {
        ConductorSignal signal = inbox.poll(properties.getPollInterval().toMillis(), TimeUnit.MILLISECONDS);
        if (signal != null) {
            handle(signal);
        }
    }

    private void handle(ConductorSignal signal) {
        RunState.TaskState ts = state.get(signal.taskId());
        if (ts == null) {
            log.warn("Signal for unknown task {}: {}", signal.taskId(), signal);
            return;
        }
        if (signal instanceof ConductorSignal.Launched launched) {
            onLaunched(ts, launched);
        } else if (signal instanceof ConductorSignal.LaunchFailed launchFailed) {
            onLaunchFailed(ts, launchFailed);
        } else if (signal instanceof ConductorSignal.Verdict verdict) {
            onVerdict(ts, verdict.verdict());
        } else if (signal instanceof ConductorSignal.Released released) {
            recordTerminal(ts, released.status(), released.reason(), released.detail(), released.exitCode());
        }
    }

    private void onLaunched(RunState.TaskState ts, ConductorSignal.Launched launched) {
        ts.jobInFlight(false);
        ts.plan(launched.plan());
        ts.allocation(launched.allocation());
        ts.process(launched.process());
        if (aborting) {
            finishTask(ts, TaskStatus.FAILED, FailureReason.RUN_ABORTED, abortReason, null);
            return;
        }
        monitor.watch(ts.task(), launched.allocation(), launched.plan().attempt(), launched.process().startedAt());
        log.info("{} running (attempt {}, pid {})", ts.id(), launched.plan().attempt(), launched.process().pid());
    }

    private void onLaunchFailed(RunState.TaskState ts, ConductorSignal.LaunchFailed failed) {
        ts.jobInFlight(false);
        ts.process(null);
        ts.allocation(null);
        if (failed.relaunch() && !aborting) {
            escalation.onRelaunchFailed(ts.id(), clock.instant(), failed.detail());
            return;
        }
        FailureReason reason = aborting && failed.relaunch() ? FailureReason.RUN_ABORTED : failed.reason();
        recordTerminal(ts, TaskStatus.FAILED, reason, failed.detail(), null);
    }

    private void onVerdict(RunState.TaskState ts, WatchdogVerdict verdict) {
        if (aborting || ts.status() != TaskStatus.RUNNING || ts.jobInFlight() || ts.process() == null
                || ts.plan() == null || ts.plan().attempt() != verdict.attempt()) {
            return;
        }
        if (verdict.newlyStuck()) {
            escalation.onStuck(ts.id(), verdict.at());
        } else if (verdict.liveness() == Liveness.ACTIVE) {
            escalation.onActivity(ts.id(), verdict.at());
        }
    }

    // ── Scheduling ───────────────────────────────────────────────────────

    private void schedule(Instant now) {
        while (true) {
            ReadySetCalculator.ReadySet ready = readySet.compute(context.selected(), state.statuses(),
                    events.succeededTasks(), context.includeManual());
            if (ready.blocked().isEmpty()) {
                start(ready.ready(), now);
                return;
            }
            for (ReadySetCalculator.Blocked blocked : ready.blocked()) {
                block(state.get(blocked.taskId()), blocked.reason(), blocked.causes(), now);
            }
        }
    }

    private void block(RunState.TaskState ts, FailureReason reason, List<String> causes, Instant now) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("reason", wire(reason));
        payload.put("causes", causes);
        events.append(ts.id(), EventType.TASK_BLOCKED, payload);
        ts.finish(TaskStatus.BLOCKED, reason, causes.isEmpty() ? null : String.join(", ", causes), now);
        metrics.recordTaskFinished(TaskStatus.BLOCKED, Duration.ZERO);
        log.warn("{} blocked ({}): {}", ts.id(), wire(reason), causes);
    }

    private void start(List<String> readyIds, Instant now) {
        for (String id : readyIds) {
            RunState.TaskState ts = state.get(id);
            if (ts.status() == TaskStatus.PENDING) {
                ts.status(TaskStatus.READY);
                events.append(id, EventType.TASK_READY, Map.of("depends_on", List.copyOf(ts.task().dependsOn())));
            }
        }
        long running = state.count(TaskStatus.RUNNING);
        for (String id : readyIds) {
            if (running >= properties.getMaxParallel()) {
                log.debug("Parallel limit {} reached, {} ready task(s) waiting", properties.getMaxParallel(),
                        state.count(TaskStatus.READY));
                return;
            }
            RunState.TaskState ts = state.get(id);
            if (ts.status() != TaskStatus.READY) {
                continue;
            }
            Task task = ts.task();
            var plan = new LaunchPlan(task.runner(), task.promptPath(), null, 1);
            var payload = new LinkedHashMap<String, Object>();
            payload.put("attempt", plan.attempt());
            payload.put("runner", plan.runner().name());
            payload.put("workspace", task.workspacePath().toString());
            payload.put("branch", task.branch());
            events.append(id, EventType.TASK_STARTED, payload);
            ts.status(TaskStatus.RUNNING);
            ts.plan(plan);
            ts.startedAt(now);
            ts.jobInFlight(true);
            running++;
            submit(id, () -> launchJob(task, plan, false));
        }
    }

    // ── Processes ────────────────────────────────────────────────────────

    private void pollProcesses(Instant now) {
        for (RunState.TaskState ts : state.withStatus(TaskStatus.RUNNING)) {
            if (ts.jobInFlight() || ts.process() == null) {
                continue;
            }
            Optional<ExitStatus> exit = supervisor.poll(ts.process());
            if (exit.isEmpty()) {
                continue;
            }
            monitor.unwatch(ts.id());
            int code = exit.get().code();
            var payload = new LinkedHashMap<String, Object>();
            payload.put("attempt", ts.process().attempt());
            payload.put("exit_code", code);
            events.append(ts.id(), EventType.PROCESS_EXITED, payload);
            log.info("{} exited with code {}", ts.id(), code);

            if (supervisor.isLaunchFailure(ts.process(), exit.get())) {
                finishTask(ts, TaskStatus.FAILED, FailureReason.LAUNCH_FAILED,
                        "worker command could not be executed (exit code " + code + ")", code);
                continue;
            }
            if (!aborting && escalation.onWorkerExited(ts.id(), now)) {
                continue;
            }
            if (code == 0) {
                finishTask(ts, TaskStatus.SUCCEEDED, null, null, code);
            } else {
                finishTask(ts, TaskStatus.FAILED, FailureReason.PROCESS_EXIT, "exit code " + code, code);
            }
        }
    }

    /**
     * Stops the worker if needed and releases the workspace on the pool; the terminal record
     * follows when the job reports back.
     */
    private void finishTask(RunState.TaskState ts, TaskStatus status, FailureReason reason, String detail,
                            Integer exitCode) {
        monitor.unwatch(ts.id());
        RunningProcess process = ts.process();
        WorkspaceAllocation allocation = ts.allocation();
        ReleaseOutcome outcome = status == TaskStatus.SUCCEEDED ? ReleaseOutcome.SUCCESS : ReleaseOutcome.FAILURE;
        ts.jobInFlight(true);
        String id = ts.id();
        submit(id, () -> {
            try {
                if (process != null) {
                    terminateProcess(id, process);
                }
                if (allocation != null) {
                    releaseWorkspace(allocation, outcome);
                }
            } catch (RuntimeException e) {
                log.error("Cleanup of {} failed: {}", id, e.getMessage(), e);
            } finally {
                inbox.add(new ConductorSignal.Released(id, status, reason, detail, exitCode));
            }
        });
    }

    private void recordTerminal(RunState.TaskState ts, TaskStatus status, FailureReason reason, String detail,
                                Integer exitCode) {
        Instant now = clock.instant();
        var payload = new LinkedHashMap<String, Object>();
        if (ts.plan() != null) {
            payload.put("attempt", ts.plan().attempt());
        }
        Duration duration = ts.startedAt() == null ? Duration.ZERO : Duration.between(ts.startedAt(), now);
        if (status == TaskStatus.SUCCEEDED) {
            payload.put("duration_s", duration.toSeconds());
            events.append(ts.id(), EventType.TASK_SUCCEEDED, payload);
            log.info("{} succeeded in {}s", ts.id(), duration.toSeconds());
        } else {
            payload.put("reason", wire(reason));
            if (detail != null) {
                payload.put("detail", detail);
            }
            if (exitCode != null) {
                payload.put("exit_code", exitCode);
            }
            events.append(ts.id(), EventType.TASK_FAILED, payload);
            log.error("{} failed ({}): {}", ts.id(), wire(reason), detail);
        }
        ts.finish(status, reason, detail, now);
        metrics.recordTaskFinished(status, duration);
        escalation.onTaskFinished(ts.id(), status == TaskStatus.SUCCEEDED);
    }

    // ── Jobs (worker pool) ───────────────────────────────────────────────

    private void submit(String taskId, Runnable job) {
        pool.execute(() -> {
            MdcContext.setTask(context.runId(), taskId);
            try {
                job.run();
            } finally {
                MdcContext.clearTask();
            }
        });
    }

    /** Allocates the workspace and starts the worker; always reports back through the inbox. */
    private void launchJob(Task task, LaunchPlan plan, boolean relaunch) {
        String id = task.id();
        WorkspaceAllocation allocation = null;
        RunningProcess process = null;
        try {
            allocation = allocator.allocate(task);
            var allocated = new LinkedHashMap<String, Object>();
            allocated.put("path", allocation.path().toString());
            allocated.put("branch", allocation.branch());
            allocated.put("base_commit", String.valueOf(allocation.baseCommit()));
            events.append(id, EventType.WORKSPACE_ALLOCATED, allocated);

            process = supervisor.start(task, allocation, plan, context.runId());
            var started = new LinkedHashMap<String, Object>();
            started.put("attempt", plan.attempt());
            started.put("pid", process.pid());
            started.put("backend", process.backend());
            started.put("command", process.command());
            events.append(id, EventType.PROCESS_STARTED, started);
            inbox.add(new ConductorSignal.Launched(id, plan, allocation, process));
        } catch (WorkspaceConflictException e) {
            log.error("Workspace conflict for {}: {}", id, e.getMessage());
            inbox.add(new ConductorSignal.LaunchFailed(id, plan, FailureReason.WORKSPACE_CONFLICT,
                    e.getMessage(), relaunch));
        } catch (ProcessLaunchException e) {
            log.error("Cannot launch {}: {}", id, e.getMessage());
            cleanupQuietly(id, process, allocation);
            inbox.add(new ConductorSignal.LaunchFailed(id, plan, FailureReason.LAUNCH_FAILED,
                    e.getMessage(), relaunch));
        } catch (RuntimeException e) {
            log.error("Launching {} failed: {}", id, e.getMessage(), e);
            cleanupQuietly(id, process, allocation);
            FailureReason reason = allocation == null ? FailureReason.WORKSPACE_CONFLICT : FailureReason.LAUNCH_FAILED;
            inbox.add(new ConductorSignal.LaunchFailed(id, plan, reason, e.getMessage(), relaunch));
        }
    }

    private void cleanupQuietly(String taskId, RunningProcess process, WorkspaceAllocation allocation) {
        try {
            if (process != null) {
                supervisor.terminate(process);
            }
            if (allocation != null) {
                releaseWorkspace(allocation, ReleaseOutcome.FAILURE);
            }
        } catch (RuntimeException e) {
            log.error("Cleanup after failed launch of {} failed: {}", taskId, e.getMessage(), e);
        }
    }

    private void terminateProcess(String taskId, RunningProcess process) {
        if (supervisor.poll(process).isPresent()) {
            return;
        }
        Optional<ExitStatus> status = supervisor.terminate(process);
        var payload = new LinkedHashMap<String, Object>();
        payload.put("attempt", process.attempt());
        payload.put("exit_code", status.map(ExitStatus::code).orElse(null));
        events.append(taskId, EventType.PROCESS_TERMINATED, payload);
    }

    private void releaseWorkspace(WorkspaceAllocation allocation, ReleaseOutcome outcome) {
        if (allocator.release(allocation, outcome)) {
            var payload = new LinkedHashMap<String, Object>();
            payload.put("path", allocation.path().toString());
            payload.put("branch", allocation.branch());
            payload.put("outcome", outcome.name().toLowerCase(Locale.ROOT));
            events.append(allocation.taskId(), EventType.WORKSPACE_RELEASED, payload);
        }
    }

    // ── Recovery actions (called by the escalation engine on this thread) ─

    @Override
    public void notifyStuck(Task task, EscalationRecord record) {
        String line = "[NOTIFY] task=" + task.id() + " is stuck; attempt " + record.attemptCount()
                + ", next strategy in " + task.escalation().notifyGrace().toSeconds() + "s without progress";
        alerts.append(line);
        log.warn(line);
    }

    @Override
    public void interrupt(Task task, EscalationRecord record) {
        RunState.TaskState ts = state.get(task.id());
        if (ts.process() == null) {
            log.warn("Cannot interrupt {}: no running worker", task.id());
            return;
        }
        alerts.append("[INTERRUPT] task=" + task.id() + " pid=" + ts.process().pid());
        supervisor.interrupt(ts.process());
    }

    @Override
    public void restart(Task task, EscalationRecord record) {
        RunState.TaskState ts = state.get(task.id());
        EscalationStrategy strategy = record.strategy();
        LaunchPlan current = ts.plan();
        LaunchPlan next = switch (strategy) {
            case SWITCH_AGENT -> {
                RunnerSpec alternate = context.graph().runner(task.escalation().alternateRunner())
                        .orElseThrow(() -> new IllegalStateException(
                                "Alternate runner " + task.escalation().alternateRunner() + " not configured"));
                yield current.withRunner(alternate, handoff.pathFor(task.id()));
            }
            case SIMPLIFY_SCOPE -> current.withPrompt(task.escalation().simplifiedPrompt());
            default -> current.next();
        };

        monitor.unwatch(task.id());
        RunningProcess old = ts.process();
        WorkspaceAllocation allocation = ts.allocation();
        List<EscalationRecord> history = escalation.records(task.id());
        ts.process(null);
        ts.allocation(null);
        ts.plan(next);
        ts.jobInFlight(true);

        var payload = new LinkedHashMap<String, Object>();
        payload.put("attempt", next.attempt());
        payload.put("runner", next.runner().name());
        payload.put("strategy", strategy.wireName());
        events.append(task.id(), EventType.TASK_STARTED, payload);
        log.warn("Restarting {} with {} (attempt {})", task.id(), strategy.wireName(), next.attempt());

        submit(task.id(), () -> {
            try {
                if (old != null) {
                    terminateProcess(task.id(), old);
                }
                if (strategy == EscalationStrategy.SWITCH_AGENT && allocation != null) {
                    handoff.write(task, allocation, history);
                }
                if (allocation != null) {
                    releaseWorkspace(allocation, ReleaseOutcome.RESTART);
                }
            } catch (RuntimeException e) {
                log.error("Preparing restart of {} failed: {}", task.id(), e.getMessage(), e);
                inbox.add(new ConductorSignal.LaunchFailed(task.id(), next, FailureReason.LAUNCH_FAILED,
                        e.getMessage(), true));
                return;
            }
            launchJob(task, next, true);
        });
    }

    @Override
    public void fail(Task task, List<EscalationRecord> records) {
        RunState.TaskState ts = state.get(task.id());
        var tried = new ArrayList<String>();
        for (EscalationRecord record : records) {
            tried.add(record.strategy().wireName());
        }
        alerts.append("[FAILED] task=" + task.id() + " escalation exhausted after " + tried);
        finishTask(ts, TaskStatus.FAILED, FailureReason.ESCALATION_EXHAUSTED,
                "escalation exhausted after " + String.join(", ", tried), null);
    }

    // ── Abort ────────────────────────────────────────────────────────────

    private void beginAbort(String reason) {
        aborting = true;
        log.warn("Aborting run {}: {}", context.runId(), reason);
        Instant now = clock.instant();
        for (RunState.TaskState ts : state.tasks()) {
            if (ts.status() == TaskStatus.PENDING || ts.status() == TaskStatus.READY) {
                block(ts, FailureReason.RUN_ABORTED, List.of(), now);
            } else if (ts.status() == TaskStatus.RUNNING && !ts.jobInFlight()) {
                finishTask(ts, TaskStatus.FAILED, FailureReason.RUN_ABORTED, reason, null);
            }
        }
    }

    /**
     * Last-resort cleanup when the loop itself failed: everything runs on this thread.
     */
    private void emergencyStop(String reason) {
        aborting = true;
        pool.shutdownNow();
        try {
            pool.awaitTermination(properties.getSupervisor().getTerminateGrace().toMillis() * 2 + 1000,
                    TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        ConductorSignal signal;
        while ((signal = inbox.poll()) != null) {
            if (signal instanceof ConductorSignal.Launched launched) {
                stopQuietly(launched.process());
            }
        }
        for (RunState.TaskState ts : state.tasks()) {
            if (ts.process() != null) {
                stopQuietly(ts.process());
            }
        }
        try {
            allocator.releaseAll(ReleaseOutcome.FAILURE);
        } catch (RuntimeException e) {
            log.error("Releasing workspaces failed: {}", e.getMessage(), e);
        }
        Instant now = clock.instant();
        for (RunState.TaskState ts : state.tasks()) {
            if (ts.status().isTerminal()) {
                continue;
            }
            TaskStatus terminal = ts.status() == TaskStatus.RUNNING ? TaskStatus.FAILED : TaskStatus.BLOCKED;
            try {
                events.append(ts.id(), terminal == TaskStatus.FAILED ? EventType.TASK_FAILED : EventType.TASK_BLOCKED,
                        Map.of("reason", wire(FailureReason.RUN_ABORTED), "detail", reason));
            } catch (RuntimeException e) {
                log.error("Cannot record abort of {}: {}", ts.id(), e.getMessage());
            }
            ts.finish(terminal, FailureReason.RUN_ABORTED, reason, now);
        }
    }

    private void stopQuietly(RunningProcess process) {
        try {
            supervisor.terminate(process);
        } catch (RuntimeException e) {
            log.error("Cannot terminate {}: {}", process, e.getMessage(), e);
        }
    }

    private void shutdownPool() {
        pool.shutdown();
        try {
            long wait = properties.getSupervisor().getTerminateGrace().toMillis() * 3 + 10_000;
            if (!pool.awaitTermination(wait, TimeUnit.MILLISECONDS)) {
                log.warn("Worker pool did not finish in {}ms", wait);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    static String wire(FailureReason reason) {
        return reason == null ? null : reason.name().toLowerCase(Locale.ROOT);
    }
}
