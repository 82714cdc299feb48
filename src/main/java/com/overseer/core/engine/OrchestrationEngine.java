package com.overseer.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.overseer.core.OverseerException;
import com.overseer.core.config.ConfigException;
import com.overseer.core.config.OverseerProperties;
import com.overseer.core.config.RunConfig;
import com.overseer.core.config.RunConfigLoader;
import com.overseer.core.events.EventLog;
import com.overseer.core.events.EventType;
import com.overseer.core.events.LogEvent;
import com.overseer.core.graph.TaskDefaults;
import com.overseer.core.graph.TaskGraph;
import com.overseer.core.graph.TaskGraphBuilder;
import com.overseer.core.health.PreflightChecker;
import com.overseer.core.lock.PhaseLockManager;
import com.overseer.core.logging.MdcContext;
import com.overseer.core.metrics.OverseerMetrics;
import com.overseer.core.model.Phase;
import com.overseer.core.model.PhaseLock;
import com.overseer.core.model.Task;
import com.overseer.core.model.TaskStatus;
import com.overseer.core.scheduler.ReadySetCalculator;
import com.overseer.core.summary.RunSummary;
import com.overseer.core.summary.RunSummaryGenerator;
import com.overseer.supervisor.ProcessSupervisor;
import com.overseer.workspace.GitCommandException;
import com.overseer.workspace.GitWorkspaceManager;
import com.overseer.workspace.WorkspaceAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Entry point for one orchestration run, bridging the CLI to the {@link Conductor}.
 *
 * <p>A run goes through:
 * <ol>
 *   <li>planning: load the task file, build the graph, select the requested phases</li>
 *   <li>pre-flight checks (also for dry runs)</li>
 *   <li>phase locks, then the event stream with {@code run_started}</li>
 *   <li>the coordinating loop until every scheduled task is terminal</li>
 *   <li>{@code run_finished}, the summary report, and lock release</li>
 * </ol>
 *
 * Nothing is locked or written before pre-flight has passed.
 */
@Service
public class OrchestrationEngine {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationEngine.class);
    private static final DateTimeFormatter RUN_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final RunConfigLoader loader;
    private final TaskGraphBuilder graphBuilder;
    private final ReadySetCalculator readySet;
    private final PreflightChecker preflight;
    private final ProcessSupervisor supervisor;
    private final GitWorkspaceManager git;
    private final RunSummaryGenerator summaries;
    private final OverseerMetrics metrics;
    private final OverseerProperties properties;
    private final Clock clock;
    private final ObjectMapper mapper = EventLog.newObjectMapper();

    public OrchestrationEngine(RunConfigLoader loader, TaskGraphBuilder graphBuilder, ReadySetCalculator readySet,
                               PreflightChecker preflight, ProcessSupervisor supervisor, GitWorkspaceManager git,
                               RunSummaryGenerator summaries, OverseerMetrics metrics,
                               OverseerProperties properties, Clock clock) {
        this.loader = loader;
        this.graphBuilder = graphBuilder;
        this.readySet = readySet;
        this.preflight = preflight;
        this.supervisor = supervisor;
        this.git = git;
        this.summaries = summaries;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Loads and validates a run without side effects.
     *
     * @throws ConfigException for unreadable or invalid configuration and failed pre-flight checks
     * @throws com.overseer.core.graph.DependencyCycleException when the graph has a cycle
     */
    public RunPlan plan(RunRequest request) {
        if (request.phases().isEmpty()) {
            throw new ConfigException("At least one phase must be requested");
        }
        RunConfig config = loader.load(request.configFile());
        RunPaths paths = RunPaths.resolve(config);
        String runId = generateRunId();

        TaskDefaults defaults = TaskDefaults.from(properties, paths.projectRoot(), paths.logsDir(),
                config.baseRef(), runId, supervisor.backendNames());
        TaskGraph graph = graphBuilder.build(config, defaults);
        List<Task> selected = graph.inPhases(request.phaseSet());
        List<Task> scheduled = readySet.scheduled(selected, request.includeManual());
        List<String> excluded = selected.stream()
                .filter(t -> !scheduled.contains(t))
                .map(Task::id)
                .toList();

        preflight.verify(new PreflightChecker.Request(paths.projectRoot(), paths.logsDir(), graph, selected,
                request.phaseSet(), properties.isRunnerNoop()));
        log.info("Planned run {}: {} task(s) in phase(s) {}, {} manual task(s) excluded", runId, scheduled.size(),
                names(request.phases()), excluded.size());
        return new RunPlan(runId, paths, config, graph, request.phases(), selected, scheduled, excluded);
    }

    /**
     * Plans and executes a run.
     *
     * @throws ConfigException                                 when planning or pre-flight fails
     * @throws com.overseer.core.lock.PhaseLockHeldException when a privileged phase is already running
     */
    public RunResult run(RunRequest request) {
        RunPlan plan = plan(request);
        if (request.dryRun()) {
            var statuses = new LinkedHashMap<String, TaskStatus>();
            plan.scheduled().forEach(t -> statuses.put(t.id(), TaskStatus.PENDING));
            return new RunResult(plan.runId(), RunResult.PLANNED, statuses, null, null, null,
                    metrics.digest(), plan.levels(), plan.excluded());
        }
        return execute(plan, request.includeManual());
    }

    private RunResult execute(RunPlan plan, boolean includeManual) {
        RunPaths paths = plan.paths();
        String runId = plan.runId();
        var locks = new PhaseLockManager(paths.logsDir(), properties.getLock(), mapper, clock);
        List<Phase> locked = locks.acquireAll(plan.phaseSet(), runId);

        MdcContext.setRun(runId, names(plan.phases()));
        Instant startedAt = clock.instant();
        EventLog events = new EventLog(paths.logsDir().resolve(properties.getEvents().getFileName()), runId,
                mapper, properties.getEvents().isFsync(), clock);
        Conductor conductor = null;
        Thread shutdownHook = null;
        RunState state = null;
        String error = null;
        Path summaryFile = null;
        RunSummary summary = null;
        try {
            for (Phase phase : locked) {
                events.append(null, EventType.PHASE_LOCK_ACQUIRED, Map.of("phase", phase.wireName(),
                        "lock_file", locks.lockFile(phase).toString()));
            }
            events.append(null, EventType.RUN_STARTED, runStartedPayload(plan));

            var allocator = new WorkspaceAllocator(paths.projectRoot(), git,
                    properties.getWorkspace().isSnapshotOnRelease(), clock, metrics);
            var context = new RunContext(runId, plan.phases(), plan.graph(), plan.selected(), plan.scheduled(),
                    includeManual, paths.logsDir(), events);
            conductor = new Conductor(context, allocator, supervisor, readySet, metrics, properties, clock);
            shutdownHook = installShutdownHook(conductor);

            state = conductor.run();
            error = conductor.failure().orElse(null);
        } catch (OverseerException e) {
            log.error("Run {} failed: {}", runId, e.getMessage(), e);
            error = e.getMessage();
        } finally {
            removeShutdownHook(shutdownHook);
            String status = runStatus(state, error);
            try {
                finishRun(events, state, status, error, startedAt);
                summary = summaries.reduce(runId, events.events());
                summaryFile = summaries.write(summary, paths.summaryDir(), clock.instant());
                events.append(null, EventType.SUMMARY_WRITTEN, Map.of("path", summaryFile.toString()));
            } catch (OverseerException e) {
                log.error("Cannot complete the record of run {}: {}", runId, e.getMessage(), e);
            } finally {
                for (Phase phase : locked) {
                    releaseLock(locks, events, phase, runId);
                }
                events.close();
                metrics.recordRunResult(status);
                MdcContext.clear();
            }
        }

        var statuses = new LinkedHashMap<String, TaskStatus>();
        if (state != null) {
            statuses.putAll(state.statuses());
        }
        return new RunResult(runId, runStatus(state, error), statuses, summary, summaryFile, events.file(),
                metrics.digest(), plan.levels(), plan.excluded());
    }

    private Map<String, Object> runStartedPayload(RunPlan plan) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("phases", plan.phases().stream().map(Phase::wireName).toList());
        payload.put("tasks", plan.scheduled().stream().map(Task::id).toList());
        payload.put("excluded", plan.excluded());
        payload.put("project_root", plan.paths().projectRoot().toString());
        payload.put("config", plan.paths().configFile().toString());
        payload.put("head_commit", headCommit(plan.paths().projectRoot()));
        return payload;
    }

    private String headCommit(Path projectRoot) {
        try {
            return git.resolveCommit(projectRoot, "HEAD");
        } catch (GitCommandException e) {
            log.warn("Cannot resolve HEAD of {}: {}", projectRoot, e.getMessage());
            return null;
        }
    }

    private void finishRun(EventLog events, RunState state, String status, String error, Instant startedAt) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", status);
        payload.put("duration_s", Duration.between(startedAt, clock.instant()).toSeconds());
        if (state != null) {
            var counts = new EnumMap<TaskStatus, Long>(TaskStatus.class);
            for (TaskStatus s : TaskStatus.values()) {
                long n = state.count(s);
                if (n > 0) {
                    counts.put(s, n);
                }
            }
            payload.put("counts", counts.entrySet().stream().collect(Collectors.toMap(
                    e -> e.getKey().name().toLowerCase(Locale.ROOT), Map.Entry::getValue,
                    (a, b) -> a, LinkedHashMap::new)));
        }
        if (error != null) {
            payload.put("error", error);
        }
        events.append(null, EventType.RUN_FINISHED, payload);
        log.info("Run {} {}", events.runId(), status);
    }

    private void releaseLock(PhaseLockManager locks, EventLog events, Phase phase, String runId) {
        try {
            if (locks.release(phase, runId)) {
                events.append(null, EventType.PHASE_LOCK_RELEASED, Map.of("phase", phase.wireName()));
            }
        } catch (OverseerException e) {
            log.error("Cannot release {} phase lock: {}", phase.wireName(), e.getMessage(), e);
        }
    }

    static String runStatus(RunState state, String error) {
        if (state == null) {
            return RunResult.ABORTED;
        }
        if (error != null) {
            return RunResult.ABORTED;
        }
        return state.count(TaskStatus.SUCCEEDED) == state.size() ? RunResult.SUCCEEDED : RunResult.FAILED;
    }

    private Thread installShutdownHook(Conductor conductor) {
        Duration wait = properties.getSupervisor().getTerminateGrace().multipliedBy(3).plusSeconds(30);
        Thread hook = new Thread(() -> {
            log.warn("Shutdown requested, stopping workers and releasing workspaces");
            conductor.requestAbort("interrupted");
            try {
                if (!conductor.awaitFinished(wait)) {
                    log.error("Run did not stop within {}s", wait.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "overseer-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }

    private void removeShutdownHook(Thread hook) {
        if (hook == null) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM is shutting down, keeping the shutdown hook");
        }
    }

    // ── Inspection ───────────────────────────────────────────────────────

    /** Resolves the directories a task file points at. */
    public RunPaths paths(Path configFile) {
        return RunPaths.resolve(loader.load(configFile));
    }

    /**
     * Reduces the event stream of a run, finished or still in progress.
     *
     * @param runId the run, or null for the latest one in the stream
     * @return empty when the stream holds no such run
     */
    public Optional<RunSummary> status(Path configFile, String runId) {
        Path eventsFile = paths(configFile).logsDir().resolve(properties.getEvents().getFileName());
        if (!Files.isRegularFile(eventsFile)) {
            return Optional.empty();
        }
        String target = runId;
        if (target == null) {
            List<String> ids = EventLog.runIds(eventsFile, mapper);
            if (ids.isEmpty()) {
                return Optional.empty();
            }
            target = ids.get(ids.size() - 1);
        }
        List<LogEvent> records = EventLog.readRun(eventsFile, mapper, target);
        if (records.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(summaries.reduce(target, records));
    }

    /** Rewrites the summary report of a run from its event stream. */
    public Optional<Path> regenerateSummary(Path configFile, String runId) {
        RunPaths paths = paths(configFile);
        return status(configFile, runId).map(s -> summaries.write(s, paths.summaryDir(), clock.instant()));
    }

    /**
     * Removes a phase lock regardless of holder.
     *
     * @return the holder recorded in the lock, empty when there was no readable lock
     */
    public Optional<PhaseLock> unlock(Path configFile, Phase phase) {
        var locks = new PhaseLockManager(paths(configFile).logsDir(), properties.getLock(), mapper, clock);
        Optional<PhaseLock> holder = locks.holder(phase);
        if (locks.forceRelease(phase)) {
            log.warn("Removed {} phase lock held by {}", phase.wireName(),
                    holder.map(PhaseLock::holderRunId).orElse("unknown run"));
        }
        return holder;
    }

    /** Lock files currently present, keyed by phase. */
    public Map<Phase, Optional<PhaseLock>> heldLocks(Path configFile) {
        var locks = new PhaseLockManager(paths(configFile).logsDir(), properties.getLock(), mapper, clock);
        var held = new EnumMap<Phase, Optional<PhaseLock>>(Phase.class);
        for (Phase phase : Phase.values()) {
            if (Files.exists(locks.lockFile(phase))) {
                held.put(phase, locks.holder(phase));
            }
        }
        return held;
    }

    /**
     * Generates a run id in the format {@code yyyyMMddTHHmmss-NN}.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet() % 100;
        return RUN_ID_FORMAT.format(clock.instant()) + String.format("-%02d", count);
    }

    private static String names(List<Phase> phases) {
        var names = new ArrayList<String>();
        for (Phase phase : phases) {
            names.add(phase.wireName());
        }
        return String.join(",", names);
    }
}
