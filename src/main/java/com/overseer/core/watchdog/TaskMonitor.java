package com.overseer.core.watchdog;

import com.overseer.core.config.OverseerProperties;
import com.overseer.core.events.EventLog;
import com.overseer.core.events.EventType;
import com.overseer.core.events.ProtocolLog;
import com.overseer.core.logging.MdcContext;
import com.overseer.core.metrics.OverseerMetrics;
import com.overseer.core.model.Indicator;
import com.overseer.core.model.Task;
import com.overseer.core.model.WorkspaceAllocation;
import com.overseer.workspace.GitWorkspaceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs one periodic monitoring job per running task on a shared scheduled executor.
 *
 * <p>Each job samples the task's {@link ProgressWatchdog}, appends {@code stuck_task_detected}
 * and {@code task_recovered} records to the event log, and posts every verdict to the
 * coordinator's inbox. Jobs never touch run state directly.
 */
public class TaskMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskMonitor.class);

    private final ScheduledExecutorService scheduler;
    private final EventLog events;
    private final ProtocolLog alerts;
    private final OverseerMetrics metrics;
    private final GitWorkspaceManager git;
    private final OverseerProperties.Watchdog properties;
    private final Clock clock;
    private final Consumer<WatchdogVerdict> inbox;

    private final Map<String, Watch> watches = new ConcurrentHashMap<>();

    static final class Watch {
        final ProgressWatchdog watchdog;
        volatile ScheduledFuture<?> future;
        volatile boolean stopped;

        Watch(ProgressWatchdog watchdog) {
            this.watchdog = watchdog;
        }

        void stop() {
            stopped = true;
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }

    public TaskMonitor(int threads, EventLog events, ProtocolLog alerts, OverseerMetrics metrics,
                       GitWorkspaceManager git, OverseerProperties.Watchdog properties, Clock clock,
                       Consumer<WatchdogVerdict> inbox) {
        this(newScheduler(threads), events, alerts, metrics, git, properties, clock, inbox);
    }

    TaskMonitor(ScheduledExecutorService scheduler, EventLog events, ProtocolLog alerts,
                OverseerMetrics metrics, GitWorkspaceManager git, OverseerProperties.Watchdog properties,
                Clock clock, Consumer<WatchdogVerdict> inbox) {
        this.scheduler = scheduler;
        this.events = events;
        this.alerts = alerts;
        this.metrics = metrics;
        this.git = git;
        this.properties = properties;
        this.clock = clock;
        this.inbox = inbox;
    }

    private static ScheduledExecutorService newScheduler(int threads) {
        var counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "watchdog-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts monitoring one launch attempt of a task. An existing watch of the same task is
     * replaced, so a restarted worker always starts with a fresh watchdog.
     */
    public ProgressWatchdog watch(Task task, WorkspaceAllocation allocation, int attempt, Instant startedAt) {
        unwatch(task.id());
        var watchdog = newWatchdog(task, allocation, attempt, startedAt);
        long intervalMs = Math.max(1L, task.watchdog().checkInterval().toMillis());
        var watch = new Watch(watchdog);
        watches.put(task.id(), watch);
        watch.future = scheduler.scheduleWithFixedDelay(
                () -> sampleOnce(task, watch), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        if (watch.stopped) {
            watch.future.cancel(false);
        }
        log.debug("Watching {} attempt {} every {}ms", task.id(), attempt, intervalMs);
        return watchdog;
    }

    /** Stops monitoring a task. Safe to call for tasks that are not watched. */
    public void unwatch(String taskId) {
        Watch watch = watches.remove(taskId);
        if (watch != null) {
            watch.stop();
        }
    }

    ProgressWatchdog newWatchdog(Task task, WorkspaceAllocation allocation, int attempt, Instant startedAt) {
        var settings = task.watchdog();
        List<ProgressIndicator> indicators = new ArrayList<>();
        if (settings.indicators().contains(Indicator.FILESYSTEM)) {
            indicators.add(new FilesystemActivityIndicator());
        }
        if (settings.indicators().contains(Indicator.COMMITS)) {
            indicators.add(new CommitActivityIndicator(git));
        }
        if (settings.indicators().contains(Indicator.LOG_GROWTH)) {
            indicators.add(new LogGrowthIndicator(task.logPath(), settings.logGrowthMinBytes()));
        }
        if (settings.indicators().contains(Indicator.OUTPUT_PATTERN)) {
            indicators.add(new OutputPatternIndicator(task.logPath(),
                    properties.getPatternWindowLines(), properties.getPatternMinDistinct()));
        }
        return new ProgressWatchdog(task.id(), attempt, startedAt, settings, indicators,
                (windowStart, now) -> new SampleContext(task.id(), allocation.path(), allocation.branch(),
                        task.logPath(), windowStart, now));
    }

    /**
     * Takes one sample and reports it. Exceptions are logged here so that a failing sample does
     * not cancel the periodic job.
     */
    void sampleOnce(Task task, Watch watch) {
        if (watch == null || watch.stopped) {
            return;
        }
        MdcContext.setTask(events.runId(), task.id());
        try {
            WatchdogVerdict verdict = watch.watchdog.sample(clock.instant());
            if (watch.stopped) {
                return;
            }
            report(task, verdict);
            inbox.accept(verdict);
        } catch (RuntimeException e) {
            log.error("Watchdog sample for {} failed: {}", task.id(), e.getMessage(), e);
        } finally {
            MdcContext.clearTask();
        }
    }

    void report(Task task, WatchdogVerdict verdict) {
        if (verdict.newlyStuck()) {
            var payload = new LinkedHashMap<String, Object>();
            payload.put("attempt", verdict.attempt());
            payload.put("since_progress_s", verdict.sinceProgress().toSeconds());
            payload.put("stuck_threshold_s", task.watchdog().stuckThreshold().toSeconds());
            events.append(task.id(), EventType.STUCK_TASK_DETECTED, payload);
            metrics.recordStuckDetected();
            alerts.append("[STUCK] task=" + task.id() + " attempt=" + verdict.attempt()
                    + " no progress for " + verdict.sinceProgress().toSeconds() + "s");
            log.warn("{} is stuck: no progress for {}s", task.id(), verdict.sinceProgress().toSeconds());
        } else if (verdict.recovered()) {
            events.append(task.id(), EventType.TASK_RECOVERED,
                    Map.of("attempt", verdict.attempt(), "signals", verdict.signals()));
            metrics.recordRecovered();
            log.info("{} recovered: {}", task.id(), verdict.signals());
        }
    }

    @Override
    public void close() {
        for (String taskId : List.copyOf(watches.keySet())) {
            unwatch(taskId);
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
