package com.overseer.core.metrics;

import com.overseer.core.model.EscalationStrategy;
import com.overseer.core.model.TaskStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Centralised Micrometer metrics for orchestration runs.
 */
@Service
public class OverseerMetrics {

    static final String TASK_DURATION = "overseer.task.duration";
    static final String STUCK_DETECTIONS = "overseer.watchdog.stuck_detections";
    static final String RECOVERIES = "overseer.watchdog.recoveries";
    static final String ESCALATIONS = "overseer.escalations.total";
    static final String WORKTREE_OPERATIONS = "overseer.worktree.operations";
    static final String PROCESS_LAUNCHES = "overseer.process.launches";
    static final String RUNS = "overseer.runs.total";

    private final MeterRegistry registry;

    public OverseerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskFinished(TaskStatus status, Duration duration) {
        Timer.builder(TASK_DURATION)
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .record(duration);
    }

    public void recordStuckDetected() {
        Counter.builder(STUCK_DETECTIONS)
                .description("Stuck episodes detected by the progress watchdog")
                .register(registry)
                .increment();
    }

    public void recordRecovered() {
        Counter.builder(RECOVERIES)
                .description("Stuck episodes that ended with renewed activity")
                .register(registry)
                .increment();
    }

    public void recordEscalation(EscalationStrategy strategy) {
        Counter.builder(ESCALATIONS)
                .tag("strategy", strategy.wireName())
                .register(registry)
                .increment();
    }

    /**
     * Records worktree operations for monitoring workspace health.
     *
     * @param operation "allocate" or "release"
     * @param success   whether the operation succeeded
     */
    public void recordWorktreeOperation(String operation, boolean success) {
        Counter.builder(WORKTREE_OPERATIONS)
                .description("Git worktree lifecycle operations")
                .tag("operation", operation)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordProcessLaunch(String backend, boolean success) {
        Counter.builder(PROCESS_LAUNCHES)
                .tag("backend", backend)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordRunResult(String status) {
        Counter.builder(RUNS)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Short human-readable totals for the end-of-run console output, e.g.
     * {@code {tasks.succeeded=3, stuck=1, escalations=2}}.
     */
    public Map<String, String> digest() {
        var digest = new LinkedHashMap<String, String>();
        for (TaskStatus status : TaskStatus.values()) {
            var timer = registry.find(TASK_DURATION).tag("status", status.name().toLowerCase(Locale.ROOT)).timer();
            if (timer != null && timer.count() > 0) {
                digest.put("tasks." + status.name().toLowerCase(Locale.ROOT),
                        timer.count() + " (avg " + Math.round(timer.mean(TimeUnit.SECONDS)) + "s)");
            }
        }
        digest.put("stuck", String.valueOf(count(STUCK_DETECTIONS)));
        digest.put("recovered", String.valueOf(count(RECOVERIES)));
        digest.put("escalations", String.valueOf(count(ESCALATIONS)));
        digest.put("worktree.failures", String.valueOf(
                registry.find(WORKTREE_OPERATIONS).tag("success", "false").counters().stream()
                        .mapToLong(c -> (long) c.count()).sum()));
        return digest;
    }

    private long count(String name) {
        return registry.find(name).counters().stream()
                .mapToLong(c -> (long) c.count())
                .sum();
    }
}
