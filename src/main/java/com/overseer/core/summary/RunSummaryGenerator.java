package com.overseer.core.summary;

import com.overseer.core.OverseerException;
import com.overseer.core.events.EventType;
import com.overseer.core.events.LogEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the event records of one run into a {@link RunSummary} and a markdown report.
 *
 * <p>The reduction only reads the event log, so it works for finished runs, aborted runs and
 * runs still in progress alike.
 */
@Service
public class RunSummaryGenerator {

    private static final Logger log = LoggerFactory.getLogger(RunSummaryGenerator.class);

    public static final String FILE_PREFIX = "orchestrator-run-summary-";

    private static final class Row {
        final String taskId;
        String status = "pending";
        Instant firstStart;
        Instant end;
        String reason;
        final List<String> escalations = new ArrayList<>();

        Row(String taskId) {
            this.taskId = taskId;
        }

        RunSummary.TaskRow toRow() {
            Duration duration = firstStart == null || end == null ? null : Duration.between(firstStart, end);
            return new RunSummary.TaskRow(taskId, status, duration, escalations, reason);
        }
    }

    /**
     * Reduces the records of one run. Records of other runs must already be filtered out.
     */
    public RunSummary reduce(String runId, List<LogEvent> events) {
        var rows = new LinkedHashMap<String, Row>();
        var phases = new ArrayList<String>();
        Instant startedAt = null;
        Instant finishedAt = null;
        String runStatus = "in_progress";
        String error = null;

        for (LogEvent event : events) {
            EventType type = EventType.fromWire(event.eventType()).orElse(null);
            if (type == null) {
                continue;
            }
            switch (type) {
                case RUN_STARTED -> {
                    startedAt = event.timestamp();
                    phases.addAll(strings(event.payload().get("phases")));
                    for (String id : strings(event.payload().get("tasks"))) {
                        rows.computeIfAbsent(id, Row::new);
                    }
                }
                case RUN_FINISHED -> {
                    finishedAt = event.timestamp();
                    runStatus = event.text("status") != null ? event.text("status") : "finished";
                    error = event.text("error");
                }
                case TASK_READY -> row(rows, event).status = "ready";
                case TASK_STARTED -> {
                    Row row = row(rows, event);
                    row.status = "running";
                    if (row.firstStart == null) {
                        row.firstStart = event.timestamp();
                    }
                }
                case TASK_SUCCEEDED -> finish(row(rows, event), "succeeded", event, null);
                case TASK_FAILED -> finish(row(rows, event), "failed", event, describeFailure(event));
                case TASK_BLOCKED -> finish(row(rows, event), "blocked", event, describeBlock(event));
                case ESCALATION_APPLIED -> {
                    Row row = row(rows, event);
                    row.escalations.add(event.text("strategy"));
                }
                default -> {
                }
            }
        }

        var taskRows = rows.values().stream().map(Row::toRow).toList();
        return new RunSummary(runId, phases, runStatus, startedAt, finishedAt, error, taskRows);
    }

    private static Row row(Map<String, Row> rows, LogEvent event) {
        return rows.computeIfAbsent(event.taskId() == null ? "?" : event.taskId(), Row::new);
    }

    private static void finish(Row row, String status, LogEvent event, String reason) {
        row.status = status;
        row.end = event.timestamp();
        row.reason = reason;
    }

    private static String describeFailure(LogEvent event) {
        String reason = event.text("reason");
        String detail = event.text("detail");
        if (detail == null || detail.isBlank()) {
            return reason;
        }
        return reason == null ? detail : reason + ": " + detail;
    }

    private static String describeBlock(LogEvent event) {
        String reason = event.text("reason");
        List<String> causes = strings(event.payload().get("causes"));
        if (causes.isEmpty()) {
            return reason;
        }
        return (reason == null ? "blocked" : reason) + " (" + String.join(", ", causes) + ")";
    }

    private static List<String> strings(Object value) {
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(String::valueOf).toList();
        }
        if (value == null) {
            return List.of();
        }
        return List.of(String.valueOf(value));
    }

    // ── Rendering ────────────────────────────────────────────────────────

    /** {@code orchestrator-run-summary-<phases>-<run_id>.md} */
    public static String fileName(RunSummary summary) {
        String phases = summary.phases().isEmpty() ? "run" : String.join("-", summary.phases());
        return FILE_PREFIX + phases + "-" + summary.runId() + ".md";
    }

    public String renderMarkdown(RunSummary summary, Instant now) {
        var sb = new StringBuilder();
        sb.append("# Orchestrator run summary\n\n");
        sb.append("- Run: `").append(summary.runId()).append("`\n");
        sb.append("- Phases: ").append(summary.phases().isEmpty() ? "-" : String.join(", ", summary.phases())).append('\n');
        sb.append("- Status: **").append(summary.status()).append("**\n");
        if (summary.startedAt() != null) {
            sb.append("- Started: ").append(summary.startedAt()).append('\n');
        }
        if (summary.finishedAt() != null) {
            sb.append("- Finished: ").append(summary.finishedAt()).append('\n');
        }
        sb.append("- Elapsed: ").append(formatDuration(summary.elapsed(now))).append('\n');
        sb.append("- Tasks: ").append(summary.tasks().size())
                .append(" (succeeded ").append(summary.count("succeeded"))
                .append(", failed ").append(summary.count("failed"))
                .append(", blocked ").append(summary.count("blocked")).append(")\n");
        if (summary.error() != null) {
            sb.append("- Error: ").append(summary.error()).append('\n');
        }

        sb.append("\n| Task | Status | Duration | Escalations | Reason |\n");
        sb.append("|------|--------|----------|-------------|--------|\n");
        for (RunSummary.TaskRow row : summary.tasks()) {
            sb.append("| ").append(escape(row.taskId()))
                    .append(" | ").append(row.status())
                    .append(" | ").append(row.duration() == null ? "-" : formatDuration(row.duration()))
                    .append(" | ").append(row.escalations().isEmpty() ? "-" : String.join(", ", row.escalations()))
                    .append(" | ").append(row.reason() == null ? "" : escape(row.reason()))
                    .append(" |\n");
        }
        return sb.toString();
    }

    /**
     * Writes the report into {@code summaryDir}.
     *
     * @throws OverseerException when the file cannot be written
     */
    public Path write(RunSummary summary, Path summaryDir, Instant now) {
        Path target = summaryDir.resolve(fileName(summary));
        try {
            Files.createDirectories(summaryDir);
            Files.writeString(target, renderMarkdown(summary, now), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new OverseerException("Cannot write run summary " + target + ": " + e.getMessage(), e);
        }
        log.info("Run summary written to {}", target);
        return target;
    }

    public static String formatDuration(Duration duration) {
        long seconds = Math.max(0, duration.toSeconds());
        if (seconds >= 3600) {
            return String.format("%d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
        }
        return String.format("%02d:%02d", seconds / 60, seconds % 60);
    }

    private static String escape(String text) {
        return text.replace("|", "\\|").replace("\n", " ");
    }
}
