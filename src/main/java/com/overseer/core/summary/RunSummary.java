package com.overseer.core.summary;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Reduction of one run's event log: one row per task plus run-level facts.
 *
 * @param runId      the run
 * @param phases     requested phases, in request order
 * @param status     {@code succeeded}, {@code failed}, {@code aborted}, or {@code in_progress}
 *                   while no {@code run_finished} record exists
 * @param startedAt  time of {@code run_started}, null if missing
 * @param finishedAt time of {@code run_finished}, null while running
 * @param error      run-level error recorded at the end, may be null
 * @param tasks      per-task rows in declaration order
 */
public record RunSummary(
    String runId,
    List<String> phases,
    String status,
    Instant startedAt,
    Instant finishedAt,
    String error,
    List<TaskRow> tasks
) {
    public RunSummary {
        phases = List.copyOf(phases);
        tasks = List.copyOf(tasks);
    }

    /**
     * @param taskId      task id
     * @param status      last known status ({@code pending} through {@code blocked})
     * @param duration    first start to terminal record, null if it never started
     * @param escalations strategies applied, in order
     * @param reason      failure or block reason, null on success
     */
    public record TaskRow(
        String taskId,
        String status,
        Duration duration,
        List<String> escalations,
        String reason
    ) {
        public TaskRow {
            escalations = List.copyOf(escalations);
        }
    }

    public boolean isFinished() {
        return finishedAt != null;
    }

    public long count(String taskStatus) {
        return tasks.stream().filter(t -> t.status().equals(taskStatus)).count();
    }

    public Duration elapsed(Instant now) {
        if (startedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt != null ? finishedAt : now);
    }
}
