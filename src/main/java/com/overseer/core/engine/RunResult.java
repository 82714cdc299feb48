package com.overseer.core.engine;

import com.overseer.core.model.TaskStatus;
import com.overseer.core.summary.RunSummary;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link OrchestrationEngine#run}.
 *
 * @param runId        the run
 * @param status       {@code succeeded}, {@code failed}, {@code aborted} or {@code planned} for dry runs
 * @param statuses     terminal status per scheduled task
 * @param summary      reduced event log, null for dry runs
 * @param summaryFile  written report, null for dry runs
 * @param eventsFile   the event stream, null for dry runs
 * @param metrics      short metrics digest
 * @param levels       dependency levels of the scheduled tasks
 * @param excluded     manual tasks left out
 */
public record RunResult(
    String runId,
    String status,
    Map<String, TaskStatus> statuses,
    RunSummary summary,
    Path summaryFile,
    Path eventsFile,
    Map<String, String> metrics,
    List<List<String>> levels,
    List<String> excluded
) {
    public static final String SUCCEEDED = "succeeded";
    public static final String FAILED = "failed";
    public static final String ABORTED = "aborted";
    public static final String PLANNED = "planned";

    public boolean dryRun() {
        return PLANNED.equals(status);
    }

    public boolean succeeded() {
        return SUCCEEDED.equals(status) || PLANNED.equals(status);
    }
}
