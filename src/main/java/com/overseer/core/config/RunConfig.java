package com.overseer.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Declarative run configuration as read from the task file (JSON or YAML).
 *
 * <p>Values are kept as written; validation and defaulting happen in
 * {@link com.overseer.core.graph.TaskGraphBuilder}.
 *
 * @param source      file the configuration was read from (not part of the file itself)
 * @param projectRoot git repository the workspaces branch from, relative to the config file
 * @param logsDir     directory for worker logs, the event stream and lock files, relative to the project root
 * @param summaryDir  directory for run summary reports, relative to the project root
 * @param baseRef     default reference new task branches start from
 * @param runners     named worker command templates
 * @param tasks       task entries in declaration order
 */
public record RunConfig(
    Path source,
    @JsonProperty("project_root") String projectRoot,
    @JsonProperty("logs_dir") String logsDir,
    @JsonProperty("summary_dir") String summaryDir,
    @JsonProperty("base_ref") String baseRef,
    @JsonProperty("runners") Map<String, RunnerEntry> runners,
    @JsonProperty("tasks") List<TaskEntry> tasks
) {

    public RunConfig {
        runners = runners == null ? Map.of() : Map.copyOf(runners);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public RunConfig withSource(Path path) {
        return new RunConfig(path, projectRoot, logsDir, summaryDir, baseRef, runners, tasks);
    }

    public record RunnerEntry(
        @JsonProperty("command") String command,
        @JsonProperty("backend") String backend
    ) {}

    public record TaskEntry(
        @JsonProperty("id") String id,
        @JsonProperty("phase") String phase,
        @JsonProperty("branch") String branch,
        @JsonProperty("workspace_path") String workspacePath,
        @JsonProperty("base_ref") String baseRef,
        @JsonProperty("command") String command,
        @JsonProperty("runner") String runner,
        @JsonProperty("prompt") String prompt,
        @JsonProperty("log") String log,
        @JsonProperty("depends_on") List<String> dependsOn,
        @JsonProperty("manual") Boolean manual,
        @JsonProperty("watchdog") WatchdogEntry watchdog,
        @JsonProperty("escalation") EscalationEntry escalation
    ) {}

    public record WatchdogEntry(
        @JsonProperty("check_interval") String checkInterval,
        @JsonProperty("stuck_threshold") String stuckThreshold,
        @JsonProperty("indicators") List<String> indicators,
        @JsonProperty("log_growth_min_bytes") Long logGrowthMinBytes
    ) {}

    public record EscalationEntry(
        @JsonProperty("strategies") List<String> strategies,
        @JsonProperty("max_retries") Integer maxRetries,
        @JsonProperty("notify_grace") String notifyGrace,
        @JsonProperty("interrupt_grace") String interruptGrace,
        @JsonProperty("alternate_runner") String alternateRunner,
        @JsonProperty("simplified_prompt") String simplifiedPrompt
    ) {}
}
