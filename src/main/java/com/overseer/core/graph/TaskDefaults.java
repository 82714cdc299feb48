package com.overseer.core.graph;

import com.overseer.core.config.OverseerProperties;
import com.overseer.core.model.EscalationSettings;
import com.overseer.core.model.WatchdogSettings;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;

/**
 * Everything the graph builder needs besides the task entries themselves.
 *
 * @param projectRoot       relative task paths resolve against this directory
 * @param logsDir           default home of per-task logs
 * @param baseRef           base reference for tasks that do not set one
 * @param runId             substituted for {@code {run_id}} in path templates
 * @param watchdog          watchdog settings for tasks without a {@code watchdog} block
 * @param escalation        escalation settings for tasks without an {@code escalation} block
 * @param intervalOverride  replaces every task's check interval when non-null
 * @param runnerNoop        launch every task with the no-op backend
 * @param backends          names of the available worker backends
 */
public record TaskDefaults(
    Path projectRoot,
    Path logsDir,
    String baseRef,
    String runId,
    WatchdogSettings watchdog,
    EscalationSettings escalation,
    Duration intervalOverride,
    boolean runnerNoop,
    Set<String> backends
) {
    public TaskDefaults {
        backends = Set.copyOf(backends);
    }

    public static TaskDefaults from(OverseerProperties properties, Path projectRoot, Path logsDir,
                                    String baseRef, String runId, Set<String> backends) {
        var wd = properties.getWatchdog();
        var esc = properties.getEscalation();
        return new TaskDefaults(
                projectRoot,
                logsDir,
                baseRef != null ? baseRef : properties.getBaseRef(),
                runId,
                new WatchdogSettings(wd.getCheckInterval(), wd.getStuckThreshold(),
                        wd.getIndicators(), wd.getLogGrowthMinBytes()),
                new EscalationSettings(esc.getStrategies(), esc.getMaxRetries(),
                        esc.getNotifyGrace(), esc.getInterruptGrace(), null, null),
                wd.getIntervalOverride(),
                properties.isRunnerNoop(),
                backends);
    }
}
