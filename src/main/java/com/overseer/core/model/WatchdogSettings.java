package com.overseer.core.model;

import java.time.Duration;
import java.util.Set;

/**
 * Per-task watchdog configuration.
 *
 * @param checkInterval      how often the task is sampled
 * @param stuckThreshold     silence after which the task is considered stuck
 * @param indicators         enabled progress indicators
 * @param logGrowthMinBytes  minimum log growth per sample that counts as activity
 */
public record WatchdogSettings(
    Duration checkInterval,
    Duration stuckThreshold,
    Set<Indicator> indicators,
    long logGrowthMinBytes
) {
    public WatchdogSettings {
        indicators = Set.copyOf(indicators);
    }
}
