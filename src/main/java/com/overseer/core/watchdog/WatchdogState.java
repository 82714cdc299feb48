package com.overseer.core.watchdog;

import com.overseer.core.model.Indicator;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Liveness bookkeeping for one running task. Mutated only by its {@link ProgressWatchdog}.
 */
public class WatchdogState {

    private final String taskId;
    private final Map<Indicator, Instant> lastSignalAt = new EnumMap<>(Indicator.class);
    private Instant lastSampleAt;
    private Instant lastProgressAt;
    private Instant stuckSince;

    public WatchdogState(String taskId, Instant startedAt) {
        this.taskId = taskId;
        this.lastSampleAt = startedAt;
        this.lastProgressAt = startedAt;
    }

    public String taskId() { return taskId; }
    public Instant lastSampleAt() { return lastSampleAt; }
    public Instant lastProgressAt() { return lastProgressAt; }
    public Optional<Instant> stuckSince() { return Optional.ofNullable(stuckSince); }

    public Map<Indicator, Instant> lastSignalAt() {
        return Collections.unmodifiableMap(lastSignalAt);
    }

    void recordSignal(Indicator indicator, Instant at) {
        lastSignalAt.put(indicator, at);
    }

    void recordSample(Instant at) {
        lastSampleAt = at;
    }

    void recordProgress(Instant at) {
        lastProgressAt = at;
    }

    void markStuck(Instant at) {
        stuckSince = at;
    }

    void clearStuck() {
        stuckSince = null;
    }
}
