package com.overseer.core.engine;

import com.overseer.core.events.ProtocolLog;
import com.overseer.core.model.TaskStatus;
import com.overseer.core.summary.RunSummaryGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Periodic one-line progress report written to the console log and {@code protocol-status.log}.
 * A zero interval disables it.
 */
class StatusHeartbeat {

    private static final Logger log = LoggerFactory.getLogger(StatusHeartbeat.class);

    private final String phases;
    private final Duration interval;
    private final ProtocolLog statusLog;
    private final Instant startedAt;
    private Instant lastBeat;

    StatusHeartbeat(String phases, Duration interval, ProtocolLog statusLog, Instant startedAt) {
        this.phases = phases;
        this.interval = interval;
        this.statusLog = statusLog;
        this.startedAt = startedAt;
        this.lastBeat = startedAt;
    }

    boolean enabled() {
        return interval != null && !interval.isZero() && !interval.isNegative();
    }

    /** Emits a line when the interval has passed since the previous one. */
    void maybeBeat(Instant now, RunState state) {
        if (!enabled() || Duration.between(lastBeat, now).compareTo(interval) < 0) {
            return;
        }
        lastBeat = now;
        String line = format(now, state);
        log.info(line);
        statusLog.append(line);
    }

    String format(Instant now, RunState state) {
        String running = state.withStatus(TaskStatus.RUNNING).stream()
                .map(RunState.TaskState::id)
                .collect(Collectors.joining(","));
        return "[STATUS] phase=" + phases
                + " run_id=" + state.runId()
                + " running=" + (running.isEmpty() ? "-" : running)
                + " done=" + state.terminalCount() + "/" + state.size()
                + " elapsed=" + RunSummaryGenerator.formatDuration(Duration.between(startedAt, now));
    }
}
