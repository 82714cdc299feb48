package com.overseer.core.watchdog;

import com.overseer.core.model.Indicator;
import com.overseer.core.model.Liveness;
import com.overseer.core.model.WatchdogSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether one running task is making progress.
 *
 * <p>Each sample evaluates every enabled indicator. The task is <b>active</b> when at least one
 * signals, which moves {@code last_progress_at} to the sample time; otherwise it is
 * <b>uncertain</b> until {@code stuck_threshold} has passed since the last progress, and
 * <b>stuck</b> after that. A degenerate output tail cancels the log-growth signal of the same
 * sample. Entering stuck is reported once per episode; the next active sample ends the episode.
 *
 * <p>Not thread-safe: a watchdog is sampled by one monitoring task at a time.
 */
public class ProgressWatchdog {

    private static final Logger log = LoggerFactory.getLogger(ProgressWatchdog.class);

    private final String taskId;
    private final int attempt;
    private final SampleContextFactory contexts;
    private final WatchdogSettings settings;
    private final List<ProgressIndicator> indicators;
    private final WatchdogState state;

    /**
     * Supplies the per-sample view of the task.
     */
    @FunctionalInterface
    public interface SampleContextFactory {
        SampleContext create(Instant windowStart, Instant now);
    }

    public ProgressWatchdog(String taskId, int attempt, Instant startedAt, WatchdogSettings settings,
                            List<ProgressIndicator> indicators, SampleContextFactory contexts) {
        this.taskId = taskId;
        this.attempt = attempt;
        this.settings = settings;
        this.contexts = contexts;
        this.indicators = indicators.stream()
                .filter(i -> settings.indicators().contains(i.kind()))
                .toList();
        this.state = new WatchdogState(taskId, startedAt);
    }

    public WatchdogState state() {
        return state;
    }

    public WatchdogSettings settings() {
        return settings;
    }

    public WatchdogVerdict sample(Instant now) {
        var context = contexts.create(state.lastSampleAt(), now);
        var signals = new ArrayList<String>();
        boolean degenerate = false;
        boolean logGrowth = false;

        for (ProgressIndicator indicator : indicators) {
            IndicatorReading reading;
            try {
                reading = indicator.sample(context);
            } catch (RuntimeException e) {
                log.warn("Indicator {} failed for {}: {}", indicator.kind().wireName(), taskId, e.getMessage());
                continue;
            }
            degenerate |= reading.degenerate();
            if (reading.signaled()) {
                if (indicator.kind() == Indicator.LOG_GROWTH) {
                    logGrowth = true;
                }
                state.recordSignal(indicator.kind(), now);
                signals.add(indicator.kind().wireName() + ": " + reading.detail());
            }
        }
        if (degenerate && logGrowth) {
            signals.removeIf(s -> s.startsWith(Indicator.LOG_GROWTH.wireName() + ":"));
            log.debug("{}: degenerate output tail, log growth discounted", taskId);
        }
        state.recordSample(now);

        boolean newlyStuck = false;
        boolean recovered = false;
        Liveness liveness;
        if (!signals.isEmpty()) {
            liveness = Liveness.ACTIVE;
            state.recordProgress(now);
            if (state.stuckSince().isPresent()) {
                state.clearStuck();
                recovered = true;
            }
        } else if (Duration.between(state.lastProgressAt(), now).compareTo(settings.stuckThreshold()) >= 0) {
            liveness = Liveness.STUCK;
            if (state.stuckSince().isEmpty()) {
                state.markStuck(now);
                newlyStuck = true;
            }
        } else {
            liveness = Liveness.UNCERTAIN;
        }

        var verdict = new WatchdogVerdict(taskId, attempt, liveness, now,
                Duration.between(state.lastProgressAt(), now), List.copyOf(signals), newlyStuck, recovered);
        log.debug("{} attempt {}: {} ({} since progress) {}", taskId, attempt, liveness,
                verdict.sinceProgress(), signals);
        return verdict;
    }
}
