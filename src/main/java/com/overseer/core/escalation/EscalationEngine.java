package com.overseer.core.escalation;

import com.overseer.core.events.EventLog;
import com.overseer.core.events.EventType;
import com.overseer.core.metrics.OverseerMetrics;
import com.overseer.core.model.EscalationOutcome;
import com.overseer.core.model.EscalationRecord;
import com.overseer.core.model.EscalationStrategy;
import com.overseer.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Per-task recovery ladder for stuck workers.
 *
 * <p>State machine per task:
 * <pre>
 *   healthy -> stuck -> {notified | interrupted | retried | reassigned | simplified} -> healthy | failed
 * </pre>
 *
 * <p>Strategies are tried in the task's configured order. Each strategy has an attempt budget
 * ({@code max_retries} for {@code kill_and_retry}, one for the others) that is never refilled
 * within a run, and the ladder position does not move backwards when a task recovers. When no
 * strategy with budget remains the task fails with {@code escalation_exhausted}.
 *
 * <p>Timed strategies ({@code notify}, {@code interrupt}) arm a deadline; {@link #onTick}
 * escalates once it has passed without activity.
 *
 * <p>Not thread-safe. Only the coordinating loop calls into the engine.
 */
public class EscalationEngine {

    private static final Logger log = LoggerFactory.getLogger(EscalationEngine.class);

    private final EventLog events;
    private final RecoveryActions actions;
    private final OverseerMetrics metrics;
    private final Map<String, Ladder> ladders = new LinkedHashMap<>();

    private static final class Ladder {
        final Task task;
        final Map<EscalationStrategy, Integer> attempts = new EnumMap<>(EscalationStrategy.class);
        final List<EscalationRecord> records = new ArrayList<>();
        EscalationState state = EscalationState.HEALTHY;
        int position;
        Instant deadline;

        Ladder(Task task) {
            this.task = task;
        }

        int used(EscalationStrategy strategy) {
            return attempts.getOrDefault(strategy, 0);
        }

        Optional<EscalationRecord> pending() {
            if (records.isEmpty()) {
                return Optional.empty();
            }
            EscalationRecord last = records.get(records.size() - 1);
            return last.outcome() == EscalationOutcome.APPLIED ? Optional.of(last) : Optional.empty();
        }

        void replaceLast(EscalationRecord record) {
            records.set(records.size() - 1, record);
        }
    }

    public EscalationEngine(EventLog events, RecoveryActions actions, OverseerMetrics metrics) {
        this.events = events;
        this.actions = actions;
        this.metrics = metrics;
    }

    public void register(Task task) {
        ladders.putIfAbsent(task.id(), new Ladder(task));
    }

    public EscalationState state(String taskId) {
        return ladder(taskId).state;
    }

    public List<EscalationRecord> records(String taskId) {
        return List.copyOf(ladder(taskId).records);
    }

    public int attempts(String taskId, EscalationStrategy strategy) {
        return ladder(taskId).used(strategy);
    }

    /** Deadline of the current timed strategy, if one is armed. */
    public Optional<Instant> deadline(String taskId) {
        return Optional.ofNullable(ladder(taskId).deadline);
    }

    /**
     * A new stuck episode was detected. Applies the next strategy unless the task is already
     * escalating or finished.
     */
    public void onStuck(String taskId, Instant now) {
        Ladder ladder = ladder(taskId);
        if (ladder.state == EscalationState.FAILED) {
            return;
        }
        if (ladder.state == EscalationState.NOTIFIED || ladder.state == EscalationState.INTERRUPTED) {
            // the armed deadline decides
            return;
        }
        ladder.state = EscalationState.STUCK;
        applyNext(ladder, now, true);
    }

    /** The watchdog saw progress. Ends any escalation in flight. */
    public void onActivity(String taskId, Instant now) {
        Ladder ladder = ladder(taskId);
        if (ladder.state == EscalationState.HEALTHY || ladder.state == EscalationState.FAILED) {
            return;
        }
        ladder.pending().ifPresent(record -> {
            ladder.replaceLast(record.withOutcome(EscalationOutcome.RECOVERED));
            appendOutcome(ladder.task, record, EscalationOutcome.RECOVERED);
        });
        log.info("{} back to healthy (was {})", taskId, ladder.state);
        ladder.state = EscalationState.HEALTHY;
        ladder.deadline = null;
    }

    /** Escalates every task whose timed strategy ran out without activity. */
    public void onTick(Instant now) {
        for (Ladder ladder : List.copyOf(ladders.values())) {
            if (ladder.deadline != null && !now.isBefore(ladder.deadline)) {
                log.info("{}: {} grace expired without activity", ladder.task.id(), ladder.state);
                ladder.deadline = null;
                applyNext(ladder, now, true);
            }
        }
    }

    /**
     * The worker exited on its own.
     *
     * @return true when the exit was consumed by the ladder (the task was interrupted), false
     *         when the exit status should decide the task as usual
     */
    public boolean onWorkerExited(String taskId, Instant now) {
        Ladder ladder = ladder(taskId);
        if (ladder.state != EscalationState.INTERRUPTED) {
            return false;
        }
        log.info("{} exited after interrupt, escalating", taskId);
        ladder.deadline = null;
        applyNext(ladder, now, false);
        return true;
    }

    /** A restarting strategy could not launch the replacement worker. The attempt stays consumed. */
    public void onRelaunchFailed(String taskId, Instant now, String error) {
        Ladder ladder = ladder(taskId);
        if (ladder.state == EscalationState.FAILED) {
            return;
        }
        ladder.pending().ifPresent(record -> {
            ladder.replaceLast(record.withOutcome(EscalationOutcome.LAUNCH_FAILED));
            appendOutcome(ladder.task, record, EscalationOutcome.LAUNCH_FAILED);
        });
        log.warn("{}: relaunch failed ({}), continuing escalation", taskId, error);
        applyNext(ladder, now, false);
    }

    /** The task reached a terminal status outside the ladder. */
    public void onTaskFinished(String taskId, boolean succeeded) {
        Ladder ladder = ladders.get(taskId);
        if (ladder == null) {
            return;
        }
        if (succeeded) {
            ladder.pending().ifPresent(record -> {
                ladder.replaceLast(record.withOutcome(EscalationOutcome.RECOVERED));
                appendOutcome(ladder.task, record, EscalationOutcome.RECOVERED);
            });
            ladder.state = EscalationState.HEALTHY;
        }
        ladder.deadline = null;
    }

    private void applyNext(Ladder ladder, Instant now, boolean workerAlive) {
        Task task = ladder.task;
        ladder.pending().ifPresent(record -> {
            ladder.replaceLast(record.withOutcome(EscalationOutcome.ESCALATED));
            appendOutcome(task, record, EscalationOutcome.ESCALATED);
        });

        List<EscalationStrategy> strategies = task.escalation().strategies();
        while (ladder.position < strategies.size()) {
            EscalationStrategy strategy = strategies.get(ladder.position);
            int used = ladder.used(strategy);
            if (used >= task.escalation().budgetFor(strategy)) {
                ladder.position++;
                continue;
            }
            if (!workerAlive && !strategy.restartsWorker()) {
                // nothing left to notify or interrupt
                ladder.position++;
                continue;
            }
            apply(ladder, strategy, used + 1, now);
            return;
        }
        exhaust(ladder);
    }

    private void apply(Ladder ladder, EscalationStrategy strategy, int attempt, Instant now) {
        Task task = ladder.task;
        ladder.attempts.put(strategy, attempt);
        var record = new EscalationRecord(task.id(), strategy, attempt, EscalationOutcome.APPLIED, now);
        ladder.records.add(record);
        ladder.state = EscalationState.after(strategy);
        ladder.deadline = switch (strategy) {
            case NOTIFY -> now.plus(task.escalation().notifyGrace());
            case INTERRUPT -> now.plus(task.escalation().interruptGrace());
            default -> null;
        };

        var payload = new LinkedHashMap<String, Object>();
        payload.put("strategy", strategy.wireName());
        payload.put("attempt", attempt);
        payload.put("budget", task.escalation().budgetFor(strategy));
        events.append(task.id(), EventType.ESCALATION_APPLIED, payload);
        metrics.recordEscalation(strategy);
        log.warn("Escalating {}: {} (attempt {}/{})", task.id(), strategy.wireName(), attempt,
                task.escalation().budgetFor(strategy));

        switch (strategy) {
            case NOTIFY -> actions.notifyStuck(task, record);
            case INTERRUPT -> actions.interrupt(task, record);
            default -> actions.restart(task, record);
        }
    }

    private void exhaust(Ladder ladder) {
        Task task = ladder.task;
        ladder.state = EscalationState.FAILED;
        ladder.deadline = null;
        var tried = new ArrayList<String>();
        for (EscalationRecord record : ladder.records) {
            tried.add(record.strategy().wireName() + "#" + record.attemptCount());
        }
        events.append(task.id(), EventType.ESCALATION_EXHAUSTED, Map.of("tried", tried));
        log.error("Escalation exhausted for {} after {}", task.id(), tried);
        actions.fail(task, List.copyOf(ladder.records));
    }

    private void appendOutcome(Task task, EscalationRecord record, EscalationOutcome outcome) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("strategy", record.strategy().wireName());
        payload.put("attempt", record.attemptCount());
        payload.put("outcome", outcome.name().toLowerCase(Locale.ROOT));
        events.append(task.id(), EventType.ESCALATION_OUTCOME, payload);
    }

    private Ladder ladder(String taskId) {
        Ladder ladder = ladders.get(taskId);
        if (ladder == null) {
            throw new IllegalArgumentException("Task not registered for escalation: " + taskId);
        }
        return ladder;
    }
}
