package com.overseer.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Per-task escalation ladder.
 *
 * @param strategies        strategies to attempt, in order
 * @param maxRetries        bound on {@link EscalationStrategy#KILL_AND_RETRY} attempts
 * @param notifyGrace       time a notified task may stay stuck before the next strategy
 * @param interruptGrace    time an interrupted task has to show activity again
 * @param alternateRunner   runner used by {@link EscalationStrategy#SWITCH_AGENT}, may be null
 * @param simplifiedPrompt  prompt used by {@link EscalationStrategy#SIMPLIFY_SCOPE}, may be null
 */
public record EscalationSettings(
    List<EscalationStrategy> strategies,
    int maxRetries,
    Duration notifyGrace,
    Duration interruptGrace,
    String alternateRunner,
    Path simplifiedPrompt
) {
    public EscalationSettings {
        strategies = List.copyOf(strategies);
    }

    /** Attempts allowed for a strategy on one task. */
    public int budgetFor(EscalationStrategy strategy) {
        return strategy == EscalationStrategy.KILL_AND_RETRY ? maxRetries : 1;
    }
}
