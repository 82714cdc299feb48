package com.overseer.core.model;

import java.time.Instant;

/**
 * One invocation of an escalation strategy against a task.
 *
 * @param taskId       the stuck task
 * @param strategy     strategy applied
 * @param attemptCount 1-based attempt number for this strategy on this task
 * @param outcome      what came of it
 * @param appliedAt    when the strategy was applied
 */
public record EscalationRecord(
    String taskId,
    EscalationStrategy strategy,
    int attemptCount,
    EscalationOutcome outcome,
    Instant appliedAt
) {
    public EscalationRecord withOutcome(EscalationOutcome newOutcome) {
        return new EscalationRecord(taskId, strategy, attemptCount, newOutcome, appliedAt);
    }
}
