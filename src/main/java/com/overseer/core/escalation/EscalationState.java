package com.overseer.core.escalation;

import com.overseer.core.model.EscalationStrategy;

/**
 * Position of a task in the escalation state machine.
 */
public enum EscalationState {
    HEALTHY,
    STUCK,
    NOTIFIED,
    INTERRUPTED,
    RETRIED,
    REASSIGNED,
    SIMPLIFIED,
    FAILED;

    static EscalationState after(EscalationStrategy strategy) {
        return switch (strategy) {
            case NOTIFY -> NOTIFIED;
            case INTERRUPT -> INTERRUPTED;
            case KILL_AND_RETRY -> RETRIED;
            case SWITCH_AGENT -> REASSIGNED;
            case SIMPLIFY_SCOPE -> SIMPLIFIED;
        };
    }
}
