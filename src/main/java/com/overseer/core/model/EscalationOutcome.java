package com.overseer.core.model;

/**
 * Result of one escalation strategy invocation.
 */
public enum EscalationOutcome {
    APPLIED,      // action taken, waiting to see its effect
    RECOVERED,    // task produced activity again
    ESCALATED,    // superseded by the next strategy
    LAUNCH_FAILED,
    EXHAUSTED     // nothing left to try, task failed
}
