package com.overseer.core.events;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of records in the run event log. The wire name is the lower-case constant name.
 */
public enum EventType {
    RUN_STARTED,
    RUN_FINISHED,
    TASK_READY,
    TASK_STARTED,
    TASK_SUCCEEDED,
    TASK_FAILED,
    TASK_BLOCKED,
    WORKSPACE_ALLOCATED,
    WORKSPACE_RELEASED,
    PROCESS_STARTED,
    PROCESS_EXITED,
    PROCESS_TERMINATED,
    STUCK_TASK_DETECTED,
    TASK_RECOVERED,
    ESCALATION_APPLIED,
    ESCALATION_OUTCOME,
    ESCALATION_EXHAUSTED,
    PHASE_LOCK_ACQUIRED,
    PHASE_LOCK_RELEASED,
    SUMMARY_WRITTEN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<EventType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.name().equals(normalized))
                .findFirst();
    }
}
