package com.overseer.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Recovery strategies applied to a stuck task, in increasing intrusiveness.
 */
public enum EscalationStrategy {
    NOTIFY,
    INTERRUPT,
    KILL_AND_RETRY,
    SWITCH_AGENT,
    SIMPLIFY_SCOPE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Whether applying this strategy terminates the worker and launches a new one. */
    public boolean restartsWorker() {
        return this == KILL_AND_RETRY || this == SWITCH_AGENT || this == SIMPLIFY_SCOPE;
    }

    public static Optional<EscalationStrategy> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(s -> s.name().equals(normalized))
                .findFirst();
    }
}
