package com.overseer.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Named, mutually-exclusive class of task runs.
 */
public enum Phase {
    DISCOVERY,
    MAIN,
    LEGACY,
    POST;

    /** Lower-case name used in configuration files, lock files and the event log. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Phase> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.name().equals(normalized))
                .findFirst();
    }
}
