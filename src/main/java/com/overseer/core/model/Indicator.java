package com.overseer.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Independent progress signals sampled by the watchdog.
 */
public enum Indicator {
    FILESYSTEM,
    COMMITS,
    LOG_GROWTH,
    OUTPUT_PATTERN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Indicator> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(i -> i.name().equals(normalized))
                .findFirst();
    }
}
