package com.overseer.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;

/**
 * Human-readable side log under the logs directory ({@code protocol-status.log},
 * {@code protocol-alerts.log}). Each line is prefixed with its timestamp.
 *
 * <p>Unlike the event log, these files are informational: a failed write is logged and the run
 * continues.
 */
public class ProtocolLog {

    private static final Logger log = LoggerFactory.getLogger(ProtocolLog.class);

    public static final String STATUS_FILE = "protocol-status.log";
    public static final String ALERTS_FILE = "protocol-alerts.log";

    private final Path file;
    private final Clock clock;

    public ProtocolLog(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
    }

    public Path file() {
        return file;
    }

    public synchronized void append(String line) {
        if (file == null) {
            return;
        }
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Files.writeString(file, clock.instant() + " " + line + System.lineSeparator(),
                    StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("Cannot write {}: {}", file, e.getMessage());
        }
    }
}
