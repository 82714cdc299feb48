package com.overseer.core.watchdog;

import com.overseer.core.model.Indicator;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Signals when the task log grew by more than a minimum number of bytes since the previous sample.
 */
public class LogGrowthIndicator implements ProgressIndicator {

    private final long minBytes;
    private long lastSize;

    public LogGrowthIndicator(Path logPath, long minBytes) {
        this.minBytes = minBytes;
        this.lastSize = size(logPath);
    }

    @Override
    public Indicator kind() {
        return Indicator.LOG_GROWTH;
    }

    @Override
    public IndicatorReading sample(SampleContext context) {
        long size = size(context.logPath());
        long grown = size - lastSize;
        lastSize = size;
        if (grown > minBytes) {
            return IndicatorReading.signal("log grew " + grown + " bytes");
        }
        return IndicatorReading.quiet("log grew " + Math.max(grown, 0) + " bytes");
    }

    private static long size(Path path) {
        try {
            return Files.exists(path) ? Files.size(path) : 0L;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot stat " + path, e);
        }
    }
}
