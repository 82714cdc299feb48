package com.overseer.core.watchdog;

import com.overseer.core.model.Indicator;

/**
 * One independent signal of forward progress. Implementations may keep per-task state between
 * samples; each instance belongs to a single task's watchdog.
 */
public interface ProgressIndicator {

    Indicator kind();

    /**
     * Samples the indicator.
     *
     * @throws java.io.UncheckedIOException when the underlying files cannot be read
     */
    IndicatorReading sample(SampleContext context);
}
