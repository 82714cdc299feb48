package com.overseer.core.watchdog;

/**
 * Outcome of sampling one progress indicator.
 *
 * @param signaled   the indicator saw forward progress since the previous sample
 * @param degenerate the output tail is a degenerate repetition (only set by the output-pattern indicator)
 * @param detail     short description for logs and events
 */
public record IndicatorReading(boolean signaled, boolean degenerate, String detail) {

    public static IndicatorReading signal(String detail) {
        return new IndicatorReading(true, false, detail);
    }

    public static IndicatorReading quiet(String detail) {
        return new IndicatorReading(false, false, detail);
    }

    public static IndicatorReading degenerate(String detail) {
        return new IndicatorReading(false, true, detail);
    }
}
