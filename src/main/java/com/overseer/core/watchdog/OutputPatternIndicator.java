package com.overseer.core.watchdog;

import com.overseer.core.model.Indicator;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Health check on the tail of the task log. It never signals progress by itself; it reports a
 * degenerate tail, which cancels the log-growth signal of the same sample, when
 * <ul>
 *   <li>the non-blank lines of the window reduce to a handful of distinct lines once numbers are
 *   normalized away (a worker looping on the same retry message or progress counter), or</li>
 *   <li>the only new output is the last line being extended by one repeated character (a spinner
 *   or dot trail).</li>
 * </ul>
 */
public class OutputPatternIndicator implements ProgressIndicator {

    private static final Pattern NUMBERS = Pattern.compile("\\d+");
    private static final Pattern HEX = Pattern.compile("\\b[0-9a-f]{7,40}\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int windowLines;
    private final int minDistinct;
    private List<String> lastTail;

    public OutputPatternIndicator(Path logPath, int windowLines, int minDistinct) {
        this.windowLines = windowLines;
        this.minDistinct = minDistinct;
        this.lastTail = LogTail.lastLines(logPath, windowLines);
    }

    @Override
    public Indicator kind() {
        return Indicator.OUTPUT_PATTERN;
    }

    @Override
    public IndicatorReading sample(SampleContext context) {
        List<String> tail = LogTail.lastLines(context.logPath(), windowLines);
        List<String> previous = lastTail;
        lastTail = tail;

        if (isDegenerate(tail)) {
            return IndicatorReading.degenerate("tail repeats " + distinct(tail) + " distinct line(s)");
        }
        String trail = repeatedTrail(previous, tail);
        if (trail != null) {
            return IndicatorReading.degenerate("last line only grew by '" + trail + "'");
        }
        return IndicatorReading.quiet(tail.equals(previous) ? "no new output" : "tail healthy");
    }

    /**
     * The characters appended to the previous last line when that is the only change and they
     * are one character repeated, otherwise null.
     */
    static String repeatedTrail(List<String> previous, List<String> tail) {
        if (previous.isEmpty() || tail.isEmpty()) {
            return null;
        }
        String before = previous.get(previous.size() - 1);
        String after = tail.get(tail.size() - 1);
        if (after.length() <= before.length() || !after.startsWith(before)) {
            return null;
        }
        String added = after.substring(before.length());
        long distinctChars = added.chars().filter(c -> !Character.isWhitespace(c)).distinct().count();
        return distinctChars <= 1 ? added : null;
    }

    boolean isDegenerate(List<String> tail) {
        var lines = normalized(tail);
        return lines.size() > 2 * minDistinct && new HashSet<>(lines).size() <= minDistinct;
    }

    private int distinct(List<String> tail) {
        return new HashSet<>(normalized(tail)).size();
    }

    static String normalize(String line) {
        String result = line.toLowerCase(Locale.ROOT);
        result = HEX.matcher(result).replaceAll("#");
        result = NUMBERS.matcher(result).replaceAll("#");
        return WHITESPACE.matcher(result).replaceAll(" ").trim();
    }

    private static List<String> normalized(List<String> tail) {
        var lines = new ArrayList<String>(tail.size());
        for (String line : tail) {
            String n = normalize(line);
            if (!n.isEmpty()) {
                lines.add(n);
            }
        }
        return lines;
    }
}
