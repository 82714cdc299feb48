package com.overseer.dispatch.cli;

import com.overseer.core.summary.RunSummary;
import com.overseer.core.summary.RunSummaryGenerator;
import picocli.CommandLine;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Overseer CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) OVERSEER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [OVERSEER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void problems(List<String> problems) {
        for (String problem : problems) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ " + problem));
        }
    }

    public static void levels(List<List<String>> levels) {
        for (int i = 0; i < levels.size(); i++) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|bold,fg(yellow) [LEVEL " + i + "]|@ " + String.join(", ", levels.get(i))));
        }
    }

    public static void summary(RunSummary summary, Instant now) {
        System.out.println();
        System.out.println("RUN " + summary.runId() + "  phases=" + String.join(",", summary.phases())
                + "  elapsed=" + RunSummaryGenerator.formatDuration(summary.elapsed(now)));
        runStatus(summary.status());
        if (summary.error() != null) {
            error("Error: " + summary.error());
        }
        if (summary.tasks().isEmpty()) {
            return;
        }
        System.out.println();
        System.out.printf("  %-24s %-10s %-9s %-28s %s%n", "TASK", "STATUS", "DURATION", "ESCALATIONS", "REASON");
        System.out.println("  " + "-".repeat(90));
        for (RunSummary.TaskRow row : summary.tasks()) {
            String duration = row.duration() == null ? "-" : RunSummaryGenerator.formatDuration(row.duration());
            String escalations = row.escalations().isEmpty() ? "-" : String.join(",", row.escalations());
            String line = String.format("  %-24s %-10s %-9s %-28s %s", truncate(row.taskId(), 24), row.status(),
                    duration, truncate(escalations, 28), row.reason() == null ? "" : row.reason());
            System.out.println(CommandLine.Help.Ansi.AUTO.string(colorFor(row.status()) + line + "|@"));
        }
    }

    private static void runStatus(String status) {
        switch (status) {
            case "succeeded" -> success("Status: " + status);
            case "failed", "aborted" -> error("Status: " + status);
            default -> info("Status: " + status);
        }
    }

    private static String colorFor(String status) {
        return switch (status) {
            case "succeeded" -> "@|fg(green) ";
            case "failed" -> "@|fg(red) ";
            case "blocked" -> "@|fg(yellow) ";
            default -> "@|fg(white) ";
        };
    }

    public static void metrics(Map<String, String> digest) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Run Metrics|@"));
        digest.forEach((name, value) -> System.out.println("  " + name + ": " + value));
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
