package com.overseer.core.summary;

import com.overseer.core.events.EventType;
import com.overseer.core.events.LogEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunSummaryGeneratorTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private RunSummaryGenerator generator;
    private List<LogEvent> events;

    @BeforeEach
    void setUp() {
        generator = new RunSummaryGenerator();
        events = new ArrayList<>();
    }

    private void add(long second, String taskId, EventType type, Map<String, Object> payload) {
        events.add(LogEvent.of(T0.plusSeconds(second), "R1", taskId, type, payload));
    }

    private void typicalRun(boolean finished) {
        add(0, null, EventType.RUN_STARTED, Map.of("phases", List.of("main"), "tasks", List.of("A", "B", "C")));
        add(1, "A", EventType.TASK_READY, Map.of());
        add(1, "C", EventType.TASK_READY, Map.of());
        add(2, "A", EventType.TASK_STARTED, Map.of("attempt", 1));
        add(2, "C", EventType.TASK_STARTED, Map.of("attempt", 1));
        add(40, "C", EventType.TASK_FAILED, Map.of("reason", "process_exit", "detail", "exit code 1"));
        add(41, "B", EventType.TASK_BLOCKED, Map.of("reason", "dependency_failed", "causes", List.of("C")));
        add(60, "A", EventType.ESCALATION_APPLIED, Map.of("strategy", "notify", "attempt", 1));
        add(92, "A", EventType.TASK_SUCCEEDED, Map.of());
        if (finished) {
            add(93, null, EventType.RUN_FINISHED, Map.of("status", "failed"));
        }
    }

    @Nested
    @DisplayName("Reduction")
    class Reduction {

        @Test
        @DisplayName("Each task gets its last status, duration, escalations and reason")
        void rows() {
            typicalRun(true);
            RunSummary summary = generator.reduce("R1", events);

            assertEquals("failed", summary.status());
            assertEquals(List.of("main"), summary.phases());
            assertEquals(List.of("A", "B", "C"), summary.tasks().stream().map(RunSummary.TaskRow::taskId).toList());

            RunSummary.TaskRow a = summary.tasks().get(0);
            assertEquals("succeeded", a.status());
            assertEquals(Duration.ofSeconds(90), a.duration());
            assertEquals(List.of("notify"), a.escalations());
            assertNull(a.reason());

            RunSummary.TaskRow b = summary.tasks().get(1);
            assertEquals("blocked", b.status());
            assertNull(b.duration());
            assertEquals("dependency_failed (C)", b.reason());

            assertEquals("process_exit: exit code 1", summary.tasks().get(2).reason());
            assertEquals(1, summary.count("succeeded"));
            assertEquals(Duration.ofSeconds(93), summary.elapsed(T0.plusSeconds(500)));
        }

        @Test
        @DisplayName("A run without run_finished is in progress")
        void inProgress() {
            typicalRun(false);
            RunSummary summary = generator.reduce("R1", events);
            assertEquals("in_progress", summary.status());
            assertFalse(summary.isFinished());
            assertEquals(Duration.ofSeconds(200), summary.elapsed(T0.plusSeconds(200)));
        }

        @Test
        @DisplayName("Tasks never mentioned after run_started stay pending")
        void pendingTasks() {
            add(0, null, EventType.RUN_STARTED, Map.of("phases", List.of("main"), "tasks", List.of("A")));
            assertEquals("pending", generator.reduce("R1", events).tasks().get(0).status());
        }

        @Test
        @DisplayName("Unknown event types are skipped")
        void unknownTypes() {
            add(0, null, EventType.RUN_STARTED, Map.of("phases", List.of("main"), "tasks", List.of("A")));
            events.add(new LogEvent(T0, "R1", "A", "from_the_future", Map.of()));
            assertEquals(1, generator.reduce("R1", events).tasks().size());
        }
    }

    @Nested
    @DisplayName("Report")
    class Report {

        @TempDir
        Path dir;

        @Test
        @DisplayName("Markdown carries the header facts and one table row per task")
        void markdown() {
            typicalRun(true);
            String md = generator.renderMarkdown(generator.reduce("R1", events), T0.plusSeconds(100));

            assertTrue(md.startsWith("# Orchestrator run summary"));
            assertTrue(md.contains("- Status: **failed**"));
            assertTrue(md.contains("- Tasks: 3 (succeeded 1, failed 1, blocked 1)"));
            assertTrue(md.contains("| A | succeeded | 01:30 | notify |  |"));
            assertTrue(md.contains("| B | blocked | - | - | dependency_failed (C) |"));
        }

        @Test
        @DisplayName("The report file is named after phases and run id")
        void write() throws IOException {
            typicalRun(true);
            RunSummary summary = generator.reduce("R1", events);

            Path file = generator.write(summary, dir.resolve("summaries"), T0.plusSeconds(100));

            assertEquals("orchestrator-run-summary-main-R1.md", file.getFileName().toString());
            assertTrue(Files.readString(file).contains("`R1`"));
        }

        @Test
        @DisplayName("Durations use mm:ss below an hour and h:mm:ss above")
        void formatDuration() {
            assertEquals("00:05", RunSummaryGenerator.formatDuration(Duration.ofSeconds(5)));
            assertEquals("12:00", RunSummaryGenerator.formatDuration(Duration.ofMinutes(12)));
            assertEquals("1:01:01", RunSummaryGenerator.formatDuration(Duration.ofSeconds(3661)));
        }
    }
}
