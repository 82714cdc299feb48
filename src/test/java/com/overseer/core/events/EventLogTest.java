package com.overseer.core.events;

import com.overseer.core.OverseerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventLogTest {

    @TempDir
    Path tempDir;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private Path file;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("logs").resolve("framework-run.jsonl");
    }

    private EventLog open(String runId) {
        return new EventLog(file, runId, EventLog.newObjectMapper(), false, clock);
    }

    @Nested
    @DisplayName("Writing")
    class Writing {

        @Test
        @DisplayName("Each record is one JSON line with run id, task id, type and payload")
        void writesJsonLines() throws IOException {
            try (EventLog log = open("R1")) {
                log.append(null, EventType.RUN_STARTED, Map.of("phases", List.of("main")));
                log.append("A", EventType.TASK_STARTED, Map.of("attempt", 1));
            }
            List<String> lines = Files.readAllLines(file);
            assertEquals(2, lines.size());
            assertTrue(lines.get(1).contains("\"run_id\":\"R1\""));
            assertTrue(lines.get(1).contains("\"task_id\":\"A\""));
            assertTrue(lines.get(1).contains("\"event_type\":\"task_started\""));
            assertTrue(lines.get(1).contains("\"timestamp\":\"2026-03-01T10:00:00Z\""));
            assertFalse(lines.get(0).contains("task_id"), "run-level records carry no task id");
        }

        @Test
        @DisplayName("Runs append to the same file")
        void appendsAcrossRuns() {
            try (EventLog first = open("R1")) {
                first.append("A", EventType.TASK_SUCCEEDED);
            }
            try (EventLog second = open("R2")) {
                second.append("A", EventType.TASK_STARTED);
            }
            var mapper = EventLog.newObjectMapper();
            assertEquals(2, EventLog.readAll(file, mapper).size());
            assertEquals(List.of("R1", "R2"), EventLog.runIds(file, mapper));
            assertEquals(1, EventLog.readRun(file, mapper, "R2").size());
        }

        @Test
        @DisplayName("Appending after close fails")
        void closedLogRejectsAppends() {
            EventLog log = open("R1");
            log.close();
            assertThrows(OverseerException.class, () -> log.append("A", EventType.TASK_READY));
        }

        @Test
        @DisplayName("Concurrent writers never interleave lines")
        void concurrentAppends() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            var start = new CountDownLatch(1);
            try (EventLog log = open("R1")) {
                for (int t = 0; t < 8; t++) {
                    String task = "T" + t;
                    pool.execute(() -> {
                        try {
                            start.await();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        for (int i = 0; i < 50; i++) {
                            log.append(task, EventType.PROCESS_EXITED, Map.of("i", i));
                        }
                    });
                }
                start.countDown();
                pool.shutdown();
                assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
            }
            assertEquals(400, EventLog.readAll(file, EventLog.newObjectMapper()).size());
        }
    }

    @Nested
    @DisplayName("Projections")
    class Projections {

        @Test
        @DisplayName("succeededTasks tracks task_succeeded records only")
        void succeededProjection() {
            EventLog log = EventLog.inMemory("R1", clock);
            log.append("A", EventType.TASK_SUCCEEDED);
            log.append("B", EventType.TASK_FAILED, Map.of("reason", "process_exit"));
            assertEquals(Set.of("A"), log.succeededTasks());
            assertEquals(2, log.events().size());
            assertNull(log.file());
        }

        @Test
        @DisplayName("Subscribers see every record; a failing subscriber does not break the log")
        void subscribers() {
            EventLog log = EventLog.inMemory("R1", clock);
            var seen = new ArrayList<String>();
            log.subscribe(e -> {
                throw new IllegalStateException("boom");
            });
            var subscription = log.subscribe(e -> seen.add(e.eventType()));
            log.append("A", EventType.TASK_READY);
            subscription.unsubscribe();
            log.append("A", EventType.TASK_STARTED);
            assertEquals(List.of("task_ready"), seen);
        }
    }

    @Nested
    @DisplayName("Reading")
    class Reading {

        @Test
        @DisplayName("A torn last line is skipped")
        void tornLine() throws IOException {
            try (EventLog log = open("R1")) {
                log.append("A", EventType.TASK_STARTED);
            }
            Files.writeString(file, "{\"run_id\":\"R1\",\"event_ty", StandardOpenOption.APPEND);
            var events = EventLog.readAll(file, EventLog.newObjectMapper());
            assertEquals(1, events.size());
            assertTrue(events.get(0).is(EventType.TASK_STARTED));
        }

        @Test
        @DisplayName("A missing file reads as empty")
        void missingFile() {
            assertTrue(EventLog.readAll(tempDir.resolve("none.jsonl"), EventLog.newObjectMapper()).isEmpty());
        }
    }
}
