package com.overseer.core.watchdog;

import com.overseer.core.config.OverseerProperties;
import com.overseer.core.events.EventLog;
import com.overseer.core.events.EventType;
import com.overseer.core.events.LogEvent;
import com.overseer.core.events.ProtocolLog;
import com.overseer.core.metrics.OverseerMetrics;
import com.overseer.core.model.Liveness;
import com.overseer.core.model.Task;
import com.overseer.core.model.TaskFixtures;
import com.overseer.core.model.WatchdogSettings;
import com.overseer.core.model.WorkspaceAllocation;
import com.overseer.workspace.GitWorkspaceManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class TaskMonitorTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private SimpleMeterRegistry registry;
    private EventLog events;
    private ProtocolLog alerts;
    private final List<WatchdogVerdict> inbox = new CopyOnWriteArrayList<>();
    private TaskMonitor monitor;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        events = EventLog.inMemory("run-1", Clock.systemUTC());
        alerts = new ProtocolLog(tempDir.resolve(ProtocolLog.ALERTS_FILE), Clock.systemUTC());
        monitor = new TaskMonitor(1, events, alerts, new OverseerMetrics(registry), mock(GitWorkspaceManager.class),
                new OverseerProperties.Watchdog(), Clock.systemUTC(), inbox::add);
    }

    @AfterEach
    void tearDown() {
        monitor.close();
    }

    private List<LogEvent> eventsOf(EventType type) {
        return events.events().stream().filter(e -> e.is(type)).toList();
    }

    private static WatchdogVerdict verdict(Liveness liveness, long sinceSeconds, List<String> signals,
                                           boolean newlyStuck, boolean recovered) {
        return new WatchdogVerdict("A", 1, liveness, T0.plusSeconds(sinceSeconds), Duration.ofSeconds(sinceSeconds),
                signals, newlyStuck, recovered);
    }

    private static Task quickTask(Path root, Duration interval, Duration threshold) {
        Task base = TaskFixtures.task("A", root);
        var settings = new WatchdogSettings(interval, threshold, Set.of(), 64);
        return new Task(base.id(), base.phase(), base.branch(), base.workspacePath(), base.baseRef(), base.runner(),
                base.promptPath(), base.logPath(), base.dependsOn(), base.manual(), settings, base.escalation());
    }

    @Nested
    @DisplayName("Reporting")
    class Reporting {

        private final Task task = TaskFixtures.task("A");

        @Test
        @DisplayName("The sample that starts a stuck episode records one detection with its timings")
        void newlyStuckRecordsDetection() throws Exception {
            monitor.report(task, verdict(Liveness.STUCK, 900, List.of(), true, false));

            List<LogEvent> stuck = eventsOf(EventType.STUCK_TASK_DETECTED);
            assertEquals(1, stuck.size());
            assertEquals("A", stuck.get(0).taskId());
            assertEquals("900", stuck.get(0).text("since_progress_s"));
            assertEquals("900", stuck.get(0).text("stuck_threshold_s"));
            assertEquals(1.0, registry.find("overseer.watchdog.stuck_detections").counter().count());
            assertTrue(Files.readString(alerts.file()).contains("[STUCK] task=A attempt=1"));
        }

        @Test
        @DisplayName("Further stuck samples of the same episode record nothing")
        void repeatedStuckIsSilent() {
            monitor.report(task, verdict(Liveness.STUCK, 900, List.of(), true, false));
            monitor.report(task, verdict(Liveness.STUCK, 930, List.of(), false, false));
            monitor.report(task, verdict(Liveness.STUCK, 960, List.of(), false, false));

            assertEquals(1, eventsOf(EventType.STUCK_TASK_DETECTED).size());
            assertEquals(1.0, registry.find("overseer.watchdog.stuck_detections").counter().count());
        }

        @Test
        @DisplayName("Activity after a stuck episode records a recovery with the signals")
        void recoveryRecorded() {
            monitor.report(task, verdict(Liveness.STUCK, 900, List.of(), true, false));
            monitor.report(task, verdict(Liveness.ACTIVE, 0, List.of("filesystem: modified src/A.java"), false, true));

            List<LogEvent> recovered = eventsOf(EventType.TASK_RECOVERED);
            assertEquals(1, recovered.size());
            assertEquals(List.of("filesystem: modified src/A.java"), recovered.get(0).payload().get("signals"));
            assertEquals(1.0, registry.find("overseer.watchdog.recoveries").counter().count());
        }

        @Test
        @DisplayName("Active and uncertain samples record nothing")
        void ordinarySamplesSilent() {
            monitor.report(task, verdict(Liveness.ACTIVE, 0, List.of("commits: 1 new"), false, false));
            monitor.report(task, verdict(Liveness.UNCERTAIN, 120, List.of(), false, false));

            assertTrue(events.events().isEmpty());
            assertNull(registry.find("overseer.watchdog.stuck_detections").counter());
        }
    }

    @Nested
    @DisplayName("Scheduling")
    class Scheduling {

        @Test
        @DisplayName("Every sample reaches the inbox and a stuck task is detected once")
        void samplesReachInbox() throws Exception {
            var latch = new CountDownLatch(1);
            var stuck = new CopyOnWriteArrayList<WatchdogVerdict>();
            monitor.close();
            monitor = new TaskMonitor(1, events, alerts, new OverseerMetrics(registry),
                    mock(GitWorkspaceManager.class), new OverseerProperties.Watchdog(), Clock.systemUTC(), v -> {
                        inbox.add(v);
                        if (v.liveness() == Liveness.STUCK) {
                            stuck.add(v);
                            if (stuck.size() >= 3) {
                                latch.countDown();
                            }
                        }
                    });
            Task task = quickTask(tempDir, Duration.ofMillis(10), Duration.ofMillis(50));
            var allocation = new WorkspaceAllocation(tempDir, "task/A", "A", "abc123", Instant.now());

            ProgressWatchdog watchdog = monitor.watch(task, allocation, 1, Instant.now());
            assertNotNull(watchdog);
            assertTrue(latch.await(5, TimeUnit.SECONDS), "stuck verdicts posted");
            monitor.unwatch("A");

            assertTrue(stuck.get(0).newlyStuck());
            assertEquals(1, eventsOf(EventType.STUCK_TASK_DETECTED).size());
        }

        @Test
        @DisplayName("No samples are posted once the monitor is closed")
        void closeStopsSampling() throws Exception {
            Task task = quickTask(tempDir, Duration.ofMillis(10), Duration.ofMinutes(5));
            var allocation = new WorkspaceAllocation(tempDir, "task/A", "A", "abc123", Instant.now());
            monitor.watch(task, allocation, 1, Instant.now());

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (inbox.isEmpty() && System.nanoTime() < deadline) {
                Thread.sleep(5);
            }
            assertFalse(inbox.isEmpty());

            monitor.close();
            int posted = inbox.size();
            Thread.sleep(60);
            assertEquals(posted, inbox.size());
        }

        @Test
        @DisplayName("Unwatching a task that is not watched is a no-op")
        void unwatchUnknown() {
            assertDoesNotThrow(() -> monitor.unwatch("missing"));
        }
    }
}
