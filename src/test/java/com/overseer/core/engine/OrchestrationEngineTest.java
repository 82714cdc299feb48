package com.overseer.core.engine;

import com.overseer.core.config.ConfigException;
import com.overseer.core.config.OverseerProperties;
import com.overseer.core.config.RunConfigLoader;
import com.overseer.core.events.EventLog;
import com.overseer.core.events.LogEvent;
import com.overseer.core.graph.TaskGraphBuilder;
import com.overseer.core.health.PreflightChecker;
import com.overseer.core.lock.PhaseLockHeldException;
import com.overseer.core.lock.PhaseLockManager;
import com.overseer.core.metrics.OverseerMetrics;
import com.overseer.core.model.Phase;
import com.overseer.core.model.PhaseLock;
import com.overseer.core.model.TaskStatus;
import com.overseer.core.scheduler.ReadySetCalculator;
import com.overseer.core.summary.RunSummary;
import com.overseer.core.summary.RunSummaryGenerator;
import com.overseer.supervisor.NoopWorkerBackend;
import com.overseer.supervisor.ProcessSupervisor;
import com.overseer.workspace.GitWorkspaceManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@Timeout(value = 30, unit = TimeUnit.SECONDS)
class OrchestrationEngineTest {

    @TempDir
    Path root;

    private Path configFile;
    private OverseerProperties properties;
    private GitWorkspaceManager git;
    private OrchestrationEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        configFile = root.resolve("tasks.yml");
        Files.writeString(configFile, """
                tasks:
                  - id: schema
                    workspace_path: wt/{task}
                    command: echo {task}
                  - id: api
                    workspace_path: wt/{task}
                    command: echo {task}
                    depends_on: [schema]
                  - id: docs
                    workspace_path: wt/{task}
                    command: echo {task}
                    manual: true
                """);

        properties = new OverseerProperties();
        properties.setRunnerNoop(true);
        properties.setPollInterval(Duration.ofMillis(10));

        git = mock(GitWorkspaceManager.class);
        when(git.isGitAvailable(any())).thenReturn(true);
        when(git.isGitRepository(any())).thenReturn(true);
        when(git.resolveCommit(any(), anyString())).thenReturn("abc123");
        when(git.addWorktree(any(), any(), anyString(), anyString()))
                .thenAnswer(inv -> GitWorkspaceManager.WorktreeResult.success(inv.getArgument(1)));
        when(git.removeWorktree(any(), any())).thenReturn(true);

        var metrics = new OverseerMetrics(new SimpleMeterRegistry());
        var supervisor = new ProcessSupervisor(List.of(new NoopWorkerBackend()), properties, Clock.systemUTC(), metrics);
        engine = new OrchestrationEngine(new RunConfigLoader(), new TaskGraphBuilder(), new ReadySetCalculator(),
                new PreflightChecker(git), supervisor, git, new RunSummaryGenerator(), metrics, properties,
                Clock.systemUTC());
    }

    private RunRequest request(boolean dryRun) {
        return new RunRequest(configFile, List.of(Phase.MAIN), dryRun, false);
    }

    private Path eventsFile() {
        return root.resolve("logs").resolve(properties.getEvents().getFileName());
    }

    @Nested
    @DisplayName("Planning")
    class Planning {

        @Test
        @DisplayName("A dry run reports levels and exclusions without locking or writing events")
        void dryRun() {
            RunResult result = engine.run(request(true));

            assertTrue(result.dryRun());
            assertEquals(Map.of("schema", TaskStatus.PENDING, "api", TaskStatus.PENDING), result.statuses());
            assertEquals(List.of(List.of("schema"), List.of("api")), result.levels());
            assertEquals(List.of("docs"), result.excluded());
            assertFalse(Files.exists(eventsFile()));
            assertTrue(engine.heldLocks(configFile).isEmpty());
            verify(git, never()).addWorktree(any(), any(), anyString(), anyString());
        }

        @Test
        @DisplayName("At least one phase is required")
        void noPhase() {
            assertThrows(ConfigException.class,
                    () -> engine.run(new RunRequest(configFile, List.of(), false, false)));
        }

        @Test
        @DisplayName("Pre-flight failures stop the run before anything is locked")
        void preflightFailure() {
            when(git.isGitRepository(any())).thenReturn(false);
            var e = assertThrows(ConfigException.class, () -> engine.run(request(false)));
            assertTrue(e.problems().stream().anyMatch(p -> p.startsWith("Project root is not a git repository")));
            assertTrue(engine.heldLocks(configFile).isEmpty());
        }

        @Test
        @DisplayName("Run ids carry a timestamp and a counter")
        void runIdFormat() {
            assertTrue(engine.generateRunId().matches("\\d{8}T\\d{6}-\\d{2}"));
        }
    }

    @Nested
    @DisplayName("Execution")
    class Execution {

        @Test
        @DisplayName("A run drives every scheduled task, writes the summary and releases its lock")
        void fullRun() throws IOException {
            RunResult result = engine.run(request(false));

            assertEquals(RunResult.SUCCEEDED, result.status());
            assertEquals(TaskStatus.SUCCEEDED, result.statuses().get("schema"));
            assertEquals(TaskStatus.SUCCEEDED, result.statuses().get("api"));
            assertFalse(result.statuses().containsKey("docs"));
            assertTrue(Files.isRegularFile(result.summaryFile()));
            assertTrue(Files.readString(result.summaryFile()).contains("- Status: **succeeded**"));
            assertTrue(engine.heldLocks(configFile).isEmpty());

            List<String> types = EventLog.readAll(eventsFile(), EventLog.newObjectMapper()).stream()
                    .map(LogEvent::eventType).toList();
            assertEquals("phase_lock_acquired", types.get(0));
            assertEquals("run_started", types.get(1));
            assertTrue(types.indexOf("run_finished") < types.indexOf("summary_written"));
            assertEquals("phase_lock_released", types.get(types.size() - 1));
        }

        @Test
        @DisplayName("A held phase lock refuses the run")
        void lockHeld() {
            var locks = new PhaseLockManager(root.resolve("logs"), properties.getLock(), EventLog.newObjectMapper(),
                    Clock.systemUTC());
            locks.acquire(Phase.MAIN, "other-run");

            var e = assertThrows(PhaseLockHeldException.class, () -> engine.run(request(false)));
            assertEquals("other-run", e.holder().holderRunId());
            assertFalse(Files.exists(eventsFile()));
        }

        @Test
        @DisplayName("A worker failure makes the run fail and blocks dependents")
        void failingRun() {
            when(git.addWorktree(any(), any(), anyString(), anyString()))
                    .thenReturn(GitWorkspaceManager.WorktreeResult.failure("fatal: bad ref"));

            RunResult result = engine.run(request(false));

            assertEquals(RunResult.FAILED, result.status());
            assertEquals(TaskStatus.FAILED, result.statuses().get("schema"));
            assertEquals(TaskStatus.BLOCKED, result.statuses().get("api"));
            assertFalse(result.succeeded());
        }
    }

    @Nested
    @DisplayName("Inspection")
    class Inspection {

        @Test
        @DisplayName("Status reduces the latest run from the event stream")
        void status() {
            RunResult result = engine.run(request(false));

            RunSummary summary = engine.status(configFile, null).orElseThrow();
            assertEquals(result.runId(), summary.runId());
            assertEquals("succeeded", summary.status());
            assertTrue(engine.status(configFile, "no-such-run").isEmpty());
        }

        @Test
        @DisplayName("Status of a project that never ran is empty")
        void statusWithoutRuns() {
            assertTrue(engine.status(configFile, null).isEmpty());
        }

        @Test
        @DisplayName("The summary can be regenerated from the event stream")
        void regenerate() throws IOException {
            RunResult result = engine.run(request(false));
            Files.delete(result.summaryFile());

            Path rewritten = engine.regenerateSummary(configFile, result.runId()).orElseThrow();
            assertEquals(result.summaryFile(), rewritten);
            assertTrue(Files.exists(rewritten));
        }

        @Test
        @DisplayName("Unlock removes a stale lock and reports its holder")
        void unlock() {
            var locks = new PhaseLockManager(root.resolve("logs"), properties.getLock(), EventLog.newObjectMapper(),
                    Clock.systemUTC());
            locks.acquire(Phase.MAIN, "crashed-run");

            Optional<PhaseLock> holder = engine.unlock(configFile, Phase.MAIN);

            assertEquals("crashed-run", holder.orElseThrow().holderRunId());
            assertTrue(engine.heldLocks(configFile).isEmpty());
            assertTrue(engine.unlock(configFile, Phase.MAIN).isEmpty());
        }
    }
}
