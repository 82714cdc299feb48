package com.overseer.core.metrics;

import com.overseer.core.model.EscalationStrategy;
import com.overseer.core.model.TaskStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class OverseerMetricsTest {

    private SimpleMeterRegistry registry;
    private OverseerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new OverseerMetrics(registry);
    }

    @Test
    @DisplayName("recordTaskFinished records by status tag")
    void recordTaskFinished() {
        metrics.recordTaskFinished(TaskStatus.SUCCEEDED, Duration.ofSeconds(30));
        metrics.recordTaskFinished(TaskStatus.FAILED, Duration.ofSeconds(5));

        var succeeded = registry.find("overseer.task.duration").tag("status", "succeeded").timer();
        var failed = registry.find("overseer.task.duration").tag("status", "failed").timer();
        assertNotNull(succeeded);
        assertNotNull(failed);
        assertEquals(1, succeeded.count());
        assertEquals(1, failed.count());
    }

    @Test
    @DisplayName("recordEscalation tags the strategy")
    void recordEscalation() {
        metrics.recordEscalation(EscalationStrategy.NOTIFY);
        metrics.recordEscalation(EscalationStrategy.NOTIFY);
        metrics.recordEscalation(EscalationStrategy.KILL_AND_RETRY);

        assertEquals(2.0, registry.find("overseer.escalations.total").tag("strategy", "notify").counter().count());
        assertEquals(1.0, registry.find("overseer.escalations.total").tag("strategy", "kill_and_retry")
                .counter().count());
    }

    @Test
    @DisplayName("recordWorktreeOperation tags operation and outcome")
    void recordWorktreeOperation() {
        metrics.recordWorktreeOperation("allocate", true);
        metrics.recordWorktreeOperation("allocate", false);
        metrics.recordWorktreeOperation("release", true);

        var failed = registry.find("overseer.worktree.operations")
                .tag("operation", "allocate").tag("success", "false").counter();
        assertNotNull(failed);
        assertEquals(1.0, failed.count());
    }

    @Test
    @DisplayName("digest summarises counters for the console")
    void digest() {
        metrics.recordTaskFinished(TaskStatus.SUCCEEDED, Duration.ofSeconds(10));
        metrics.recordTaskFinished(TaskStatus.SUCCEEDED, Duration.ofSeconds(30));
        metrics.recordStuckDetected();
        metrics.recordRecovered();
        metrics.recordEscalation(EscalationStrategy.NOTIFY);
        metrics.recordWorktreeOperation("allocate", false);

        var digest = metrics.digest();

        assertEquals("2 (avg 20s)", digest.get("tasks.succeeded"));
        assertFalse(digest.containsKey("tasks.failed"));
        assertEquals("1", digest.get("stuck"));
        assertEquals("1", digest.get("recovered"));
        assertEquals("1", digest.get("escalations"));
        assertEquals("1", digest.get("worktree.failures"));
    }

    @Test
    @DisplayName("digest of an empty registry reports zeros")
    void emptyDigest() {
        var digest = metrics.digest();
        assertEquals("0", digest.get("stuck"));
        assertEquals("0", digest.get("worktree.failures"));
    }
}
