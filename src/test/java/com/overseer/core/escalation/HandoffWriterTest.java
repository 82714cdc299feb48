package com.overseer.core.escalation;

import com.overseer.core.model.EscalationOutcome;
import com.overseer.core.model.EscalationRecord;
import com.overseer.core.model.EscalationStrategy;
import com.overseer.core.model.Task;
import com.overseer.core.model.TaskFixtures;
import com.overseer.core.model.WorkspaceAllocation;
import com.overseer.workspace.GitCommandException;
import com.overseer.workspace.GitWorkspaceManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class HandoffWriterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:30:00Z");

    @TempDir
    Path root;

    private GitWorkspaceManager git;
    private HandoffWriter writer;
    private Task task;
    private WorkspaceAllocation allocation;

    @BeforeEach
    void setUp() throws IOException {
        git = mock(GitWorkspaceManager.class);
        writer = new HandoffWriter(root.resolve("logs/handoff"), git, Clock.fixed(NOW, ZoneOffset.UTC));
        task = TaskFixtures.task("D", root);
        allocation = new WorkspaceAllocation(task.workspacePath(), task.branch(), "D", "abc123", NOW.minusSeconds(900));
        Files.createDirectories(task.logPath().getParent());
        Files.writeString(task.logPath(), String.join("\n",
                "reading src/Main.java",
                "ERROR: cannot resolve symbol Foo in Bar.java:12",
                "retrying",
                "retrying") + "\n");
    }

    @Test
    void writesHandoffWithHistoryCommitsAndBlocker() throws IOException {
        when(git.commitLog(task.workspacePath(), "abc123")).thenReturn("f00dcafe add parser skeleton\n");
        when(git.diffStat(task.workspacePath(), "abc123"))
                .thenReturn(List.of(new GitWorkspaceManager.FileChange("src/Parser.java", "created", 40)));
        when(git.statusPorcelain(task.workspacePath())).thenReturn(" M src/Main.java");
        when(git.diff(task.workspacePath(), "abc123")).thenReturn("+class Parser {}\n");
        var history = List.of(
                new EscalationRecord("D", EscalationStrategy.NOTIFY, 1, EscalationOutcome.ESCALATED, NOW.minusSeconds(120)),
                new EscalationRecord("D", EscalationStrategy.SWITCH_AGENT, 1, EscalationOutcome.APPLIED, NOW));

        Path file = writer.write(task, allocation, history);

        assertEquals(root.resolve("logs/handoff/D.md"), file);
        String content = Files.readString(file);
        assertTrue(content.startsWith("# Handoff: D"));
        assertTrue(content.contains("- Branch: `task/D`"));
        assertTrue(content.contains("notify #1: escalated"));
        assertTrue(content.contains("switch_agent #1: applied"));
        assertTrue(content.contains("ERROR: cannot resolve symbol Foo in Bar.java:12"));
        assertTrue(content.contains("f00dcafe add parser skeleton"));
        assertTrue(content.contains("- created src/Parser.java (40 lines)"));
        assertTrue(content.contains(" M src/Main.java"));
        assertTrue(content.contains("+class Parser {}"));
    }

    @Test
    void gitFailuresAreNotedInsteadOfAborting() throws IOException {
        when(git.commitLog(any(), any())).thenThrow(new GitCommandException("git missing", new IOException("enoent")));
        when(git.diffStat(any(), any())).thenThrow(new GitCommandException("git missing", new IOException("enoent")));
        when(git.statusPorcelain(any())).thenReturn("");
        when(git.diff(any(), any())).thenReturn("");

        String content = Files.readString(writer.write(task, allocation, List.of()));

        assertTrue(content.contains("(unavailable: git missing)"));
        assertTrue(content.contains("## Changed files\n\n_none_"));
    }

    @Test
    void longDiffIsTruncated() {
        when(git.diff(any(), any())).thenReturn("x".repeat(HandoffWriter.MAX_DIFF_CHARS + 500));
        when(git.commitLog(any(), any())).thenReturn("");
        when(git.statusPorcelain(any())).thenReturn("");
        when(git.diffStat(any(), any())).thenReturn(List.of());

        String content = writer.render(task, allocation, List.of());

        assertTrue(content.contains("... (diff truncated)"));
    }

    @Test
    void lastBlockerPicksNewestErrorLine() {
        assertEquals("Traceback (most recent call last):",
                HandoffWriter.lastBlocker(List.of("error: first", "  Traceback (most recent call last):", "ok")));
        assertNull(HandoffWriter.lastBlocker(List.of("all good", "still fine")));
    }
}
