package com.overseer.workspace;

import com.overseer.core.metrics.OverseerMetrics;
import com.overseer.core.model.ReleaseOutcome;
import com.overseer.core.model.Task;
import com.overseer.core.model.TaskFixtures;
import com.overseer.core.model.WorkspaceAllocation;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

class WorkspaceAllocatorTest {

    @TempDir
    Path root;

    private GitWorkspaceManager git;
    private SimpleMeterRegistry registry;
    private WorkspaceAllocator allocator;

    @BeforeEach
    void setUp() {
        git = mock(GitWorkspaceManager.class);
        registry = new SimpleMeterRegistry();
        allocator = new WorkspaceAllocator(root, git, true,
                Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC), new OverseerMetrics(registry));
        when(git.resolveCommit(root, "HEAD")).thenReturn("abc123");
        when(git.addWorktree(any(), any(), anyString(), anyString()))
                .thenAnswer(inv -> GitWorkspaceManager.WorktreeResult.success(inv.getArgument(1)));
        when(git.removeWorktree(any(), any())).thenReturn(true);
    }

    private double operations(String operation, boolean success) {
        var counter = registry.find("overseer.worktree.operations")
                .tag("operation", operation).tag("success", String.valueOf(success)).counter();
        return counter == null ? 0 : counter.count();
    }

    @Nested
    @DisplayName("Allocate")
    class Allocate {

        @Test
        @DisplayName("Creates the branch and worktree from the task's base reference")
        void createsWorktree() {
            Task task = TaskFixtures.task("A", root);
            WorkspaceAllocation allocation = allocator.allocate(task);

            assertEquals(task.workspacePath(), allocation.path());
            assertEquals("task/A", allocation.branch());
            assertEquals("abc123", allocation.baseCommit());
            assertTrue(allocation.isLive());
            verify(git).addWorktree(root, task.workspacePath(), "task/A", "HEAD");
            assertTrue(Files.isDirectory(task.workspacePath().getParent()));
            assertEquals(1.0, operations("allocate", true));
        }

        @Test
        @DisplayName("A path already held by a live allocation is a conflict")
        void pathAlreadyAllocated() {
            Task a = TaskFixtures.task("A", root);
            allocator.allocate(a);
            Task twin = new Task("B", a.phase(), "task/B", a.workspacePath(), "HEAD", a.runner(), null,
                    root.resolve("logs/B.log"), Set.of(), false, a.watchdog(), a.escalation());

            var e = assertThrows(WorkspaceConflictException.class, () -> allocator.allocate(twin));
            assertTrue(e.getMessage().contains("to task A"));
            verify(git, times(1)).addWorktree(any(), any(), anyString(), anyString());
        }

        @Test
        @DisplayName("An existing directory that is not a worktree is a conflict and frees the path")
        void existingPlainDirectory() throws IOException {
            Task task = TaskFixtures.task("A", root);
            Files.createDirectories(task.workspacePath());
            when(git.isWorktree(task.workspacePath())).thenReturn(false);

            assertThrows(WorkspaceConflictException.class, () -> allocator.allocate(task));
            assertTrue(allocator.liveAllocations().isEmpty());
            assertEquals(1.0, operations("allocate", false));

            when(git.isWorktree(task.workspacePath())).thenReturn(true);
            when(git.currentBranch(task.workspacePath())).thenReturn("task/A");
            assertNotNull(allocator.allocate(task));
        }

        @Test
        @DisplayName("An existing worktree of another branch is a conflict")
        void existingWorktreeOtherBranch() throws IOException {
            Task task = TaskFixtures.task("A", root);
            Files.createDirectories(task.workspacePath());
            when(git.isWorktree(task.workspacePath())).thenReturn(true);
            when(git.currentBranch(task.workspacePath())).thenReturn("main");

            var e = assertThrows(WorkspaceConflictException.class, () -> allocator.allocate(task));
            assertTrue(e.getMessage().contains("branch main"));
        }

        @Test
        @DisplayName("An existing worktree of the task branch is reused")
        void existingWorktreeReused() throws IOException {
            Task task = TaskFixtures.task("A", root);
            Files.createDirectories(task.workspacePath());
            when(git.isWorktree(task.workspacePath())).thenReturn(true);
            when(git.currentBranch(task.workspacePath())).thenReturn("task/A");

            assertTrue(allocator.allocate(task).isLive());
            verify(git, never()).addWorktree(any(), any(), anyString(), anyString());
        }

        @Test
        @DisplayName("A failing git worktree add is reported as a conflict")
        void gitFailure() {
            when(git.addWorktree(any(), any(), anyString(), anyString()))
                    .thenReturn(GitWorkspaceManager.WorktreeResult.failure("fatal: invalid reference"));

            var e = assertThrows(WorkspaceConflictException.class,
                    () -> allocator.allocate(TaskFixtures.task("A", root)));
            assertEquals("fatal: invalid reference", e.getMessage());
        }
    }

    @Nested
    @DisplayName("Release")
    class Release {

        @Test
        @DisplayName("Snapshots pending work, removes the worktree and keeps the branch")
        void snapshotsAndRemoves() {
            WorkspaceAllocation allocation = allocator.allocate(TaskFixtures.task("A", root));

            assertTrue(allocator.release(allocation, ReleaseOutcome.SUCCESS));

            verify(git).commitAll(eq(allocation.path()), contains("(success)"));
            verify(git).removeWorktree(root, allocation.path());
            assertFalse(allocation.isLive());
            assertTrue(allocator.liveAllocations().isEmpty());
            assertEquals(1.0, operations("release", true));
        }

        @Test
        @DisplayName("Releasing twice does nothing the second time")
        void releaseOnce() {
            WorkspaceAllocation allocation = allocator.allocate(TaskFixtures.task("A", root));
            allocator.release(allocation, ReleaseOutcome.FAILURE);

            assertFalse(allocator.release(allocation, ReleaseOutcome.FAILURE));
            verify(git, times(1)).removeWorktree(any(), any());
        }

        @Test
        @DisplayName("A released path can be allocated again")
        void pathReusable() {
            Task task = TaskFixtures.task("A", root);
            allocator.release(allocator.allocate(task), ReleaseOutcome.RESTART);
            assertTrue(allocator.allocate(task).isLive());
        }

        @Test
        @DisplayName("Without snapshots nothing is committed")
        void noSnapshot() {
            var plain = new WorkspaceAllocator(root, git, false, Clock.systemUTC(), new OverseerMetrics(registry));
            plain.release(plain.allocate(TaskFixtures.task("A", root)), ReleaseOutcome.SUCCESS);
            verify(git, never()).commitAll(any(), anyString());
        }

        @Test
        @DisplayName("A git error while releasing still frees the allocation")
        void gitErrorStillFrees() {
            WorkspaceAllocation allocation = allocator.allocate(TaskFixtures.task("A", root));
            when(git.commitAll(any(), anyString()))
                    .thenThrow(new GitCommandException("git vanished", new IOException("no such file")));

            assertTrue(allocator.release(allocation, ReleaseOutcome.FAILURE));
            assertTrue(allocator.liveAllocations().isEmpty());
            assertEquals(1.0, operations("release", false));
        }

        @Test
        @DisplayName("releaseAll frees every live allocation")
        void releaseAll() {
            allocator.allocate(TaskFixtures.task("A", root));
            allocator.allocate(TaskFixtures.task("B", root));

            allocator.releaseAll(ReleaseOutcome.FAILURE);

            assertTrue(allocator.liveAllocations().isEmpty());
            verify(git, times(2)).removeWorktree(any(), any());
        }
    }
}
