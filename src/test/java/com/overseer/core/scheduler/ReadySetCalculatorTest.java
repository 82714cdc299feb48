package com.overseer.core.scheduler;

import com.overseer.core.model.FailureReason;
import com.overseer.core.model.Task;
import com.overseer.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.overseer.core.model.TaskFixtures.manual;
import static com.overseer.core.model.TaskFixtures.task;
import static org.junit.jupiter.api.Assertions.*;

class ReadySetCalculatorTest {

    private ReadySetCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new ReadySetCalculator();
    }

    @Test
    @DisplayName("Independent tasks are all ready at once")
    void independentTasksReady() {
        var tasks = List.of(task("A"), task("B"), task("C"));
        var result = calculator.compute(tasks, Map.of(), Set.of(), false);
        assertEquals(List.of("A", "B", "C"), result.ready());
        assertTrue(result.blocked().isEmpty());
    }

    @Test
    @DisplayName("A, B->A, C->A: B and C become ready together once A succeeded")
    void fanOutAfterDependencySucceeds() {
        var tasks = List.of(task("A"), task("B", "A"), task("C", "A"));

        var before = calculator.compute(tasks, Map.of(), Set.of(), false);
        assertEquals(List.of("A"), before.ready());

        var after = calculator.compute(tasks, Map.of("A", TaskStatus.SUCCEEDED), Set.of("A"), false);
        assertEquals(List.of("B", "C"), after.ready());
    }

    @Test
    @DisplayName("Succeeded status without a logged task_succeeded record is not enough")
    void requiresLoggedSuccess() {
        var tasks = List.of(task("A"), task("B", "A"));
        var result = calculator.compute(tasks, Map.of("A", TaskStatus.SUCCEEDED), Set.of(), false);
        assertTrue(result.ready().isEmpty());
        assertTrue(result.blocked().isEmpty());
    }

    @Test
    @DisplayName("Dependents of a failed task are blocked with the failed dependency as cause")
    void failedDependencyBlocks() {
        var tasks = List.of(task("A"), task("B", "A"));
        var result = calculator.compute(tasks, Map.of("A", TaskStatus.FAILED), Set.of(), false);
        assertEquals(1, result.blocked().size());
        var blocked = result.blocked().get(0);
        assertEquals("B", blocked.taskId());
        assertEquals(FailureReason.DEPENDENCY_FAILED, blocked.reason());
        assertEquals(List.of("A"), blocked.causes());
    }

    @Test
    @DisplayName("Blocked tasks propagate blocking to their own dependents")
    void blockedDependencyBlocks() {
        var tasks = List.of(task("A"), task("B", "A"), task("C", "B"));
        var result = calculator.compute(tasks,
                Map.of("A", TaskStatus.FAILED, "B", TaskStatus.BLOCKED), Set.of(), false);
        assertEquals(List.of("C"), result.blocked().stream().map(ReadySetCalculator.Blocked::taskId).toList());
    }

    @Test
    @DisplayName("Manual tasks are skipped unless included, and their dependents are blocked")
    void manualTasks() {
        Task review = manual(task("review"));
        var tasks = List.of(task("A"), review, task("deploy", "review"));

        var excluded = calculator.compute(tasks, Map.of(), Set.of(), false);
        assertEquals(List.of("A"), excluded.ready());
        assertEquals(1, excluded.blocked().size());
        assertEquals(FailureReason.DEPENDENCY_EXCLUDED, excluded.blocked().get(0).reason());

        var included = calculator.compute(tasks, Map.of(), Set.of(), true);
        assertEquals(List.of("A", "review"), included.ready());
        assertTrue(included.blocked().isEmpty());
    }

    @Test
    @DisplayName("Running and terminal tasks are not offered again")
    void startedTasksIgnored() {
        var tasks = List.of(task("A"), task("B"));
        var result = calculator.compute(tasks,
                Map.of("A", TaskStatus.RUNNING, "B", TaskStatus.SUCCEEDED), Set.of("B"), false);
        assertTrue(result.isEmpty());
    }

    @Test
    @DisplayName("scheduled() drops manual tasks only when not included")
    void scheduledFiltersManual() {
        var tasks = List.of(task("A"), manual(task("M")));
        assertEquals(1, calculator.scheduled(tasks, false).size());
        assertEquals(2, calculator.scheduled(tasks, true).size());
    }
}
