package com.overseer.core.scheduler;

import com.overseer.core.model.FailureReason;
import com.overseer.core.model.Task;
import com.overseer.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes which tasks may start next and which can never start.
 *
 * <p>A task is ready when every dependency has a {@code task_succeeded} record in the event log.
 * A task whose dependency failed or was blocked becomes blocked itself; so does a task that depends
 * on a manual task left out of the run. Manual tasks are only considered when manual inclusion
 * was requested.
 */
@Service
public class ReadySetCalculator {

    private static final Logger log = LoggerFactory.getLogger(ReadySetCalculator.class);

    /**
     * A task that can never run, with the dependencies responsible.
     */
    public record Blocked(String taskId, FailureReason reason, List<String> causes) {}

    /**
     * @param ready   eligible task ids in declaration order (not capped)
     * @param blocked tasks to move to {@link TaskStatus#BLOCKED}
     */
    public record ReadySet(List<String> ready, List<Blocked> blocked) {
        public boolean isEmpty() {
            return ready.isEmpty() && blocked.isEmpty();
        }
    }

    /**
     * Evaluates every task that has not started yet.
     *
     * @param tasks         tasks of the requested phases, in declaration order
     * @param statuses      current status of each task
     * @param succeeded     ids with a {@code task_succeeded} record in the event log
     * @param includeManual whether manual tasks take part in this run
     */
    public ReadySet compute(List<Task> tasks, Map<String, TaskStatus> statuses,
                            Set<String> succeeded, boolean includeManual) {
        var ready = new ArrayList<String>();
        var blocked = new ArrayList<Blocked>();
        var excluded = new LinkedHashMap<String, Task>();
        for (Task task : tasks) {
            if (task.manual() && !includeManual) {
                excluded.put(task.id(), task);
            }
        }

        for (Task task : tasks) {
            if (excluded.containsKey(task.id())) {
                continue;
            }
            TaskStatus status = statuses.getOrDefault(task.id(), TaskStatus.PENDING);
            if (status != TaskStatus.PENDING && status != TaskStatus.READY) {
                continue;
            }

            var failedDeps = new ArrayList<String>();
            var excludedDeps = new ArrayList<String>();
            boolean satisfied = true;
            for (String dep : task.dependsOn()) {
                TaskStatus depStatus = statuses.getOrDefault(dep, TaskStatus.PENDING);
                if (depStatus == TaskStatus.FAILED || depStatus == TaskStatus.BLOCKED) {
                    failedDeps.add(dep);
                } else if (excluded.containsKey(dep)) {
                    excludedDeps.add(dep);
                }
                if (!succeeded.contains(dep)) {
                    satisfied = false;
                }
            }

            if (!failedDeps.isEmpty()) {
                log.debug("  {} blocked by failed dependencies {}", task.id(), failedDeps);
                blocked.add(new Blocked(task.id(), FailureReason.DEPENDENCY_FAILED, failedDeps));
            } else if (!excludedDeps.isEmpty()) {
                log.debug("  {} blocked by excluded manual dependencies {}", task.id(), excludedDeps);
                blocked.add(new Blocked(task.id(), FailureReason.DEPENDENCY_EXCLUDED, excludedDeps));
            } else if (satisfied) {
                ready.add(task.id());
            }
        }
        return new ReadySet(List.copyOf(ready), List.copyOf(blocked));
    }

    /** Tasks the run is expected to finish: everything except manual tasks left out. */
    public List<Task> scheduled(List<Task> tasks, boolean includeManual) {
        return tasks.stream()
                .filter(t -> includeManual || !t.manual())
                .toList();
    }
}
