package com.overseer.core.graph;

import com.overseer.core.model.Phase;
import com.overseer.core.model.RunnerSpec;
import com.overseer.core.model.Task;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * Validated, acyclic task graph. Immutable once built; iteration follows declaration order.
 */
public final class TaskGraph {

    private final Map<String, Task> tasks;
    private final List<Task> topologicalOrder;
    private final Map<String, RunnerSpec> runners;

    TaskGraph(List<Task> declared, Map<String, RunnerSpec> runners) {
        this.runners = Collections.unmodifiableMap(new LinkedHashMap<>(runners));
        var byId = new LinkedHashMap<String, Task>();
        for (Task task : declared) {
            byId.put(task.id(), task);
        }
        this.tasks = Collections.unmodifiableMap(byId);
        this.topologicalOrder = computeTopologicalOrder(declared);
    }

    public Task task(String id) {
        Task task = tasks.get(id);
        if (task == null) {
            throw new NoSuchElementException("Unknown task: " + id);
        }
        return task;
    }

    public boolean contains(String id) {
        return tasks.containsKey(id);
    }

    public Collection<Task> tasks() {
        return tasks.values();
    }

    public int size() {
        return tasks.size();
    }

    /** Named runner from the configuration, used when escalation switches a task's worker. */
    public Optional<RunnerSpec> runner(String name) {
        return Optional.ofNullable(runners.get(name));
    }

    public Map<String, RunnerSpec> runners() {
        return runners;
    }

    /**
     * Tasks of the given phases, in declaration order. Manual tasks are included too; whether
     * they may run is decided when the ready set is computed.
     */
    public List<Task> inPhases(Set<Phase> phases) {
        return tasks.values().stream()
                .filter(t -> phases.contains(t.phase()))
                .toList();
    }

    /** Every task ordered so that each one follows all of its dependencies. */
    public List<Task> topologicalOrder() {
        return topologicalOrder;
    }

    /**
     * Groups tasks by dependency depth: level 0 has no dependencies, level n depends on
     * at least one task of level n-1.
     */
    public List<List<Task>> levels() {
        var depth = new HashMap<String, Integer>();
        var levels = new ArrayList<List<Task>>();
        for (Task task : topologicalOrder) {
            int level = 0;
            for (String dep : task.dependsOn()) {
                level = Math.max(level, depth.get(dep) + 1);
            }
            depth.put(task.id(), level);
            while (levels.size() <= level) {
                levels.add(new ArrayList<>());
            }
            levels.get(level).add(task);
        }
        return levels.stream().map(List::copyOf).toList();
    }

    // Kahn's algorithm, always taking the earliest declared task whose dependencies are placed
    private static List<Task> computeTopologicalOrder(List<Task> declared) {
        var placed = new HashSet<String>();
        var order = new ArrayList<Task>(declared.size());
        var remaining = new ArrayList<>(declared);
        while (!remaining.isEmpty()) {
            Task next = null;
            for (Task candidate : remaining) {
                if (placed.containsAll(candidate.dependsOn())) {
                    next = candidate;
                    break;
                }
            }
            if (next == null) {
                throw new IllegalStateException("Graph is not acyclic: " + remaining.stream().map(Task::id).toList());
            }
            remaining.remove(next);
            placed.add(next.id());
            order.add(next);
        }
        return List.copyOf(order);
    }
}
