package com.overseer.core.engine;

import com.overseer.core.config.RunConfig;
import com.overseer.core.graph.TaskGraph;
import com.overseer.core.model.Phase;
import com.overseer.core.model.Task;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A validated run before anything is locked or started.
 *
 * @param runId      identifier of the run
 * @param paths      resolved project, logs and summary directories
 * @param config     the parsed task file
 * @param graph      the full task graph
 * @param phases     requested phases in request order
 * @param selected   tasks of the requested phases, manual ones included
 * @param scheduled  tasks the run will drive to a terminal status
 * @param excluded   manual tasks left out of this run
 */
public record RunPlan(
    String runId,
    RunPaths paths,
    RunConfig config,
    TaskGraph graph,
    List<Phase> phases,
    List<Task> selected,
    List<Task> scheduled,
    List<String> excluded
) {
    public RunPlan {
        phases = List.copyOf(phases);
        selected = List.copyOf(selected);
        scheduled = List.copyOf(scheduled);
        excluded = List.copyOf(excluded);
    }

    public Set<Phase> phaseSet() {
        return Set.copyOf(phases);
    }

    /** Dependency levels of the scheduled tasks; tasks in one level may run concurrently. */
    public List<List<String>> levels() {
        Set<String> ids = scheduled.stream().map(Task::id).collect(Collectors.toSet());
        return graph.levels().stream()
                .map(level -> level.stream().map(Task::id).filter(ids::contains).toList())
                .filter(level -> !level.isEmpty())
                .toList();
    }
}
