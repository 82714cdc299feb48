package com.overseer.core.engine;

import com.overseer.core.events.EventLog;
import com.overseer.core.graph.TaskGraph;
import com.overseer.core.model.Phase;
import com.overseer.core.model.Task;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Fixed facts of one run handed to the {@link Conductor}.
 *
 * @param runId         run identifier
 * @param phases        requested phases
 * @param graph         the full task graph
 * @param selected      tasks of the requested phases, manual ones included
 * @param scheduled     tasks the run has to finish
 * @param includeManual manual tasks take part in this run
 * @param logsDir       directory for logs, side files and handoff artifacts
 * @param events        the run's event log
 */
public record RunContext(
    String runId,
    List<Phase> phases,
    TaskGraph graph,
    List<Task> selected,
    List<Task> scheduled,
    boolean includeManual,
    Path logsDir,
    EventLog events
) {
    public RunContext {
        phases = List.copyOf(phases);
        selected = List.copyOf(selected);
        scheduled = List.copyOf(scheduled);
    }

    public String phaseNames() {
        return phases.stream().map(Phase::wireName).collect(Collectors.joining(","));
    }
}
