package com.overseer.core.graph;

import com.overseer.core.OverseerException;

import java.util.List;

/**
 * The task graph contains a dependency cycle. The cycle is reported with its first task
 * repeated at the end, e.g. {@code [a, b, a]}.
 */
public class DependencyCycleException extends OverseerException {

    private final List<String> cycle;

    public DependencyCycleException(List<String> cycle) {
        super("Dependency cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
