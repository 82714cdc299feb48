package com.overseer.core.engine;

import com.overseer.core.model.Phase;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * What the operator asked for on the command line.
 */
public record RunRequest(Path configFile, List<Phase> phases, boolean dryRun, boolean includeManual) {
    public RunRequest {
        phases = phases.stream().distinct().toList();
    }

    public Set<Phase> phaseSet() {
        return Set.copyOf(phases);
    }
}
