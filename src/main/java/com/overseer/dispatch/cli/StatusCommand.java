package com.overseer.dispatch.cli;

import com.overseer.core.OverseerException;
import com.overseer.core.engine.OrchestrationEngine;
import com.overseer.core.model.Phase;
import com.overseer.core.model.PhaseLock;
import com.overseer.core.summary.RunSummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: overseer status --config &lt;file&gt; [--run-id &lt;id&gt;]
 * <p>
 * Reduces the event stream of the latest (or the given) run, including runs still in progress,
 * and lists the phase locks currently held.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show the status of a run")
@Component
public class StatusCommand implements Callable<Integer> {

    @Option(names = {"--config", "-c"}, required = true, description = "Task file (JSON or YAML)")
    private Path config;

    @Option(names = "--run-id", description = "Run to show (default: the latest)")
    private String runId;

    private final OrchestrationEngine engine;
    private final Clock clock;

    public StatusCommand(OrchestrationEngine engine, Clock clock) {
        this.engine = engine;
        this.clock = clock;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        Optional<RunSummary> summary;
        Map<Phase, Optional<PhaseLock>> locks;
        try {
            summary = engine.status(config, runId);
            locks = engine.heldLocks(config);
        } catch (OverseerException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.PREFLIGHT;
        }

        locks.forEach((phase, holder) -> ConsoleOutput.warn("Phase lock " + phase.wireName() + " held by "
                + holder.map(h -> "run " + h.holderRunId() + " since " + h.acquiredAt()).orElse("an unknown run")));

        if (summary.isEmpty()) {
            ConsoleOutput.error(runId == null ? "No runs recorded yet" : "Run not found: " + runId);
            return ExitCodes.TASKS_FAILED;
        }
        ConsoleOutput.summary(summary.get(), clock.instant());
        return ExitCodes.OK;
    }
}
