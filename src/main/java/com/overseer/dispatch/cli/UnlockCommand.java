package com.overseer.dispatch.cli;

import com.overseer.core.OverseerException;
import com.overseer.core.engine.OrchestrationEngine;
import com.overseer.core.model.Phase;
import com.overseer.core.model.PhaseLock;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: overseer unlock --config &lt;file&gt; --phase &lt;name&gt;
 * <p>
 * Removes a stale phase lock left behind by a run that no longer exists.
 */
@Command(name = "unlock", mixinStandardHelpOptions = true, description = "Remove a stale phase lock")
@Component
public class UnlockCommand implements Callable<Integer> {

    @Option(names = {"--config", "-c"}, required = true, description = "Task file (JSON or YAML)")
    private Path config;

    @Option(names = {"--phase", "-p"}, required = true, converter = PhaseConverter.class,
            description = "Phase whose lock to remove")
    private Phase phase;

    private final OrchestrationEngine engine;

    public UnlockCommand(OrchestrationEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        try {
            Map<Phase, Optional<PhaseLock>> held = engine.heldLocks(config);
            if (!held.containsKey(phase)) {
                ConsoleOutput.info("No " + phase.wireName() + " phase lock present");
                return ExitCodes.TASKS_FAILED;
            }
            Optional<PhaseLock> holder = engine.unlock(config, phase);
            ConsoleOutput.warn("Removed " + phase.wireName() + " phase lock held by "
                    + holder.map(h -> "run " + h.holderRunId() + " since " + h.acquiredAt()).orElse("an unknown run"));
            return ExitCodes.OK;
        } catch (OverseerException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.PREFLIGHT;
        }
    }
}
