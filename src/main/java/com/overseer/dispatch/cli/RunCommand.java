package com.overseer.dispatch.cli;

import com.overseer.core.OverseerException;
import com.overseer.core.config.ConfigException;
import com.overseer.core.engine.OrchestrationEngine;
import com.overseer.core.engine.RunRequest;
import com.overseer.core.engine.RunResult;
import com.overseer.core.graph.DependencyCycleException;
import com.overseer.core.lock.PhaseLockHeldException;
import com.overseer.core.model.Phase;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: overseer run --config &lt;file&gt; --phase &lt;name&gt;
 * <p>
 * Runs every task of the requested phases in dependency order and writes the run summary.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run the tasks of one or more phases")
@Component
public class RunCommand implements Callable<Integer> {

    @Option(names = {"--config", "-c"}, required = true, description = "Task file (JSON or YAML)")
    private Path config;

    @Option(names = {"--phase", "-p"}, required = true, converter = PhaseConverter.class,
            description = "Phase to run; repeat for several phases")
    private List<Phase> phases;

    @Option(names = "--dry-run", description = "Validate and print the dependency levels without running anything")
    private boolean dryRun;

    @Option(names = "--include-manual", description = "Also run tasks marked manual")
    private boolean includeManual;

    private final OrchestrationEngine engine;
    private final Clock clock;

    public RunCommand(OrchestrationEngine engine, Clock clock) {
        this.engine = engine;
        this.clock = clock;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        RunResult result;
        try {
            result = engine.run(new RunRequest(config, phases, dryRun, includeManual));
        } catch (ConfigException e) {
            ConsoleOutput.error("Pre-flight failed:");
            ConsoleOutput.problems(e.problems());
            return ExitCodes.PREFLIGHT;
        } catch (DependencyCycleException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.PREFLIGHT;
        } catch (PhaseLockHeldException e) {
            ConsoleOutput.error(e.getMessage());
            ConsoleOutput.info("If that run is gone, remove the lock with: overseer unlock --config "
                    + config + " --phase " + (e.holder() != null ? e.holder().phase() : "main"));
            return ExitCodes.LOCK_HELD;
        } catch (OverseerException e) {
            ConsoleOutput.error("Run failed: " + e.getMessage());
            return ExitCodes.TASKS_FAILED;
        }

        if (result.dryRun()) {
            ConsoleOutput.info("Dry run " + result.runId() + ": " + result.statuses().size()
                    + " task(s) would run");
            ConsoleOutput.levels(result.levels());
            if (!result.excluded().isEmpty()) {
                ConsoleOutput.info("Manual, not scheduled: " + String.join(", ", result.excluded()));
            }
            return ExitCodes.OK;
        }

        if (result.summary() != null) {
            ConsoleOutput.summary(result.summary(), clock.instant());
        }
        if (result.summaryFile() != null) {
            ConsoleOutput.info("Summary: " + result.summaryFile());
        }
        ConsoleOutput.metrics(result.metrics());
        if (result.succeeded()) {
            ConsoleOutput.success("All " + result.statuses().size() + " task(s) succeeded");
            return ExitCodes.OK;
        }
        ConsoleOutput.error("Run " + result.status());
        return ExitCodes.TASKS_FAILED;
    }
}
