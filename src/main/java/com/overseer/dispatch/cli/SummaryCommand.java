package com.overseer.dispatch.cli;

import com.overseer.core.OverseerException;
import com.overseer.core.engine.OrchestrationEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: overseer summary --config &lt;file&gt; [--run-id &lt;id&gt;]
 * <p>
 * Rewrites the markdown summary of a run from its event stream.
 */
@Command(name = "summary", mixinStandardHelpOptions = true, description = "Regenerate the summary report of a run")
@Component
public class SummaryCommand implements Callable<Integer> {

    @Option(names = {"--config", "-c"}, required = true, description = "Task file (JSON or YAML)")
    private Path config;

    @Option(names = "--run-id", description = "Run to summarize (default: the latest)")
    private String runId;

    private final OrchestrationEngine engine;

    public SummaryCommand(OrchestrationEngine engine) {
        this.engine = engine;
    }

    @Override
    public Integer call() {
        Optional<Path> file;
        try {
            file = engine.regenerateSummary(config, runId);
        } catch (OverseerException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.PREFLIGHT;
        }
        if (file.isEmpty()) {
            ConsoleOutput.error(runId == null ? "No runs recorded yet" : "Run not found: " + runId);
            return ExitCodes.TASKS_FAILED;
        }
        ConsoleOutput.success("Summary written to " + file.get());
        return ExitCodes.OK;
    }
}
