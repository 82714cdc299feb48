package com.overseer.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Overseer.
 * Routes to subcommands: run, status, summary, unlock.
 */
@Command(
        name = "overseer",
        mixinStandardHelpOptions = true,
        version = "Overseer 0.1.0",
        description = "Runs coding agents as a dependency graph of tasks in isolated git worktrees",
        subcommands = {
                RunCommand.class,
                StatusCommand.class,
                SummaryCommand.class,
                UnlockCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class OverseerCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
