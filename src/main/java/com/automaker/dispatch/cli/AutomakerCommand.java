package com.automaker.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Automaker.
 * Routes to subcommands: serve, features, run, log, status, mcp-status.
 */
@Command(
        name = "automaker",
        mixinStandardHelpOptions = true,
        version = "Automaker 0.1.0",
        description = "Auto-mode engine that implements backlog features with coding agents in git worktrees",
        subcommands = {
                ServeCommand.class,
                FeaturesCommand.class,
                RunCommand.class,
                LogCommand.class,
                StatusCommand.class,
                McpStatusCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AutomakerCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
