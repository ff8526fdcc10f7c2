package com.presence.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: evaluate, stages, health, serve.
 */
@Command(
        name = "presence",
        mixinStandardHelpOptions = true,
        version = "Presence Engine 0.1.0",
        description = "Behavioral decision layer for a conversational companion",
        subcommands = {
                EvaluateCommand.class,
                StagesCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PresenceCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
