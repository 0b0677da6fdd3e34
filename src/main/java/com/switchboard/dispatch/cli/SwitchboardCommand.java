package com.switchboard.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Switchboard.
 * Routes to subcommands: serve, classify, models, health.
 */
@Command(
        name = "switchboard",
        mixinStandardHelpOptions = true,
        version = "Switchboard 0.1.0",
        description = "Chat-completion gateway: fast-path model routing or sandboxed agent execution",
        subcommands = {
                ServeCommand.class,
                ClassifyCommand.class,
                ModelsCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SwitchboardCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
