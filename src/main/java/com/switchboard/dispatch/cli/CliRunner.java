package com.switchboard.dispatch.cli;

import com.switchboard.SwitchboardApplication;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Hands the process arguments to picocli once the context is up and reports
 * the command's exit code back to Spring Boot.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final SwitchboardCommand rootCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SwitchboardCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // serve returns at once from picocli; the embedded server keeps the JVM alive instead
        if (SwitchboardApplication.isServe(args)) {
            return;
        }
        exitCode = new CommandLine(rootCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
