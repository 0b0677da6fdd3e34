package com.switchboard.dispatch.cli;

import com.switchboard.core.engine.RequestPlan;
import com.switchboard.core.model.ModelSpec;
import com.switchboard.core.model.TaskCategory;
import picocli.CommandLine;

import java.util.Locale;
import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for the Switchboard CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SWITCHBOARD v0.1.0|@"));
        rule();
    }

    public static void rule() {
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SWITCHBOARD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void reasoning(String text) {
        System.out.print(CommandLine.Help.Ansi.AUTO.string("@|faint " + text + "|@"));
    }

    public static void model(ModelSpec model) {
        String categories = model.taskCategories().stream()
                .map(TaskCategory::wireName)
                .sorted()
                .collect(Collectors.joining(", "));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold " + model.priority() + "|@ " + model.id()
                        + (model.supportsVision() ? " @|fg(magenta) [vision]|@" : "")
                        + " @|faint (" + categories + "; timeout " + model.callTimeout().toSeconds() + "s)|@"));
    }

    public static void plan(RequestPlan plan) {
        var complexity = plan.complexity();
        String path = complexity.needsAgent() ? "@|bold,fg(magenta) AGENT|@" : "@|bold,fg(green) FAST|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PATH]|@ " + path + " (" + complexity.reason() + ")"));
        if (!complexity.matchedKeywords().isEmpty()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(cyan) [KEYWORDS]|@ " + String.join(", ", complexity.matchedKeywords())));
        }
        if (plan.task() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(cyan) [TASK]|@ " + plan.task().category().wireName()
                            + String.format(Locale.ROOT, " (confidence %.2f)", plan.task().confidence())));
        }
        var decision = plan.decision();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PRIMARY]|@ " + decision.primary().id()));
        for (ModelSpec fallback : decision.fallbackChain()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) ->|@ " + fallback.id()));
        }
    }
}
