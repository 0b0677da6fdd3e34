package com.switchboard.dispatch.cli;

import com.switchboard.core.health.HealthCheckService;
import com.switchboard.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: switchboard health
 * <p>
 * Exits with 1 when a component is DOWN, so it can back a container health probe.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check gateway configuration health")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = {"-v", "--verbose"}, description = "Also print component metadata")
    private boolean verbose;

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        List<HealthStatus> checks = healthCheckService.checkAll();
        for (HealthStatus check : checks) {
            String line = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(line);
                case DEGRADED -> ConsoleOutput.warn(line);
                case DOWN -> ConsoleOutput.error(line);
            }
            if (verbose) {
                check.metadata().forEach((key, value) -> System.out.println("    " + key + " = " + value));
            }
        }
        ConsoleOutput.rule();

        long degraded = checks.stream().filter(c -> c.status() == HealthStatus.Status.DEGRADED).count();
        if (!checks.stream().allMatch(HealthStatus::serving)) {
            ConsoleOutput.error("Gateway cannot serve requests");
            return 1;
        }
        if (degraded > 0) {
            ConsoleOutput.warn("Serving with " + degraded + " degraded component(s)");
        } else {
            ConsoleOutput.success("All components operational");
        }
        return 0;
    }
}
