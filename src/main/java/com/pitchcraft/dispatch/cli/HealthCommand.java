package com.pitchcraft.dispatch.cli;

import com.pitchcraft.core.health.HealthCheckService;
import com.pitchcraft.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: pitchcraft health
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Runnable {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        for (HealthStatus check : healthCheckService.checkAll()) {
            String line = String.format("%-14s %-9s %s", check.component(), check.status(), check.detail());
            switch (check.status()) {
                case UP -> ConsoleOutput.success(line);
                case DEGRADED -> ConsoleOutput.info(line);
                case DOWN -> ConsoleOutput.error(line);
            }
        }
    }
}
