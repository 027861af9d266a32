package io.switchboard.cli;

import io.switchboard.core.gateway.ModelStatsView;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "health", description = "Probe every active model now")
public final class HealthCommand implements Callable<Integer> {
    private final CliContext context;

    public HealthCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<ModelStatsView> models = context.gateway().probeAll();
            if (models.isEmpty()) {
                System.out.println("No active models");
                return 0;
            }
            boolean anyHealthy = false;
            for (ModelStatsView model : models) {
                anyHealthy |= "healthy".equals(model.health());
                System.out.printf("%-32s %-9s %s%n", model.key(), model.health(), model.healthMessage());
            }
            return anyHealthy ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Health command failed: " + e.getMessage());
            return 1;
        }
    }
}
