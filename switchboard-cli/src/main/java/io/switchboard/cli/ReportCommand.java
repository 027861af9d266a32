package io.switchboard.cli;

import io.switchboard.core.usage.ModelUsage;
import io.switchboard.core.usage.UsageSummary;
import java.time.Duration;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "report", description = "Summarize the call log")
public final class ReportCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--hours", defaultValue = "24", description = "Window to report on, in hours")
    long hours;

    public ReportCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            UsageSummary summary = context.reports().summary(Duration.ofHours(Math.max(1, hours)));
            System.out.println("Since: " + summary.since());
            System.out.println("Requests: " + summary.totalRequests()
                + " (success " + summary.succeeded()
                + ", failed " + summary.failed()
                + ", timeout " + summary.timedOut()
                + ", cancelled " + summary.cancelled() + ")");
            System.out.println("Success rate: " + summary.successRate() + "%");
            System.out.println("Latency p50/p95: " + summary.p50LatencyMs() + " / " + summary.p95LatencyMs() + " ms");
            System.out.println("Tokens: " + summary.totalTokens()
                + " (prompt " + summary.promptTokens() + ", completion " + summary.completionTokens() + ")");
            System.out.println("Cost: " + summary.totalCost() + " (avg " + summary.averageCost() + ")");
            for (ModelUsage model : summary.models()) {
                System.out.printf(
                    "  %-24s %-24s requests=%d success=%.2f%% avg=%.0fms tokens=%d cost=%.4f%n",
                    model.modelId(),
                    model.provider() + ":" + model.modelName(),
                    model.requests(),
                    model.successRate(),
                    model.averageLatencyMs(),
                    model.totalTokens(),
                    model.totalCost()
                );
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Report command failed: " + e.getMessage());
            return 1;
        }
    }
}
