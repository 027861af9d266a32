package io.switchboard.core.usage;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate view of the call log since {@link #since()}. Rates are percentages.
 */
public record UsageSummary(
    Instant since,
    int totalRequests,
    int succeeded,
    int failed,
    int timedOut,
    int cancelled,
    double successRate,
    double p50LatencyMs,
    double p95LatencyMs,
    double totalCost,
    double averageCost,
    long promptTokens,
    long completionTokens,
    long totalTokens,
    List<ModelUsage> models
) {
    public UsageSummary {
        models = models == null ? List.of() : List.copyOf(models);
    }
}
