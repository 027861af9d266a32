package io.switchboard.core.usage;

public record ModelUsage(
    String modelId,
    String provider,
    String modelName,
    int requests,
    int succeeded,
    double successRate,
    double averageLatencyMs,
    long totalTokens,
    double totalCost
) {
}
