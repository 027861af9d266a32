package io.switchboard.core.gateway;

import io.switchboard.core.model.ProviderType;
import java.time.Instant;

/**
 * Read-only operator view of one active model.
 *
 * @param health {@code healthy}, {@code unhealthy} or {@code unknown}
 */
public record ModelStatsView(
    String id,
    String key,
    ProviderType provider,
    int priority,
    String health,
    String healthMessage,
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    double successRate,
    double averageResponseTimeMs,
    long totalTokens,
    double totalCost,
    Instant lastUsedAt
) {
}
