package io.switchboard.core.registry;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelStatistics(
    @JsonAlias({"total_requests"}) long totalRequests,
    @JsonAlias({"successful_requests"}) long successfulRequests,
    @JsonAlias({"failed_requests"}) long failedRequests,
    @JsonAlias({"total_tokens_used"}) long totalTokensUsed,
    @JsonAlias({"total_cost"}) double totalCost,
    @JsonAlias({"average_response_time"}) double averageResponseTimeMs,
    @JsonAlias({"last_used_at"}) Instant lastUsedAt,
    @JsonAlias({"last_error_at"}) Instant lastErrorAt,
    @JsonAlias({"last_error"}) String lastError
) {
    static final double EMA_ALPHA = 0.1;
    private static final int MAX_ERROR_LENGTH = 500;

    public ModelStatistics {
        lastError = lastError == null ? "" : lastError;
    }

    public static ModelStatistics empty() {
        return new ModelStatistics(0, 0, 0, 0, 0.0, 0.0, null, null, "");
    }

    public double successRate() {
        return totalRequests == 0 ? 0.0 : (double) successfulRequests / totalRequests;
    }

    /**
     * Folds one finished request into the rolling totals. The first sample seeds the moving average.
     */
    public ModelStatistics apply(StatisticsDelta delta) {
        if (delta.success()) {
            double average = averageResponseTimeMs == 0.0
                ? delta.durationMs()
                : EMA_ALPHA * delta.durationMs() + (1 - EMA_ALPHA) * averageResponseTimeMs;
            return new ModelStatistics(
                totalRequests + 1,
                successfulRequests + 1,
                failedRequests,
                totalTokensUsed + delta.tokens(),
                totalCost + delta.cost(),
                average,
                delta.at(),
                lastErrorAt,
                lastError
            );
        }
        String error = delta.error() == null ? "" : delta.error();
        if (error.length() > MAX_ERROR_LENGTH) {
            error = error.substring(0, MAX_ERROR_LENGTH);
        }
        return new ModelStatistics(
            totalRequests + 1,
            successfulRequests,
            failedRequests + 1,
            totalTokensUsed + delta.tokens(),
            totalCost + delta.cost(),
            averageResponseTimeMs,
            delta.at(),
            delta.at(),
            error
        );
    }
}
