package io.switchboard.core.usage;

import static org.assertj.core.api.Assertions.assertThat;

import io.switchboard.core.model.ErrorKind;
import io.switchboard.core.model.TaskType;
import io.switchboard.core.support.InMemoryCallLogStore;
import io.switchboard.core.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class UsageReportServiceTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-10T12:00:00Z"));
    private final InMemoryCallLogStore store = new InMemoryCallLogStore();
    private final UsageReportService reports = new UsageReportService(store, clock);

    @Test
    void shouldSummarizeWindow() throws Exception {
        store.append(entry("m1", CallLogStatus.SUCCESS, 100, 0.01, "2025-01-10T11:00:00Z"));
        store.append(entry("m1", CallLogStatus.SUCCESS, 300, 0.02, "2025-01-10T11:10:00Z"));
        store.append(entry("m2", CallLogStatus.FAILED, 900, 0.0, "2025-01-10T11:20:00Z"));
        store.append(entry("m2", CallLogStatus.SUCCESS, 200, 0.03, "2025-01-10T11:30:00Z"));
        store.append(entry("m1", CallLogStatus.SUCCESS, 50, 1.0, "2025-01-08T11:30:00Z"));

        UsageSummary summary = reports.summary(Duration.ofHours(24));

        assertThat(summary.totalRequests()).isEqualTo(4);
        assertThat(summary.succeeded()).isEqualTo(3);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.successRate()).isEqualTo(75.0);
        assertThat(summary.p50LatencyMs()).isEqualTo(200.0);
        assertThat(summary.p95LatencyMs()).isEqualTo(300.0);
        assertThat(summary.totalCost()).isEqualTo(0.06);
        assertThat(summary.totalTokens()).isEqualTo(60);
        assertThat(summary.models()).extracting(ModelUsage::modelId).containsExactly("m1", "m2");
        assertThat(summary.models().get(1).successRate()).isEqualTo(50.0);
        assertThat(summary.models().get(0).averageLatencyMs()).isEqualTo(200.0);
    }

    @Test
    void shouldCountCancelledAndTimedOutSeparately() throws Exception {
        store.append(entry("m1", CallLogStatus.CANCELLED, 10, 0.0, "2025-01-10T11:00:00Z"));
        store.append(entry("m1", CallLogStatus.TIMEOUT, 10, 0.0, "2025-01-10T11:00:00Z"));
        store.append(entry("", CallLogStatus.FAILED, 1, 0.0, "2025-01-10T11:00:00Z"));

        UsageSummary summary = reports.summary(Duration.ofHours(1));

        assertThat(summary.cancelled()).isEqualTo(1);
        assertThat(summary.timedOut()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.p50LatencyMs()).isZero();
        assertThat(summary.models()).extracting(ModelUsage::modelId).containsExactly("m1");
    }

    @Test
    void shouldReturnZeroesForEmptyLog() throws Exception {
        UsageSummary summary = reports.summary(Duration.ofHours(24));

        assertThat(summary.totalRequests()).isZero();
        assertThat(summary.successRate()).isZero();
        assertThat(summary.averageCost()).isZero();
        assertThat(summary.models()).isEmpty();
    }

    private static CallLogEntry entry(String modelId, CallLogStatus status, long durationMs, double cost, String at) {
        ErrorKind kind = status == CallLogStatus.SUCCESS ? null : ErrorKind.API_ERROR;
        return new CallLogEntry(modelId + at + status, "r", modelId, "gemini", "gemini-1.5-flash",
            TaskType.SUMMARIZATION, "{}", "{}", 10, 5, 15, cost, durationMs, status, kind, "", 1, Instant.parse(at));
    }
}
