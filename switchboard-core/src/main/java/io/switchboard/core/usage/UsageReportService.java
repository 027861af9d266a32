package io.switchboard.core.usage;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class UsageReportService {
    private final CallLogStore store;
    private final Clock clock;

    public UsageReportService(CallLogStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public UsageSummary summary(Duration window) throws IOException {
        return summary(clock.instant().minus(window));
    }

    public UsageSummary summary(Instant since) throws IOException {
        List<CallLogEntry> entries = store.list(since);

        int succeeded = count(entries, CallLogStatus.SUCCESS);
        int failed = count(entries, CallLogStatus.FAILED);
        int timedOut = count(entries, CallLogStatus.TIMEOUT);
        int cancelled = count(entries, CallLogStatus.CANCELLED);

        List<Double> latencies = entries.stream()
            .filter(CallLogEntry::succeeded)
            .map(e -> (double) e.durationMs())
            .sorted()
            .toList();

        double totalCost = entries.stream().mapToDouble(CallLogEntry::cost).sum();
        double averageCost = entries.isEmpty() ? 0.0 : totalCost / entries.size();

        return new UsageSummary(
            since,
            entries.size(),
            succeeded,
            failed,
            timedOut,
            cancelled,
            round2(percentage(succeeded, entries.size())),
            round2(percentile(latencies, 50)),
            round2(percentile(latencies, 95)),
            round4(totalCost),
            round4(averageCost),
            entries.stream().mapToLong(CallLogEntry::promptTokens).sum(),
            entries.stream().mapToLong(CallLogEntry::completionTokens).sum(),
            entries.stream().mapToLong(CallLogEntry::totalTokens).sum(),
            perModel(entries)
        );
    }

    private List<ModelUsage> perModel(List<CallLogEntry> entries) {
        Map<String, List<CallLogEntry>> byModel = new LinkedHashMap<>();
        for (CallLogEntry entry : entries) {
            if (!entry.modelId().isBlank()) {
                byModel.computeIfAbsent(entry.modelId(), ignored -> new ArrayList<>()).add(entry);
            }
        }
        List<ModelUsage> usage = new ArrayList<>();
        for (Map.Entry<String, List<CallLogEntry>> group : byModel.entrySet()) {
            List<CallLogEntry> rows = group.getValue();
            CallLogEntry latest = rows.get(rows.size() - 1);
            int ok = count(rows, CallLogStatus.SUCCESS);
            double avgLatency = rows.stream()
                .filter(CallLogEntry::succeeded)
                .mapToLong(CallLogEntry::durationMs)
                .average()
                .orElse(0.0);
            usage.add(new ModelUsage(
                group.getKey(),
                latest.provider(),
                latest.modelName(),
                rows.size(),
                ok,
                round2(percentage(ok, rows.size())),
                round2(avgLatency),
                rows.stream().mapToLong(CallLogEntry::totalTokens).sum(),
                round4(rows.stream().mapToDouble(CallLogEntry::cost).sum())
            ));
        }
        usage.sort(Comparator.comparingInt(ModelUsage::requests).reversed().thenComparing(ModelUsage::modelId));
        return usage;
    }

    private int count(List<CallLogEntry> entries, CallLogStatus status) {
        return (int) entries.stream().filter(e -> e.status() == status).count();
    }

    private double percentile(List<Double> sorted, int percentile) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        int safe = Math.max(0, Math.min(100, percentile));
        if (safe == 0) {
            return sorted.get(0);
        }
        int index = (int) Math.ceil((safe / 100.0) * sorted.size()) - 1;
        index = Math.max(0, Math.min(sorted.size() - 1, index));
        return sorted.get(index);
    }

    private double percentage(int numerator, int denominator) {
        if (denominator <= 0) {
            return 0.0;
        }
        return (numerator * 100.0) / denominator;
    }

    private double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
