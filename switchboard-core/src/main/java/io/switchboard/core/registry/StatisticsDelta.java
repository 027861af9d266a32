package io.switchboard.core.registry;

import java.time.Instant;
import java.util.Objects;

public record StatisticsDelta(boolean success, long tokens, double cost, long durationMs, Instant at, String error) {

    public StatisticsDelta {
        Objects.requireNonNull(at, "at must not be null");
        error = error == null ? "" : error;
    }

    public static StatisticsDelta success(long tokens, double cost, long durationMs, Instant at) {
        return new StatisticsDelta(true, tokens, cost, durationMs, at, "");
    }

    public static StatisticsDelta failure(long tokens, double cost, long durationMs, Instant at, String error) {
        return new StatisticsDelta(false, tokens, cost, durationMs, at, error);
    }
}
