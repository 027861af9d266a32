package io.switchboard.core.routing;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public final class Deadline {
    private final Clock clock;
    private final Duration budget;
    private final Instant expiresAt;

    private Deadline(Clock clock, Duration budget) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
        this.expiresAt = clock.instant().plus(budget);
    }

    public static Deadline after(Duration budget, Clock clock) {
        return new Deadline(clock, budget);
    }

    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean expired() {
        return remaining().isZero();
    }

    public Duration budget() {
        return budget;
    }
}
