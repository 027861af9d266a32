package io.switchboard.core.routing;

import java.time.Instant;

public record HealthStatus(boolean healthy, Instant lastChecked, String message) {

    public HealthStatus {
        message = message == null ? "" : message;
    }
}
