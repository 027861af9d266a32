package io.switchboard.core.provider;

public record HealthCheckResult(boolean healthy, String message) {

    public HealthCheckResult {
        message = message == null ? "" : message;
    }

    public static HealthCheckResult up() {
        return new HealthCheckResult(true, "ok");
    }

    public static HealthCheckResult down(String message) {
        return new HealthCheckResult(false, message);
    }
}
