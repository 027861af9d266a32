package io.switchboard.core.routing;

import io.switchboard.core.model.GatewayError;

public record AttemptRecord(String modelId, String modelKey, int attempt, long durationMs, GatewayError error) {

    public boolean succeeded() {
        return error == null;
    }
}
