package io.switchboard.core.usage;

import com.fasterxml.jackson.databind.JsonNode;
import io.switchboard.core.model.AIRequest;
import io.switchboard.core.model.GatewayError;
import io.switchboard.core.model.TokenUsage;
import io.switchboard.core.registry.ModelConfig;
import java.util.Objects;

/**
 * Terminal outcome of one logical request, handed to the {@link UsageRecorder}.
 *
 * @param model the model that produced the outcome, or null when none was selected
 */
public record CallOutcome(
    String requestId,
    AIRequest request,
    ModelConfig model,
    CallLogStatus status,
    String text,
    JsonNode json,
    TokenUsage usage,
    long durationMs,
    GatewayError error,
    int attempts
) {

    public CallOutcome {
        Objects.requireNonNull(requestId, "requestId must not be null");
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(status, "status must not be null");
        text = text == null ? "" : text;
        usage = usage == null ? TokenUsage.empty() : usage;
        durationMs = Math.max(0, durationMs);
        attempts = Math.max(0, attempts);
    }
}
