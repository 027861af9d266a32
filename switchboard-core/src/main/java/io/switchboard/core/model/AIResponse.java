package io.switchboard.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Caller-facing outcome. Carries exactly one of a result or a single structured failure.
 */
public record AIResponse(
    String requestId,
    boolean success,
    String text,
    JsonNode json,
    String modelId,
    String modelName,
    ProviderType provider,
    TokenUsage usage,
    double cost,
    long durationMs,
    String errorMessage,
    ErrorKind errorKind
) {

    public AIResponse {
        requestId = requestId == null ? "" : requestId;
        text = text == null ? "" : text;
        modelId = modelId == null ? "" : modelId;
        modelName = modelName == null ? "" : modelName;
        usage = usage == null ? TokenUsage.empty() : usage;
        errorMessage = errorMessage == null ? "" : errorMessage;
    }

    public static AIResponse success(
        String requestId,
        String text,
        JsonNode json,
        String modelId,
        String modelName,
        ProviderType provider,
        TokenUsage usage,
        double cost,
        long durationMs
    ) {
        return new AIResponse(requestId, true, text, json, modelId, modelName, provider, usage, cost, durationMs, "", null);
    }

    public static AIResponse failure(String requestId, ErrorKind kind, String message, long durationMs) {
        return new AIResponse(requestId, false, "", null, "", "", null, TokenUsage.empty(), 0.0, durationMs, message, kind);
    }
}
