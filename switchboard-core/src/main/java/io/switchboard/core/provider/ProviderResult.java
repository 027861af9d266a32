package io.switchboard.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.switchboard.core.model.GatewayError;
import io.switchboard.core.model.TokenUsage;
import java.util.Objects;

public record ProviderResult(String text, JsonNode json, TokenUsage usage, GatewayError error) {

    public ProviderResult {
        text = text == null ? "" : text;
        usage = usage == null ? TokenUsage.empty() : usage;
    }

    public static ProviderResult ok(String text, JsonNode json, TokenUsage usage) {
        return new ProviderResult(text, json, usage, null);
    }

    public static ProviderResult failed(GatewayError error) {
        return new ProviderResult("", null, TokenUsage.empty(), Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean success() {
        return error == null;
    }
}
