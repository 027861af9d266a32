package io.switchboard.core.registry;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelLimits(
    @JsonAlias({"requests_per_minute", "rpm"}) int requestsPerMinute,
    @JsonAlias({"tokens_per_minute", "tpm"}) int tokensPerMinute,
    @JsonAlias({"max_context_tokens"}) int maxContextTokens,
    @JsonAlias({"max_output_tokens"}) int maxOutputTokens,
    @JsonAlias({"timeout_seconds", "timeout"}) int timeoutSeconds,
    @JsonAlias({"max_retries"}) int maxRetries,
    @JsonAlias({"custom_headers", "headers"}) Map<String, String> customHeaders
) {

    public ModelLimits {
        timeoutSeconds = timeoutSeconds <= 0 ? 30 : timeoutSeconds;
        maxRetries = Math.max(0, maxRetries);
        customHeaders = customHeaders == null ? Map.of() : Map.copyOf(customHeaders);
    }

    public static ModelLimits defaults() {
        return new ModelLimits(60, 100_000, 32_768, 4_096, 30, 3, Map.of());
    }

    public Duration timeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }
}
