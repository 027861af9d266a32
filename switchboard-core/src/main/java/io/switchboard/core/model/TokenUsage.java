package io.switchboard.core.model;

public record TokenUsage(long promptTokens, long completionTokens, long totalTokens) {

    public TokenUsage {
        promptTokens = Math.max(0, promptTokens);
        completionTokens = Math.max(0, completionTokens);
        totalTokens = totalTokens > 0 ? totalTokens : promptTokens + completionTokens;
    }

    public static TokenUsage empty() {
        return new TokenUsage(0, 0, 0);
    }

    public boolean hasTokens() {
        return totalTokens > 0;
    }
}
