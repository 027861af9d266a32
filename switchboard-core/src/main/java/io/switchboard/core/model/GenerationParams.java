package io.switchboard.core.model;

public record GenerationParams(Double temperature, Integer maxOutputTokens, Double topP) {

    public static GenerationParams defaults() {
        return new GenerationParams(0.7, 1000, null);
    }

    public GenerationParams withMaxOutputTokens(int maxOutputTokens) {
        return new GenerationParams(temperature, maxOutputTokens, topP);
    }
}
