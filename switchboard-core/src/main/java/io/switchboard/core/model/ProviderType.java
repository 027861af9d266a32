package io.switchboard.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

public enum ProviderType {
    OPENAI_COMPATIBLE("https://api.openai.com/v1"),
    GEMINI("https://generativelanguage.googleapis.com/v1beta"),
    DEEPSEEK("https://api.deepseek.com/v1");

    private final String defaultEndpoint;

    ProviderType(String defaultEndpoint) {
        this.defaultEndpoint = defaultEndpoint;
    }

    public String defaultEndpoint() {
        return defaultEndpoint;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup accepting {@code openai}, {@code openai-compatible}, {@code gemini}, {@code deepseek}.
     */
    @JsonCreator
    public static ProviderType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("provider must not be blank");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("OPENAI".equals(normalized)) {
            return OPENAI_COMPATIBLE;
        }
        return valueOf(normalized);
    }
}
