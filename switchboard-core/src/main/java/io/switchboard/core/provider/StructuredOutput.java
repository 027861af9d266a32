package io.switchboard.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Optional;

public final class StructuredOutput {
    private final ObjectMapper mapper;

    public StructuredOutput(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Optional<JsonNode> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String cleaned = stripFences(text.trim());
        Optional<JsonNode> direct = tryRead(cleaned);
        if (direct.isPresent()) {
            return direct;
        }
        return extractEnclosed(cleaned).flatMap(this::tryRead);
    }

    static String stripFences(String text) {
        String value = text;
        int open = value.indexOf("```");
        if (open < 0) {
            return value;
        }
        int lineEnd = value.indexOf('\n', open);
        if (lineEnd < 0) {
            return value;
        }
        int close = value.indexOf("```", lineEnd);
        value = close < 0 ? value.substring(lineEnd + 1) : value.substring(lineEnd + 1, close);
        return value.trim();
    }

    private static Optional<String> extractEnclosed(String text) {
        int objectStart = text.indexOf('{');
        int arrayStart = text.indexOf('[');
        int start;
        char closing;
        if (objectStart >= 0 && (arrayStart < 0 || objectStart < arrayStart)) {
            start = objectStart;
            closing = '}';
        } else if (arrayStart >= 0) {
            start = arrayStart;
            closing = ']';
        } else {
            return Optional.empty();
        }
        int end = text.lastIndexOf(closing);
        if (end <= start) {
            return Optional.empty();
        }
        return Optional.of(text.substring(start, end + 1));
    }

    private Optional<JsonNode> tryRead(String candidate) {
        try {
            JsonNode node = mapper.readTree(candidate);
            if (node == null || !(node.isObject() || node.isArray())) {
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (IOException e) {
            return Optional.empty();
        }
    }
}
