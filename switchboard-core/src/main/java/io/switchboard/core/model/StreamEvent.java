package io.switchboard.core.model;

import java.util.Objects;

/**
 * One element of a streamed call. {@code END} and {@code ERROR} are terminal.
 */
public record StreamEvent(Type type, String content, TokenUsage usage, GatewayError error) {

    public enum Type {
        CONTENT,
        USAGE,
        ERROR,
        END
    }

    public StreamEvent {
        Objects.requireNonNull(type, "type must not be null");
        content = content == null ? "" : content;
        usage = usage == null ? TokenUsage.empty() : usage;
    }

    public static StreamEvent content(String fragment) {
        return new StreamEvent(Type.CONTENT, fragment, null, null);
    }

    public static StreamEvent usage(TokenUsage usage) {
        return new StreamEvent(Type.USAGE, "", usage, null);
    }

    public static StreamEvent error(GatewayError error) {
        return new StreamEvent(Type.ERROR, "", null, Objects.requireNonNull(error, "error must not be null"));
    }

    public static StreamEvent end(TokenUsage usage) {
        return new StreamEvent(Type.END, "", usage, null);
    }

    public boolean terminal() {
        return type == Type.END || type == Type.ERROR;
    }
}
