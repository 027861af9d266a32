package io.switchboard.core.model;

import java.util.Objects;

public record ChatTurn(ChatRole role, String content) {

    public ChatTurn {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
    }

    public static ChatTurn user(String content) {
        return new ChatTurn(ChatRole.USER, content);
    }

    public static ChatTurn assistant(String content) {
        return new ChatTurn(ChatRole.ASSISTANT, content);
    }

    public static ChatTurn system(String content) {
        return new ChatTurn(ChatRole.SYSTEM, content);
    }
}
