package io.switchboard.core.model;

public enum ChatRole {
    SYSTEM,
    USER,
    ASSISTANT
}
