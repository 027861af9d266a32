package io.switchboard.core.model;

public enum Capability {
    TEXT,
    VISION,
    EMBEDDING,
    AUDIO
}
