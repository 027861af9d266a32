package io.switchboard.core.model;

public enum OutputShape {
    TEXT,
    JSON
}
