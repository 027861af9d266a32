package io.switchboard.core.usage;

public enum CallLogStatus {
    SUCCESS,
    FAILED,
    TIMEOUT,
    CANCELLED
}
