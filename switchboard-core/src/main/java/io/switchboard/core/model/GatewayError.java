package io.switchboard.core.model;

import java.util.Objects;

public record GatewayError(ErrorKind kind, String message, int httpStatus) {

    public GatewayError {
        Objects.requireNonNull(kind, "kind must not be null");
        message = message == null ? "" : message;
    }

    public static GatewayError of(ErrorKind kind, String message) {
        return new GatewayError(kind, message, 0);
    }

    /**
     * Errors worth retrying against the same model: network failures, throttling and 5xx responses.
     */
    public boolean transientError() {
        return switch (kind) {
            case NETWORK_ERROR, RATE_LIMIT_ERROR -> true;
            case API_ERROR -> httpStatus == 0 || httpStatus >= 500;
            default -> false;
        };
    }

    @Override
    public String toString() {
        return kind.wireName() + ": " + message;
    }
}
