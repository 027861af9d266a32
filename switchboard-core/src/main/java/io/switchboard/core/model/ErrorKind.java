package io.switchboard.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ErrorKind {
    CONFIG_ERROR("config_error"),
    AUTHENTICATION_ERROR("authentication_error"),
    RATE_LIMIT_ERROR("rate_limit_error"),
    NETWORK_ERROR("network_error"),
    API_ERROR("api_error"),
    INVALID_REQUEST_ERROR("invalid_request_error"),
    RESPONSE_PARSING_ERROR("response_parsing_error"),
    MODEL_SELECTION_ERROR("model_selection_error"),
    ALL_MODELS_FAILED("all_models_failed"),
    TIMEOUT_ERROR("timeout_error"),
    CANCELLED("cancelled");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ErrorKind fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ErrorKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
