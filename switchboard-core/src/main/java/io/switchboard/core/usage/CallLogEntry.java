package io.switchboard.core.usage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.switchboard.core.model.ErrorKind;
import io.switchboard.core.model.TaskType;
import java.time.Instant;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CallLogEntry(
    String id,
    String requestId,
    String modelId,
    String provider,
    String modelName,
    TaskType taskType,
    String requestJson,
    String responseJson,
    long promptTokens,
    long completionTokens,
    long totalTokens,
    double cost,
    long durationMs,
    CallLogStatus status,
    ErrorKind errorKind,
    String errorMessage,
    int attempts,
    Instant timestamp
) {
    public static final int MAX_ERROR_CHARS = 1000;

    public CallLogEntry {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(status, "status must not be null");
        requestId = requestId == null ? "" : requestId;
        modelId = modelId == null ? "" : modelId;
        provider = provider == null ? "" : provider;
        modelName = modelName == null ? "" : modelName;
        requestJson = requestJson == null ? "" : requestJson;
        responseJson = responseJson == null ? "" : responseJson;
        errorMessage = truncate(errorMessage);
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
    }

    public boolean succeeded() {
        return status == CallLogStatus.SUCCESS;
    }

    private static String truncate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() <= MAX_ERROR_CHARS ? value : value.substring(0, MAX_ERROR_CHARS);
    }
}
