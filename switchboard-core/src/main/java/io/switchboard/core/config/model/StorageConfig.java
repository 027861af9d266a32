package io.switchboard.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Where call log entries go. {@code callLog} is {@code file} (JSON lines) or {@code sqlite}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    @JsonAlias({"call_log"}) String callLog,
    @JsonAlias({"call_log_path"}) String callLogPath,
    @JsonAlias({"sqlite_path"}) String sqlitePath
) {

    public static StorageConfig defaults() {
        return new StorageConfig("file", "~/.switchboard/call-log.jsonl", "~/.switchboard/call-log.db");
    }

    public boolean sqlite() {
        return "sqlite".equalsIgnoreCase(callLog);
    }

    public StorageConfig withCallLog(String value) {
        return new StorageConfig(value, callLogPath, sqlitePath);
    }
}
