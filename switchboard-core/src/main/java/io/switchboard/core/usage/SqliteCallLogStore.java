package io.switchboard.core.usage;

import io.switchboard.core.model.ErrorKind;
import io.switchboard.core.model.TaskType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

public final class SqliteCallLogStore implements CallLogStore {
    // Fixed-width UTC timestamps so created_at compares correctly as text.
    private static final DateTimeFormatter CREATED_AT =
        DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'").withZone(ZoneOffset.UTC);

    private final String jdbcUrl;

    public SqliteCallLogStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        init();
    }

    @Override
    public synchronized void append(CallLogEntry entry) throws IOException {
        String sql = """
            INSERT INTO call_log (
                id, request_id, model_id, provider, model_name, task_type, request_json, response_json,
                prompt_tokens, completion_tokens, total_tokens, cost, duration_ms, status,
                error_kind, error_message, attempts, created_at
            )
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            connection.setAutoCommit(false);
            statement.setString(1, entry.id());
            statement.setString(2, entry.requestId());
            statement.setString(3, entry.modelId());
            statement.setString(4, entry.provider());
            statement.setString(5, entry.modelName());
            statement.setString(6, entry.taskType() == null ? "" : entry.taskType().name());
            statement.setString(7, entry.requestJson());
            statement.setString(8, entry.responseJson());
            statement.setLong(9, entry.promptTokens());
            statement.setLong(10, entry.completionTokens());
            statement.setLong(11, entry.totalTokens());
            statement.setDouble(12, entry.cost());
            statement.setLong(13, entry.durationMs());
            statement.setString(14, entry.status().name());
            statement.setString(15, entry.errorKind() == null ? "" : entry.errorKind().wireName());
            statement.setString(16, entry.errorMessage());
            statement.setInt(17, entry.attempts());
            statement.setString(18, CREATED_AT.format(entry.timestamp()));
            statement.executeUpdate();
            connection.commit();
        } catch (SQLException e) {
            throw new IOException("Failed to append call log entry", e);
        }
    }

    @Override
    public synchronized List<CallLogEntry> list(Instant since) throws IOException {
        String sql = """
            SELECT * FROM call_log
            WHERE created_at >= ?
            ORDER BY created_at ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, CREATED_AT.format(since == null ? Instant.EPOCH : since));
            try (ResultSet resultSet = statement.executeQuery()) {
                List<CallLogEntry> entries = new ArrayList<>();
                while (resultSet.next()) {
                    entries.add(read(resultSet));
                }
                return entries;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list call log entries", e);
        }
    }

    private CallLogEntry read(ResultSet resultSet) throws SQLException {
        String taskType = resultSet.getString("task_type");
        return new CallLogEntry(
            resultSet.getString("id"),
            resultSet.getString("request_id"),
            resultSet.getString("model_id"),
            resultSet.getString("provider"),
            resultSet.getString("model_name"),
            taskType == null || taskType.isBlank() ? null : TaskType.valueOf(taskType),
            resultSet.getString("request_json"),
            resultSet.getString("response_json"),
            resultSet.getLong("prompt_tokens"),
            resultSet.getLong("completion_tokens"),
            resultSet.getLong("total_tokens"),
            resultSet.getDouble("cost"),
            resultSet.getLong("duration_ms"),
            CallLogStatus.valueOf(resultSet.getString("status")),
            ErrorKind.fromWireName(resultSet.getString("error_kind")),
            resultSet.getString("error_message"),
            resultSet.getInt("attempts"),
            Instant.parse(resultSet.getString("created_at"))
        );
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS call_log (
                id TEXT PRIMARY KEY,
                request_id TEXT NOT NULL,
                model_id TEXT NOT NULL,
                provider TEXT NOT NULL,
                model_name TEXT NOT NULL,
                task_type TEXT NOT NULL,
                request_json TEXT NOT NULL,
                response_json TEXT NOT NULL,
                prompt_tokens INTEGER NOT NULL,
                completion_tokens INTEGER NOT NULL,
                total_tokens INTEGER NOT NULL,
                cost REAL NOT NULL,
                duration_ms INTEGER NOT NULL,
                status TEXT NOT NULL,
                error_kind TEXT NOT NULL,
                error_message TEXT NOT NULL,
                attempts INTEGER NOT NULL,
                created_at TEXT NOT NULL
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_call_log_created_at
            ON call_log(created_at DESC)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite call log store", e);
        }
    }
}
