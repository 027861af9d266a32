package io.switchboard.core.usage;

import static org.assertj.core.api.Assertions.assertThat;

import io.switchboard.core.model.ErrorKind;
import io.switchboard.core.model.TaskType;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileCallLogStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldAppendAndFilterBySince() throws Exception {
        Path file = tempDir.resolve("logs/calls.jsonl");
        FileCallLogStore store = new FileCallLogStore(file);
        store.append(entry("old", Instant.parse("2025-01-09T10:00:00Z"), CallLogStatus.SUCCESS, null));
        store.append(entry("new", Instant.parse("2025-01-10T10:00:00Z"), CallLogStatus.FAILED, ErrorKind.NETWORK_ERROR));

        List<CallLogEntry> recent = store.list(Instant.parse("2025-01-10T00:00:00Z"));

        assertThat(recent).extracting(CallLogEntry::id).containsExactly("new");
        assertThat(recent.get(0).errorKind()).isEqualTo(ErrorKind.NETWORK_ERROR);
        assertThat(recent.get(0).taskType()).isEqualTo(TaskType.TRANSLATION);
        assertThat(store.list(null)).hasSize(2);
    }

    @Test
    void shouldSkipCorruptLines() throws Exception {
        Path file = tempDir.resolve("calls.jsonl");
        FileCallLogStore store = new FileCallLogStore(file);
        store.append(entry("a", Instant.parse("2025-01-10T10:00:00Z"), CallLogStatus.SUCCESS, null));
        Files.writeString(file, "{not json\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        store.append(entry("b", Instant.parse("2025-01-10T11:00:00Z"), CallLogStatus.CANCELLED, ErrorKind.CANCELLED));

        assertThat(store.list(null)).extracting(CallLogEntry::id).containsExactly("a", "b");
    }

    @Test
    void shouldReturnEmptyListWhenFileIsMissing() throws Exception {
        assertThat(new FileCallLogStore(tempDir.resolve("missing.jsonl")).list(null)).isEmpty();
    }

    static CallLogEntry entry(String id, Instant at, CallLogStatus status, ErrorKind errorKind) {
        return new CallLogEntry(id, "req-" + id, "m1", "gemini", "gemini-1.5-flash", TaskType.TRANSLATION,
            "{}", "{}", 10, 5, 15, 0.0002, 300, status, errorKind,
            errorKind == null ? "" : "failed", 1, at);
    }
}
