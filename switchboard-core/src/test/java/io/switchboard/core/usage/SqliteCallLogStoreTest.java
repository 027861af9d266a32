package io.switchboard.core.usage;

import static org.assertj.core.api.Assertions.assertThat;

import io.switchboard.core.model.ErrorKind;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteCallLogStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldPersistEntriesAcrossInstances() throws Exception {
        Path db = tempDir.resolve("gateway.db");
        SqliteCallLogStore store = new SqliteCallLogStore(db);
        store.append(FileCallLogStoreTest.entry("a", Instant.parse("2025-01-10T10:00:00Z"), CallLogStatus.SUCCESS, null));
        store.append(FileCallLogStoreTest.entry(
            "b", Instant.parse("2025-01-10T11:00:00Z"), CallLogStatus.TIMEOUT, ErrorKind.TIMEOUT_ERROR));

        List<CallLogEntry> entries = new SqliteCallLogStore(db).list(null);

        assertThat(entries).extracting(CallLogEntry::id).containsExactly("a", "b");
        assertThat(entries.get(0).errorKind()).isNull();
        assertThat(entries.get(1).errorKind()).isEqualTo(ErrorKind.TIMEOUT_ERROR);
        assertThat(entries.get(1).status()).isEqualTo(CallLogStatus.TIMEOUT);
        assertThat(entries.get(1).cost()).isEqualTo(0.0002);
    }

    @Test
    void shouldFilterBySince() throws Exception {
        SqliteCallLogStore store = new SqliteCallLogStore(tempDir.resolve("gateway.db"));
        store.append(FileCallLogStoreTest.entry("old", Instant.parse("2025-01-09T10:00:00Z"), CallLogStatus.SUCCESS, null));
        store.append(FileCallLogStoreTest.entry("new", Instant.parse("2025-01-10T10:00:00Z"), CallLogStatus.SUCCESS, null));

        assertThat(store.list(Instant.parse("2025-01-10T00:00:00Z")))
            .extracting(CallLogEntry::id)
            .containsExactly("new");
    }

    @Test
    void shouldIncludeSubSecondEntriesAtTheSinceBoundary() throws Exception {
        SqliteCallLogStore store = new SqliteCallLogStore(tempDir.resolve("gateway.db"));
        store.append(FileCallLogStoreTest.entry("before", Instant.parse("2025-01-10T09:59:59.999Z"), CallLogStatus.SUCCESS, null));
        store.append(FileCallLogStoreTest.entry("half", Instant.parse("2025-01-10T10:00:00.500Z"), CallLogStatus.SUCCESS, null));
        store.append(FileCallLogStoreTest.entry("exact", Instant.parse("2025-01-10T10:00:00Z"), CallLogStatus.SUCCESS, null));
        store.append(FileCallLogStoreTest.entry("nanos", Instant.parse("2025-01-10T10:00:00.000000001Z"), CallLogStatus.SUCCESS, null));

        List<CallLogEntry> entries = store.list(Instant.parse("2025-01-10T10:00:00Z"));

        assertThat(entries).extracting(CallLogEntry::id).containsExactly("exact", "nanos", "half");
        assertThat(entries.get(2).timestamp()).isEqualTo(Instant.parse("2025-01-10T10:00:00.500Z"));
    }
}
