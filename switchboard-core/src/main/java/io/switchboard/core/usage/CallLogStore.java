package io.switchboard.core.usage;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

public interface CallLogStore {
    void append(CallLogEntry entry) throws IOException;

    /**
     * Entries at or after {@code since}, oldest first.
     */
    List<CallLogEntry> list(Instant since) throws IOException;
}
