package io.switchboard.core.usage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FileCallLogStore implements CallLogStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileCallLogStore.class);

    private final Path path;
    private final ObjectMapper mapper;

    public FileCallLogStore(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized void append(CallLogEntry entry) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String line = mapper.writeValueAsString(entry) + System.lineSeparator();
        Files.writeString(
            path,
            line,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND,
            StandardOpenOption.WRITE
        );
    }

    @Override
    public synchronized List<CallLogEntry> list(Instant since) throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        List<CallLogEntry> entries = new ArrayList<>();
        int lineNumber = 0;
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                CallLogEntry entry = mapper.readValue(line, CallLogEntry.class);
                if (since == null || !entry.timestamp().isBefore(since)) {
                    entries.add(entry);
                }
            } catch (JsonProcessingException e) {
                LOG.warn("Skipping unreadable call log line {} in {}: {}", lineNumber, path, e.getOriginalMessage());
            }
        }
        entries.sort(Comparator.comparing(CallLogEntry::timestamp));
        return entries;
    }
}
