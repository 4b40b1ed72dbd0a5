package com.market.intel.pipeline.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.intel.pipeline.model.FailureRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only JSON-lines log of per-source failures. Without a path it only keeps records in memory.
 * Records that cannot be appended to the file are still kept in memory.
 */
public class FailureLog {
    private static final Logger log = LoggerFactory.getLogger(FailureLog.class);

    private final ObjectMapper objectMapper;
    private final Path path;
    private final List<FailureRecord> records = new ArrayList<>();

    public FailureLog(ObjectMapper objectMapper, Path path) {
        this.objectMapper = objectMapper;
        this.path = path;
    }

    public static FailureLog inMemory(ObjectMapper objectMapper) {
        return new FailureLog(objectMapper, null);
    }

    public synchronized void record(FailureRecord record) {
        records.add(record);
        log.warn(
            "{} failure for source {} ({}): {} {} {}",
            record.stage(),
            record.sourceId(),
            record.url(),
            record.errorKind(),
            record.reasonCode(),
            record.message()
        );
        if (path == null) {
            return;
        }
        try {
            String line = objectMapper.writeValueAsString(record) + System.lineSeparator();
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(
                path,
                line,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
            );
        } catch (IOException e) {
            log.error("Failed to append failure record for source {} to {}", record.sourceId(), path, e);
        }
    }

    public synchronized List<FailureRecord> records() {
        return List.copyOf(records);
    }

    public synchronized int size() {
        return records.size();
    }

    public Path path() {
        return path;
    }
}
