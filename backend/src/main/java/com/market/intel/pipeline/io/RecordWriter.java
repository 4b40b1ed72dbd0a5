package com.market.intel.pipeline.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes stage outputs as pretty-printed JSON. Each file is written to a temporary sibling and then
 * moved into place, so readers never observe a half-written file.
 */
@Component
public class RecordWriter {
    private static final Logger log = LoggerFactory.getLogger(RecordWriter.class);

    public static final String RAW_CAPTURES = "raw-captures.json";
    public static final String CLEANED_DOCUMENTS = "cleaned-documents.json";
    public static final String ANALYSIS_RESULTS = "analysis-results.json";
    public static final String CORPUS_SYNTHESIS = "corpus-synthesis.json";
    public static final String PROFILES = "profiles.json";
    public static final String RUN_SUMMARY = "run-summary.json";
    public static final String FAILURES = "failures.jsonl";

    private final ObjectWriter writer;

    public RecordWriter(ObjectMapper objectMapper) {
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    }

    public Path write(Path directory, String fileName, Object value) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve(fileName);
        Path temp = Files.createTempFile(directory, fileName, ".tmp");
        try {
            writer.writeValue(temp.toFile(), value);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.info("Wrote {}", target);
        return target;
    }
}
