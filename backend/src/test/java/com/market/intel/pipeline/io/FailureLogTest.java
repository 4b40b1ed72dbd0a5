package com.market.intel.pipeline.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.intel.config.PipelineConfig;
import com.market.intel.pipeline.model.ErrorKind;
import com.market.intel.pipeline.model.FailureRecord;
import com.market.intel.pipeline.model.PipelineStage;
import com.market.intel.pipeline.util.ReasonCodeClassifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.market.intel.pipeline.PipelineFixtures.CAPTURED_AT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class FailureLogTest {
    private final ObjectMapper objectMapper = new PipelineConfig().objectMapper();

    @Test
    void appendsOneJsonLinePerFailure(@TempDir Path directory) throws Exception {
        Path path = directory.resolve("out").resolve(RecordWriter.FAILURES);
        FailureLog failureLog = new FailureLog(objectMapper, path);

        failureLog.record(failure("src-1", ReasonCodeClassifier.HTTP_404));
        failureLog.record(failure("src-2", ReasonCodeClassifier.TIMEOUT));

        List<String> lines = Files.readAllLines(path);
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).contains("src-1").contains("HTTP_404");
        assertThat(lines.get(1)).contains("src-2").contains("TIMEOUT");
        assertEquals(2, failureLog.size());
    }

    @Test
    void unwritableFileKeepsRecordsInMemory(@TempDir Path directory) throws Exception {
        Path blocker = Files.writeString(directory.resolve("out"), "not a directory");
        FailureLog failureLog = new FailureLog(objectMapper, blocker.resolve(RecordWriter.FAILURES));
        FailureRecord record = failure("src-1", ReasonCodeClassifier.HTTP_404);

        failureLog.record(record);
        failureLog.record(failure("src-2", ReasonCodeClassifier.TIMEOUT));

        assertThat(failureLog.records()).hasSize(2).first().isEqualTo(record);
        assertThat(Files.isRegularFile(blocker)).isTrue();
    }

    @Test
    void inMemoryLogHasNoFile() {
        FailureLog failureLog = FailureLog.inMemory(objectMapper);

        failureLog.record(failure("src-1", ReasonCodeClassifier.HTTP_404));

        assertThat(failureLog.path()).isNull();
        assertEquals(1, failureLog.size());
    }

    private static FailureRecord failure(String sourceId, String reasonCode) {
        return new FailureRecord(
            CAPTURED_AT,
            "run-test",
            sourceId,
            "https://" + sourceId + ".example/",
            PipelineStage.FETCH,
            ErrorKind.FETCH_FAILED,
            reasonCode,
            "request failed"
        );
    }
}
