package com.market.intel.pipeline.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.intel.pipeline.model.CleanedDocument;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@Component
public class CorpusReader {
    private static final TypeReference<List<CleanedDocument>> DOCUMENTS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public CorpusReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<CleanedDocument> readCleanedDocuments(Path path) throws IOException {
        List<CleanedDocument> documents = objectMapper.readValue(path.toFile(), DOCUMENTS);
        return documents == null ? List.of() : documents;
    }
}
