package com.market.intel.pipeline.io;

import com.market.intel.pipeline.model.Source;
import com.market.intel.pipeline.model.SourceCategory;
import com.market.intel.pipeline.model.SourceStrategy;
import com.market.intel.pipeline.util.HashUtils;
import com.market.intel.pipeline.util.UrlNormalizer;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the source list CSV. Header names are matched case-insensitively; only {@code url} is required.
 */
@Component
public class SourceListReader {
    private static final Logger log = LoggerFactory.getLogger(SourceListReader.class);

    public List<Source> read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public List<Source> read(Reader reader) throws IOException {
        List<Source> sources = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        try (CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                String url = getColumn(record, "url", "website", "site");
                if (url == null) {
                    log.warn("Skipping source list row {}: blank url", record.getRecordNumber());
                    continue;
                }
                String normalized = UrlNormalizer.normalize(url);
                String identity = normalized != null ? normalized : url;
                if (!seen.add(identity)) {
                    log.warn("Skipping source list row {}: duplicate url {}", record.getRecordNumber(), url);
                    continue;
                }
                sources.add(new Source(
                    HashUtils.shortId("src", identity),
                    url,
                    getColumn(record, "name", "company_name"),
                    SourceStrategy.fromValue(getColumn(record, "strategy")),
                    SourceCategory.fromValue(getColumn(record, "category", "type")),
                    sources.size()
                ));
            }
        }
        log.info("Loaded {} sources", sources.size());
        return sources;
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (String header : record.toMap().keySet()) {
                if (header == null) {
                    continue;
                }
                if (header.trim().equalsIgnoreCase(name)) {
                    String value = record.get(header);
                    if (value == null) {
                        return null;
                    }
                    value = value.trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }
}
