package com.market.intel.pipeline.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record CleanedDocument(
    String documentId,
    String sourceId,
    String sourceUrl,
    String url,
    SourceCategory category,
    int sourceIndex,
    int pageIndex,
    String domain,
    String entityName,
    Instant capturedAt,
    String language,
    String fingerprint,
    boolean live,
    String title,
    String description,
    String text,
    Map<String, String> sections,
    List<String> emails,
    List<String> phones,
    List<String> technologies,
    List<String> services,
    List<String> offers,
    List<String> novelties
) {
}
