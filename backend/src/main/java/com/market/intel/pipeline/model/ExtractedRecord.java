package com.market.intel.pipeline.model;

import java.util.List;
import java.util.Map;

public record ExtractedRecord(
    PageCapture capture,
    String entityName,
    String title,
    String description,
    Map<String, String> sections,
    List<String> emails,
    List<String> phones,
    List<String> technologies,
    List<String> services,
    List<String> offers,
    List<String> novelties,
    String text,
    Map<String, Boolean> confidence
) {
    public boolean found(String field) {
        return Boolean.TRUE.equals(confidence.get(field));
    }
}
