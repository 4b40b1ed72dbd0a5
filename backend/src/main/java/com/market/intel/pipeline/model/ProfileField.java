package com.market.intel.pipeline.model;

import java.time.Instant;

public record ProfileField(String value, String documentId, String url, Instant capturedAt) {
}
