package com.market.intel.pipeline.model;

import java.util.Locale;

public enum SourceStrategy {
    STATIC,
    DYNAMIC,
    AUTO;

    public static SourceStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "static", "http" -> STATIC;
            case "dynamic", "browser", "selenium" -> DYNAMIC;
            default -> AUTO;
        };
    }
}
