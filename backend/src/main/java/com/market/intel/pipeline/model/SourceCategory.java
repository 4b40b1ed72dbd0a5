package com.market.intel.pipeline.model;

import java.util.Locale;

public enum SourceCategory {
    COMPANY,
    FREELANCE,
    DIRECTORY;

    public static SourceCategory fromValue(String value) {
        if (value == null || value.isBlank()) {
            return COMPANY;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "freelance", "freelancer" -> FREELANCE;
            case "directory", "platform" -> DIRECTORY;
            default -> COMPANY;
        };
    }
}
