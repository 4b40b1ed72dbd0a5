package com.market.intel.pipeline.model;

public enum EntityType {
    COMPANY,
    FREELANCER,
    UNKNOWN;

    public static EntityType fromCategory(SourceCategory category) {
        if (category == null) {
            return UNKNOWN;
        }
        return switch (category) {
            case COMPANY -> COMPANY;
            case FREELANCE -> FREELANCER;
            case DIRECTORY -> UNKNOWN;
        };
    }
}
