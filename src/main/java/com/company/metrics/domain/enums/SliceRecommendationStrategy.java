package com.company.metrics.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SliceRecommendationStrategy {
    NONE("none"),
    // Resolve overlapping candidates by keeping the first alphabetical one.
    FIRST_ALPHABETICAL("first_alphabetical"),
    // Prefer short, non-versioned field names with short values.
    CONCISE("concise");

    private final String code;

    SliceRecommendationStrategy(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static SliceRecommendationStrategy fromString(String strategy) {
        if (strategy == null) {
            return CONCISE;
        }
        for (SliceRecommendationStrategy value : values()) {
            if (value.code.equalsIgnoreCase(strategy) || value.name().equalsIgnoreCase(strategy)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown slice recommendation strategy '" + strategy
                + "', expected one of none, first_alphabetical, concise");
    }
}
