package com.company.metrics.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FieldCategory {
    SAME("same", "Same value in every entry"),
    GROUP("group", "Repeated values, usable as a grouping key"),
    UNIQUE("unique", "Distinct value in every entry"),
    TIMESTAMP("timestamp", "Distinct timestamp-like value in every entry");

    private final String code;
    private final String description;

    FieldCategory(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public static FieldCategory fromString(String category) {
        if (category == null) {
            return null;
        }
        for (FieldCategory value : values()) {
            if (value.code.equalsIgnoreCase(category) || value.name().equalsIgnoreCase(category)) {
                return value;
            }
        }
        return null;
    }
}
