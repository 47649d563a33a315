package com.company.metrics.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PruneMode {
    NONE("none"),
    // Drop metrics flagged in their own entry.
    INDIVIDUAL("all"),
    // Drop a metric only where every entry carrying it has it flagged.
    COLUMN("column");

    private final String code;

    PruneMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static PruneMode fromString(String mode) {
        if (mode == null) {
            return NONE;
        }
        for (PruneMode value : values()) {
            if (value.code.equalsIgnoreCase(mode) || value.name().equalsIgnoreCase(mode)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown prune mode '" + mode + "', expected one of none, all, column");
    }
}
