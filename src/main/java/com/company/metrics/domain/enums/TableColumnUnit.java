package com.company.metrics.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TableColumnUnit {
    TIMESTAMP("timestamp"),
    NUMERICAL("numerical"),
    STRING("string");

    private final String code;

    TableColumnUnit(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
