package com.company.metrics.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SortOrder {
    ASC("asc"),
    DESC("desc");

    private final String code;

    SortOrder(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static SortOrder fromString(String order) {
        if (order == null) {
            return DESC;
        }
        for (SortOrder value : values()) {
            if (value.code.equalsIgnoreCase(order)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown sort order '" + order + "', expected asc or desc");
    }
}
