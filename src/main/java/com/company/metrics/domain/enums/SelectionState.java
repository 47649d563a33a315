package com.company.metrics.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SelectionState {
    // Whole subtree selected. Subfields such as min_value of a leaf are selected explicitly.
    ALL("all"),
    NONE("none"),
    PARTIAL("partial");

    private final String code;

    SelectionState(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
