package com.company.metrics.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConditionOperator {
    SLICE("slice"),
    IN("in"),
    NOT_IN("not_in"),
    RANGE("range");

    private final String code;

    ConditionOperator(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * @throws IllegalArgumentException for an unknown operator
     */
    public static ConditionOperator fromString(String operator) {
        if (operator != null) {
            for (ConditionOperator value : values()) {
                if (value.code.equals(operator.trim())) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("Unknown operator '" + operator + "', expected one of slice, in, not_in, range");
    }
}
