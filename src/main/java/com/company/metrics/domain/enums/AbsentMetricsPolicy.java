package com.company.metrics.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How aggregation treats a metric that is missing from some members of a group.
 */
public enum AbsentMetricsPolicy {
    // Absent metric counts as 0. For metrics that are not recorded when 0.
    NULLIFY("nullify"),
    // Average over the members that have the metric.
    ACCEPT_SUBSET("accept_subset"),
    // Keep the metric only if every member has it.
    ALL_OR_NOTHING("all_or_nothing");

    private final String code;

    AbsentMetricsPolicy(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static AbsentMetricsPolicy fromString(String policy) {
        if (policy == null) {
            return ALL_OR_NOTHING;
        }
        for (AbsentMetricsPolicy value : values()) {
            if (value.code.equalsIgnoreCase(policy) || value.name().equalsIgnoreCase(policy)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown absent metrics policy '" + policy
                + "', expected one of nullify, accept_subset, all_or_nothing");
    }
}
