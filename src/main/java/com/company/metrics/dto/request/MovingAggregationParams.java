package com.company.metrics.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MovingAggregationParams {

    // bucket width in ms
    @Min(value = 1, message = "Time granulation must be positive")
    private long timeGranulation;

    // may address a subfield, e.g. "latency/max_value"
    @NotBlank(message = "Field name is required")
    private String fieldName;

    // applied before time bounds and slice values are determined
    @Builder.Default
    private List<String> globalFilters = new ArrayList<>();

    // applied inside every bucket
    @Builder.Default
    private List<String> filters = new ArrayList<>();

    @Builder.Default
    private String sliceField = "";

    @Min(0)
    @Max(10)
    private Integer roundPrecision;
}
