package com.company.metrics.dto.response;

import com.company.metrics.domain.Condition;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Time series over fixed-width buckets of {@code (timeBegin, timeEnd]}, one series per slice value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MovingAggregation {

    // epoch millis
    private long timeBegin;
    private long timeEnd;
    private long timeGranulation;

    // may address a subfield, e.g. "latency/max_value"
    private String fieldName;

    @Builder.Default
    private List<Condition> filters = new ArrayList<>();

    @Builder.Default
    private String sliceField = "";

    @Builder.Default
    private List<String> sliceValues = new ArrayList<>();

    // one row when unsliced, otherwise one per slice value
    @Builder.Default
    private List<List<Double>> values = new ArrayList<>();

    private double minValue;
    private double maxValue;
}
