package com.company.metrics.dto.request;

import com.company.metrics.domain.Condition;
import com.company.metrics.domain.enums.AbsentMetricsPolicy;
import com.company.metrics.domain.enums.PruneMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Options of the aggregation chain. Filters and slices are already parsed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregationParams {

    @Builder.Default
    private List<Condition> filters = new ArrayList<>();

    @Builder.Default
    private List<Condition> slices = new ArrayList<>();

    @Builder.Default
    private PruneMode pruneMode = PruneMode.NONE;

    @Builder.Default
    private boolean categorizeMetadata = true;

    @Builder.Default
    private AbsentMetricsPolicy absentMetricsPolicy = AbsentMetricsPolicy.ALL_OR_NOTHING;

    @Builder.Default
    private boolean round = true;

    // falls back to metrics.engine.round-precision
    @Min(0)
    @Max(10)
    private Integer roundPrecision;
}
