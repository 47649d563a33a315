package com.company.metrics.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsTuneParams {

    @Builder.Default
    private boolean msToSeconds = false;

    @Builder.Default
    private boolean round = true;

    @Min(0)
    @Max(10)
    private Integer roundPrecision;

    @Builder.Default
    private boolean determinePruning = true;
}
