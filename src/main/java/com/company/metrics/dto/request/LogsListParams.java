package com.company.metrics.dto.request;

import com.company.metrics.domain.enums.PruneMode;
import com.company.metrics.domain.enums.SliceRecommendationStrategy;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
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
public class LogsListParams {

    @Builder.Default
    private List<String> filters = new ArrayList<>();

    @Builder.Default
    private List<String> groups = new ArrayList<>();

    @Builder.Default
    private PruneMode pruneMode = PruneMode.INDIVIDUAL;

    @Builder.Default
    private SliceRecommendationStrategy groupRecommendationStrategy = SliceRecommendationStrategy.CONCISE;

    @Min(0)
    @Max(10)
    private Integer roundPrecision;
}
