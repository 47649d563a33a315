package com.company.metrics.dto.request;

import com.company.metrics.domain.enums.AbsentMetricsPolicy;
import com.company.metrics.domain.enums.PruneMode;
import com.company.metrics.domain.enums.SliceRecommendationStrategy;
import com.company.metrics.dto.response.SortSpec;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Table request. Conditions are raw condition strings, parsed best-effort.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableCreationParams {

    @Builder.Default
    private List<String> filters = new ArrayList<>();

    @Builder.Default
    private List<String> slices = new ArrayList<>();

    // ids of columns or column categories to show
    @Builder.Default
    private List<String> columnSelections = new ArrayList<>();

    // applied after columnSelections, additions first
    @Builder.Default
    private List<String> columnSelectionsToAdd = new ArrayList<>();

    @Builder.Default
    private List<String> columnSelectionsToRemove = new ArrayList<>();

    private SortSpec sortBy;

    @Builder.Default
    private PruneMode pruneMode = PruneMode.COLUMN;

    @Builder.Default
    private AbsentMetricsPolicy absentMetricsPolicy = AbsentMetricsPolicy.ALL_OR_NOTHING;

    @Builder.Default
    private SliceRecommendationStrategy sliceRecommendationStrategy = SliceRecommendationStrategy.CONCISE;
}
