package com.company.metrics.dto.request;

import com.company.metrics.dto.response.SortSpec;
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
public class EvaluationTableParams {

    @Builder.Default
    private List<String> filters = new ArrayList<>();

    @Builder.Default
    private List<String> columnSelections = new ArrayList<>();

    @Builder.Default
    private List<String> columnSelectionsToAdd = new ArrayList<>();

    @Builder.Default
    private List<String> columnSelectionsToRemove = new ArrayList<>();

    private SortSpec sortBy;
}
