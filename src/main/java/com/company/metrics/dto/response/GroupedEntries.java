package com.company.metrics.dto.response;

import com.company.metrics.domain.Entry;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A group summary entry together with the entries it summarizes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GroupedEntries {
    private Entry aggrEntry;
    private List<Entry> entries = new ArrayList<>();
}
