package com.company.metrics.dto.response;

import com.company.metrics.domain.enums.TableColumnUnit;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TableColumn {
    // e.g. "/metrics/api_calls/env_init/count"
    private String columnId;
    // e.g. "api_calls/env_init/count"
    private String name;
    private String description;
    private TableColumnUnit unit;
}
