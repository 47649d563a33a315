package com.company.metrics.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One table cell: {@code values} for display and sorting, {@code details} with the full field.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TableCell {
    private Map<String, Object> values = new LinkedHashMap<>();
    private Map<String, Object> details = new LinkedHashMap<>();
}
