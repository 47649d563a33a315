package com.company.metrics.dto.response;

import com.company.metrics.domain.ColumnNode;
import com.company.metrics.domain.Condition;
import com.company.metrics.domain.FieldValue;
import com.company.metrics.domain.enums.SortOrder;
import com.company.metrics.exception.ColumnNotFoundException;
import com.company.metrics.util.Values;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Pivoted report. {@code rows.get(0)} is the header row; the first cell of every row holds the row key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Table {

    private static final int HEADER_ROWS = 1;

    private static final int TIER_NUMBER = 0;
    private static final int TIER_STRING = 1;
    private static final int TIER_OTHER = 2;
    private static final int TIER_MISSING = 3;

    @Builder.Default
    private List<List<TableCell>> rows = new ArrayList<>();

    private ColumnNode columnTree;

    @Builder.Default
    private List<TableColumn> columns = new ArrayList<>();

    @Builder.Default
    private List<Condition> filters = new ArrayList<>();

    @Builder.Default
    private List<Condition> slices = new ArrayList<>();

    @Builder.Default
    private List<String> sliceRecommendations = new ArrayList<>();

    private SortSpec sortedBy;

    /**
     * Sorts data rows by {@code columnId}: numbers, then strings, then other values, then missing
     * cells. Only the order inside a tier follows {@code sortOrder}; missing cells stay last.
     *
     * @throws ColumnNotFoundException when no selected column has that id
     */
    public void sortRows(String columnId, SortOrder sortOrder) {
        int columnIndex = -1;
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).getColumnId().equals(columnId)) {
                columnIndex = i;
                break;
            }
        }
        if (columnIndex < 0) {
            throw new ColumnNotFoundException(columnId);
        }
        sortedBy = new SortSpec(columnId, sortOrder);
        if (rows.size() <= HEADER_ROWS) {
            return;
        }

        // Row key occupies the first cell.
        int cellIndex = columnIndex + 1;
        Comparator<Object> ascending = Table::compareSameTier;
        Comparator<Object> inTier = sortOrder == SortOrder.DESC ? ascending.reversed() : ascending;

        List<List<TableCell>> data = new ArrayList<>(rows.subList(HEADER_ROWS, rows.size()));
        data.sort((a, b) -> {
            Object va = sortValue(a, cellIndex);
            Object vb = sortValue(b, cellIndex);
            int tierA = tier(va);
            int tierB = tier(vb);
            if (tierA != tierB) {
                return Integer.compare(tierA, tierB);
            }
            return tierA == TIER_MISSING ? 0 : inTier.compare(va, vb);
        });

        List<List<TableCell>> sorted = new ArrayList<>(rows.subList(0, HEADER_ROWS));
        sorted.addAll(data);
        rows = sorted;
    }

    private static Object sortValue(List<TableCell> row, int cellIndex) {
        if (cellIndex >= row.size()) {
            return null;
        }
        Map<String, Object> values = row.get(cellIndex).getValues();
        if (values.containsKey(FieldValue.VALUE)) {
            return values.get(FieldValue.VALUE);
        }
        return values.get(FieldValue.MAX_VALUE);
    }

    private static int tier(Object value) {
        if (value == null) {
            return TIER_MISSING;
        }
        if (Values.isNumeric(value)) {
            return TIER_NUMBER;
        }
        if (value instanceof String) {
            return TIER_STRING;
        }
        return TIER_OTHER;
    }

    private static int compareSameTier(Object a, Object b) {
        if (Values.isNumeric(a) || a instanceof String) {
            return Values.compare(a, b);
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }

    /**
     * Drops the given side channels from every structured cell field.
     */
    public void removeSubfields(Collection<String> subfields) {
        for (List<TableCell> row : rows) {
            for (TableCell cell : row) {
                removeSubfields(cell.getValues(), subfields);
                removeSubfields(cell.getDetails(), subfields);
            }
        }
    }

    /**
     * Replaces every structured cell field holding only {@code value} with the bare value.
     */
    public void flattenValues() {
        for (List<TableCell> row : rows) {
            for (TableCell cell : row) {
                flattenValues(cell.getValues());
                flattenValues(cell.getDetails());
            }
        }
    }

    private static void removeSubfields(Map<String, Object> fields, Collection<String> subfields) {
        for (Object field : fields.values()) {
            if (field instanceof Map<?, ?> map) {
                subfields.forEach(map::remove);
            }
        }
    }

    private static void flattenValues(Map<String, Object> fields) {
        fields.replaceAll((name, field) -> {
            if (field instanceof Map<?, ?> map && map.size() == 1 && map.containsKey(FieldValue.VALUE)) {
                return map.get(FieldValue.VALUE);
            }
            return field;
        });
    }
}
