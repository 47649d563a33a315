package com.company.metrics.service;

import com.company.metrics.conversion.CategorizeMetadataConversion;
import com.company.metrics.conversion.ChainConversion;
import com.company.metrics.conversion.Conversion;
import com.company.metrics.conversion.FilterConversion;
import com.company.metrics.domain.AnnotatedFieldValue;
import com.company.metrics.domain.ColumnTree;
import com.company.metrics.domain.Condition;
import com.company.metrics.domain.Entry;
import com.company.metrics.domain.FieldValue;
import com.company.metrics.domain.enums.AbsentMetricsPolicy;
import com.company.metrics.domain.enums.FieldCategory;
import com.company.metrics.domain.enums.PruneMode;
import com.company.metrics.domain.enums.SliceRecommendationStrategy;
import com.company.metrics.domain.enums.TableColumnUnit;
import com.company.metrics.dto.request.AggregationParams;
import com.company.metrics.dto.request.EvaluationTableParams;
import com.company.metrics.dto.request.TableCreationParams;
import com.company.metrics.dto.response.SortSpec;
import com.company.metrics.dto.response.Table;
import com.company.metrics.dto.response.TableCell;
import com.company.metrics.dto.response.TableColumn;
import com.company.metrics.util.ConditionParser;
import com.company.metrics.util.Values;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds pivoted tables: one header row, then one row per (aggregated) entry and one cell per
 * selected column.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TableService {

    private static final Set<String> HIDDEN_SUBFIELDS = Set.of(FieldValue.PRUNE, FieldValue.CATEGORY);
    private static final Set<String> RANGE_SUBFIELDS = Set.of(FieldValue.MIN_VALUE, FieldValue.MAX_VALUE);
    private static final String NAME = "name";

    private final PipelineService pipelineService;
    private final SliceRecommendationService sliceRecommendationService;
    private final MeterRegistry meterRegistry;

    public Table buildTable(List<Entry> entries, TableCreationParams params) {
        List<Condition> filters = ConditionParser.parseAll(params.getFilters());
        List<Condition> slices = ConditionParser.parseAll(params.getSlices());
        return buildTable(entries, filters, slices, params);
    }

    public Table buildTable(List<Entry> entries, List<Condition> filters, List<Condition> slices,
                            List<String> columnSelections, PruneMode pruneMode,
                            AbsentMetricsPolicy absentMetricsPolicy, SortSpec sortBy) {
        TableCreationParams params = TableCreationParams.builder()
                .columnSelections(columnSelections)
                .pruneMode(pruneMode)
                .absentMetricsPolicy(absentMetricsPolicy)
                .sortBy(sortBy)
                .build();
        return buildTable(entries, filters, slices, params);
    }

    private Table buildTable(List<Entry> entries, List<Condition> filters, List<Condition> slices,
                             TableCreationParams params) {
        long start = System.currentTimeMillis();
        List<Entry> prepared = pipelineService.createPreprocessing(filters)
                .convert(PipelineService.copyOf(entries));

        AggregationParams aggregationParams = AggregationParams.builder()
                .slices(slices)
                .categorizeMetadata(false)
                .pruneMode(params.getPruneMode())
                .absentMetricsPolicy(params.getAbsentMetricsPolicy())
                .build();
        List<Entry> aggregated = pipelineService.createAggregation(aggregationParams)
                .convert(PipelineService.copyOf(prepared));

        ColumnTree columnTree = selectColumns(ColumnTree.build(aggregated), params.getColumnSelections(),
                params.getColumnSelectionsToAdd(), params.getColumnSelectionsToRemove());
        List<TableColumn> columns = columnsWithUnits(columnTree, aggregated);

        SliceRecommendationStrategy strategy = params.getSliceRecommendationStrategy();
        List<String> recommendations = sliceRecommendationService.recommendForCategorized(prepared, slices,
                strategy == null ? SliceRecommendationStrategy.NONE : strategy);

        List<List<TableCell>> rows = new ArrayList<>();
        rows.add(headerRow(columns));
        for (Entry entry : aggregated) {
            rows.add(dataRow(entry, columns, FieldCategory.GROUP, true));
        }

        Table table = Table.builder()
                .rows(rows)
                .columnTree(columnTree.getRoot())
                .columns(columns)
                .filters(filters)
                .slices(slices)
                .sliceRecommendations(recommendations)
                .build();
        finish(table, params.getSortBy());

        meterRegistry.counter("metrics.tables.built", "kind", "aggregated").increment();
        log.info("Built table with {} rows and {} columns from {} entries in {} ms",
                aggregated.size(), columns.size(), entries.size(), System.currentTimeMillis() - start);
        return table;
    }

    /**
     * Table over individual entries, no aggregation. Rows are keyed by their {@code unique} metadata.
     */
    public Table buildEvaluationTable(List<Entry> entries, EvaluationTableParams params) {
        List<Condition> filters = ConditionParser.parseAll(params.getFilters());

        List<Conversion> conversions = new ArrayList<>();
        conversions.add(new CategorizeMetadataConversion());
        if (!filters.isEmpty()) {
            conversions.add(new FilterConversion(filters));
        }
        List<Entry> prepared = new ChainConversion(conversions).convert(PipelineService.copyOf(entries));

        ColumnTree columnTree = selectColumns(ColumnTree.build(prepared), params.getColumnSelections(),
                params.getColumnSelectionsToAdd(), params.getColumnSelectionsToRemove());
        List<TableColumn> columns = columnsWithUnits(columnTree, prepared);

        List<List<TableCell>> rows = new ArrayList<>();
        rows.add(headerRow(columns));
        for (Entry entry : prepared) {
            rows.add(dataRow(entry, columns, FieldCategory.UNIQUE, false));
        }

        Table table = Table.builder()
                .rows(rows)
                .columnTree(columnTree.getRoot())
                .columns(columns)
                .filters(filters)
                .build();
        finish(table, params.getSortBy());

        meterRegistry.counter("metrics.tables.built", "kind", "evaluation").increment();
        log.info("Built evaluation table with {} rows and {} columns", prepared.size(), columns.size());
        return table;
    }

    private static ColumnTree selectColumns(ColumnTree columnTree, List<String> selections,
                                            List<String> toAdd, List<String> toRemove) {
        columnTree.addSelection(selections);
        if (toAdd != null && !toAdd.isEmpty()) {
            columnTree.addSelection(toAdd);
        }
        if (toRemove != null && !toRemove.isEmpty()) {
            columnTree.removeSelection(toRemove);
        }
        return columnTree;
    }

    private static List<TableColumn> columnsWithUnits(ColumnTree columnTree, List<Entry> entries) {
        List<TableColumn> columns = columnTree.getSelection();
        for (TableColumn column : columns) {
            column.setUnit(determineColumnUnit(column, entries));
        }
        return columns;
    }

    private static void finish(Table table, SortSpec sortBy) {
        if (sortBy != null) {
            table.sortRows(sortBy.getColumnId(), sortBy.getSortOrder());
        }
        table.removeSubfields(HIDDEN_SUBFIELDS);
        table.flattenValues();
    }

    /**
     * {@code TIMESTAMP} when the field, or the parent of a min/max subfield, is categorized as such;
     * otherwise decided by the first entry holding a value.
     */
    static TableColumnUnit determineColumnUnit(TableColumn column, List<Entry> entries) {
        boolean metadataColumn = column.getColumnId().startsWith(ColumnTree.METADATA_PREFIX);
        String name = column.getName();
        for (Entry entry : entries) {
            Map<String, FieldValue> fields = metadataColumn ? entry.getMetadata() : entry.getMetrics();
            FieldValue field = fields.get(name);
            int slash = name.lastIndexOf('/');
            if (field == null && slash >= 0 && RANGE_SUBFIELDS.contains(name.substring(slash + 1))) {
                field = fields.get(name.substring(0, slash));
            }
            if (metadataColumn && field instanceof AnnotatedFieldValue annotated
                    && annotated.getCategory() == FieldCategory.TIMESTAMP) {
                return TableColumnUnit.TIMESTAMP;
            }
            Object value = Entry.fetchValue(fields, name);
            if (value != null) {
                return Values.isNumeric(value) ? TableColumnUnit.NUMERICAL : TableColumnUnit.STRING;
            }
        }
        return TableColumnUnit.STRING;
    }

    private static List<TableCell> headerRow(List<TableColumn> columns) {
        List<TableCell> header = new ArrayList<>();
        header.add(new TableCell());
        for (TableColumn column : columns) {
            TableCell cell = new TableCell();
            cell.getValues().put(FieldValue.VALUE, column.getName());
            cell.getDetails().put(NAME, column.getName());
            cell.getDetails().put(FieldValue.DESCRIPTION, column.getDescription());
            header.add(cell);
        }
        return header;
    }

    private static List<TableCell> dataRow(Entry entry, List<TableColumn> columns, FieldCategory keyCategory,
                                           boolean withRange) {
        List<TableCell> row = new ArrayList<>();
        TableCell key = new TableCell();
        entry.getMetadata().forEach((fieldName, field) -> {
            if (field instanceof AnnotatedFieldValue annotated && annotated.getCategory() == keyCategory) {
                key.getValues().put(fieldName, annotated.toPlain(Set.of()));
            }
            key.getDetails().put(fieldName, field == null ? null : field.toPlain(Set.of()));
        });
        row.add(key);

        for (TableColumn column : columns) {
            row.add(cell(entry, column, withRange));
        }
        return row;
    }

    private static TableCell cell(Entry entry, TableColumn column, boolean withRange) {
        TableCell cell = new TableCell();
        Map<String, FieldValue> fields = column.getColumnId().startsWith(ColumnTree.METADATA_PREFIX)
                ? entry.getMetadata() : entry.getMetrics();
        FieldValue field = fields.get(column.getName());
        if (field == null) {
            // leaf subfield column
            Object value = Entry.fetchValue(fields, column.getName());
            if (value != null) {
                cell.getValues().put(FieldValue.VALUE, value);
                cell.getDetails().put(FieldValue.VALUE, value);
            }
            return cell;
        }
        if (!(field instanceof AnnotatedFieldValue annotated)) {
            cell.getValues().put(FieldValue.VALUE, field.getValue());
            cell.getDetails().put(FieldValue.VALUE, field.getValue());
            return cell;
        }
        cell.getValues().put(FieldValue.VALUE, annotated.getValue());
        if (withRange && annotated.getMinValue() != null) {
            cell.getValues().put(FieldValue.MIN_VALUE, annotated.getMinValue());
        }
        if (withRange && annotated.getMaxValue() != null) {
            cell.getValues().put(FieldValue.MAX_VALUE, annotated.getMaxValue());
        }
        Map<String, Object> details = annotated.toMap(Set.of());
        details.put(NAME, column.getName());
        cell.setDetails(details);
        return cell;
    }
}
