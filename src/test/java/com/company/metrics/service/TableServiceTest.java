package com.company.metrics.service;

import com.company.metrics.config.EngineProperties;
import com.company.metrics.domain.Condition;
import com.company.metrics.domain.Entry;
import com.company.metrics.domain.enums.AbsentMetricsPolicy;
import com.company.metrics.domain.enums.PruneMode;
import com.company.metrics.domain.enums.SelectionState;
import com.company.metrics.domain.enums.SliceRecommendationStrategy;
import com.company.metrics.domain.enums.SortOrder;
import com.company.metrics.domain.enums.TableColumnUnit;
import com.company.metrics.dto.request.EvaluationTableParams;
import com.company.metrics.dto.request.MetricsTuneParams;
import com.company.metrics.dto.request.TableCreationParams;
import com.company.metrics.dto.response.SortSpec;
import com.company.metrics.dto.response.Table;
import com.company.metrics.dto.response.TableCell;
import com.company.metrics.dto.response.TableColumn;
import com.company.metrics.exception.ColumnNotFoundException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TableServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private PipelineService pipelineService;
    private TableService tableService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        pipelineService = new PipelineService(new EngineProperties(), meterRegistry);
        tableService = new TableService(pipelineService, new SliceRecommendationService(), meterRegistry);
    }

    @Test
    void aggregatesSlicesIntoRows() {
        TableCreationParams params = TableCreationParams.builder()
                .slices(List.of("agent_name"))
                .columnSelections(List.of("/metrics/", "/metadata/time_end_utc/max_value"))
                .pruneMode(PruneMode.NONE)
                .sortBy(new SortSpec("/metrics/latency", SortOrder.DESC))
                .build();

        Table table = tableService.buildTable(runs(), params);

        assertThat(table.getColumns()).extracting(TableColumn::getName)
                .containsExactly("time_end_utc/max_value", "latency", "score", "tiny");
        assertThat(table.getColumns()).extracting(TableColumn::getUnit)
                .containsExactly(TableColumnUnit.TIMESTAMP, TableColumnUnit.NUMERICAL,
                        TableColumnUnit.NUMERICAL, TableColumnUnit.NUMERICAL);

        List<List<TableCell>> rows = table.getRows();
        assertThat(rows).hasSize(3);
        assertThat(rows.get(0).get(2).getValues()).containsEntry("value", "latency");

        // sorted by latency, descending
        assertThat(rows.get(1).get(0).getValues()).containsEntry("agent_name", "b");
        assertThat(rows.get(2).get(0).getValues()).containsEntry("agent_name", "a");
        assertThat(rows.get(2).get(1).getValues()).containsEntry("value", "2025-01-02T00:00:00");
        assertThat(rows.get(2).get(2).getValues())
                .containsEntry("value", 15.0)
                .containsEntry("min_value", 10.0)
                .containsEntry("max_value", 20.0);
        assertThat(rows.get(2).get(2).getDetails())
                .containsEntry("name", "latency")
                .containsEntry("n_samples", 2)
                .doesNotContainKey("prune");
        assertThat(rows.get(2).get(3).getValues()).containsEntry("value", 0.6);

        assertThat(table.getSlices()).containsExactly(Condition.slice("agent_name"));
        assertThat(table.getSliceRecommendations()).containsExactly("model");
        assertThat(table.getSortedBy()).isEqualTo(new SortSpec("/metrics/latency", SortOrder.DESC));
        assertThat(table.getColumnTree().getSelectionState()).isEqualTo(SelectionState.PARTIAL);
        assertThat(meterRegistry.counter("metrics.tables.built", "kind", "aggregated").count()).isEqualTo(1.0);
    }

    @Test
    void callerEntriesAreNotModified() {
        List<Entry> entries = runs();

        tableService.buildTable(entries, TableCreationParams.builder().slices(List.of("agent_name")).build());

        assertThat(entries.get(0).getMetadata().get("agent_name").isAnnotated()).isFalse();
        assertThat(entries).hasSize(3);
    }

    @Test
    void filtersApplyBeforeAggregation() {
        TableCreationParams params = TableCreationParams.builder()
                .filters(List.of("model:in:m1"))
                .columnSelections(List.of("/metrics/latency"))
                .sliceRecommendationStrategy(SliceRecommendationStrategy.NONE)
                .build();

        Table table = tableService.buildTable(runs(), params);

        assertThat(table.getRows()).hasSize(2);
        assertThat(table.getRows().get(1).get(1).getValues()).containsEntry("value", 20.0);
        assertThat(table.getFilters()).containsExactly(Condition.in("model", List.of("m1")));
        assertThat(table.getSliceRecommendations()).isEmpty();
    }

    @Test
    void columnPruningRemovesMetricsFlaggedEverywhere() {
        List<Entry> tuned = pipelineService.tuneMetrics(runs(), MetricsTuneParams.builder().build());

        Table table = tableService.buildTable(tuned, List.of(), List.of(Condition.slice("agent_name")),
                List.of("/metrics/"), PruneMode.COLUMN, AbsentMetricsPolicy.ALL_OR_NOTHING, null);

        assertThat(table.getColumns()).extracting(TableColumn::getName).containsExactly("latency", "score");
        assertThat(table.getColumnTree().getChildren().get(1).getChildren())
                .noneMatch(node -> node.getColumnNodeId().equals("/metrics/tiny"));
    }

    @Test
    void withoutColumnPruningFlaggedMetricsStay() {
        List<Entry> tuned = pipelineService.tuneMetrics(runs(), MetricsTuneParams.builder().build());

        Table table = tableService.buildTable(tuned, List.of(), List.of(),
                List.of("/metrics/"), PruneMode.NONE, AbsentMetricsPolicy.ALL_OR_NOTHING, null);

        assertThat(table.getColumns()).extracting(TableColumn::getName).contains("tiny");
        assertThat(table.getRows().get(1).get(0).getValues()).isEmpty();
    }

    @Test
    void sortingByAnUnselectedColumnFails() {
        TableCreationParams params = TableCreationParams.builder()
                .columnSelections(List.of("/metrics/latency"))
                .sortBy(new SortSpec("/metrics/score", SortOrder.ASC))
                .build();

        assertThatThrownBy(() -> tableService.buildTable(runs(), params))
                .isInstanceOf(ColumnNotFoundException.class);
    }

    @Test
    void selectionsToAddAndRemoveApplyAfterTheBaseSelection() {
        TableCreationParams params = TableCreationParams.builder()
                .columnSelections(List.of("/metrics/"))
                .columnSelectionsToAdd(List.of("/metrics/latency/max_value"))
                .columnSelectionsToRemove(List.of("/metrics/score"))
                .build();

        Table table = tableService.buildTable(runs(), params);

        assertThat(table.getColumns()).extracting(TableColumn::getColumnId)
                .containsExactly("/metrics/latency", "/metrics/latency/max_value", "/metrics/tiny");
        assertThat(table.getRows().get(1).get(2).getValues()).containsEntry("value", 30.0);
    }

    @Test
    void evaluationTableKeepsOneRowPerEntry() {
        EvaluationTableParams params = EvaluationTableParams.builder()
                .columnSelections(List.of("/metrics/score"))
                .sortBy(new SortSpec("/metrics/score", SortOrder.ASC))
                .build();

        Table table = tableService.buildEvaluationTable(runs(), params);

        assertThat(table.getRows()).hasSize(4);
        assertThat(table.getRows().get(1).get(0).getValues()).containsEntry("run_id", "r1");
        assertThat(table.getRows().get(1).get(1).getValues()).containsEntry("value", 0.5);
        assertThat(table.getRows().get(3).get(1).getValues()).containsEntry("value", 0.9);
        assertThat(table.getSlices()).isEmpty();
        assertThat(meterRegistry.counter("metrics.tables.built", "kind", "evaluation").count()).isEqualTo(1.0);
    }

    static List<Entry> runs() {
        return List.of(
                run("r1", "a", "m1", "2025-01-01T00:00:00", 10, 0.5),
                run("r2", "a", "m2", "2025-01-02T00:00:00", 20, 0.7),
                run("r3", "b", "m1", "2025-01-03T00:00:00", 30, 0.9));
    }

    private static Entry run(String runId, String agent, String model, String time, int latency, double score) {
        return new Entry(runId)
                .putMetadata("run_id", runId)
                .putMetadata("agent_name", agent)
                .putMetadata("model", model)
                .putMetadata("time_end_utc", time)
                .putMetric("latency", latency)
                .putMetric("score", score)
                .putMetric("tiny", 0.001);
    }
}
