package com.company.metrics.service;

import com.company.metrics.config.EngineProperties;
import com.company.metrics.conversion.AggregateConversion;
import com.company.metrics.conversion.CategorizeMetadataConversion;
import com.company.metrics.conversion.ChainConversion;
import com.company.metrics.conversion.Conversion;
import com.company.metrics.conversion.DeterminePruningConversion;
import com.company.metrics.conversion.FilterConversion;
import com.company.metrics.conversion.MsToSecondsConversion;
import com.company.metrics.conversion.PruneConversion;
import com.company.metrics.conversion.RoundConversion;
import com.company.metrics.conversion.SortByFieldConversion;
import com.company.metrics.domain.Condition;
import com.company.metrics.domain.Entry;
import com.company.metrics.domain.enums.AbsentMetricsPolicy;
import com.company.metrics.domain.enums.PruneMode;
import com.company.metrics.dto.request.AggregationParams;
import com.company.metrics.dto.request.MetricsTuneParams;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry-level operations and the conversion chains built from them.
 * Every public operation works on a deep copy; callers' entries are never modified.
 */
@Service
@Slf4j
@Validated
@RequiredArgsConstructor
public class PipelineService {

    private final EngineProperties properties;
    private final MeterRegistry meterRegistry;

    public List<Entry> categorize(List<Entry> entries) {
        return new CategorizeMetadataConversion().convert(copyOf(entries));
    }

    public List<Entry> filter(List<Entry> entries, List<Condition> conditions) {
        return new FilterConversion(conditions).convert(copyOf(entries));
    }

    /**
     * Groups and collapses entries. The result is in order of first occurrence, not sorted.
     */
    public List<Entry> aggregate(List<Entry> entries, List<Condition> slices, AbsentMetricsPolicy policy) {
        return new AggregateConversion(slices, policy, meterRegistry).convert(copyOf(entries));
    }

    /**
     * Descending by {@code fieldName}; entries lacking the field sort last.
     */
    public List<Entry> sortByField(List<Entry> entries, String fieldName) {
        return new SortByFieldConversion(fieldName).convert(copyOf(entries));
    }

    /**
     * Most recent first, using the configured timestamp field and its fallback.
     */
    public List<Entry> sortByTimestamp(List<Entry> entries) {
        return timestampSort().convert(copyOf(entries));
    }

    public List<Entry> determinePruning(List<Entry> entries) {
        return determinePruningConversion().convert(copyOf(entries));
    }

    public List<Entry> prune(List<Entry> entries, PruneMode mode) {
        return new PruneConversion(mode).convert(copyOf(entries));
    }

    public List<Entry> tuneMetrics(List<Entry> entries, @Valid MetricsTuneParams params) {
        return createMetricsTuning(params).convert(copyOf(entries));
    }

    public List<Entry> runAggregation(List<Entry> entries, @Valid AggregationParams params) {
        return createAggregation(params).convert(copyOf(entries));
    }

    /**
     * Optional ms to s renaming, rounding and pruning determination, in that order.
     */
    public Conversion createMetricsTuning(@Valid MetricsTuneParams params) {
        List<Conversion> conversions = new ArrayList<>();
        if (params.isMsToSeconds()) {
            conversions.add(new MsToSecondsConversion());
        }
        if (params.isRound()) {
            conversions.add(new RoundConversion(properties.resolveRoundPrecision(params.getRoundPrecision())));
        }
        if (params.isDeterminePruning()) {
            conversions.add(determinePruningConversion());
        }
        return new ChainConversion(conversions);
    }

    /**
     * Categorize, filter, sort most recent first, aggregate, re-sort the aggregates by their latest
     * timestamp, prune and round. Sorting before aggregation gives the most recent entries priority
     * as templates.
     */
    public Conversion createAggregation(@Valid AggregationParams params) {
        List<Conversion> conversions = new ArrayList<>();
        if (params.isCategorizeMetadata()) {
            conversions.add(new CategorizeMetadataConversion());
        }
        if (params.getFilters() != null && !params.getFilters().isEmpty()) {
            conversions.add(new FilterConversion(params.getFilters()));
        }
        conversions.add(timestampSort());
        conversions.add(new AggregateConversion(params.getSlices(), params.getAbsentMetricsPolicy(), meterRegistry));
        conversions.add(new SortByFieldConversion(properties.getAggregatedTimestampField()));
        if (params.getPruneMode() != PruneMode.NONE) {
            conversions.add(new PruneConversion(params.getPruneMode()));
        }
        if (params.isRound()) {
            conversions.add(new RoundConversion(properties.resolveRoundPrecision(params.getRoundPrecision())));
        }
        log.debug("Aggregation chain: {} conversions, slices {}", conversions.size(), params.getSlices());
        return new ChainConversion(conversions);
    }

    /**
     * Categorize, optionally filter, then sort most recent first. Shared entry step of the reports.
     */
    public Conversion createPreprocessing(List<Condition> filters) {
        List<Conversion> conversions = new ArrayList<>();
        conversions.add(new CategorizeMetadataConversion());
        if (!filters.isEmpty()) {
            conversions.add(new FilterConversion(filters));
        }
        conversions.add(timestampSort());
        return new ChainConversion(conversions);
    }

    public Conversion timestampSort() {
        return new SortByFieldConversion(properties.getTimestampField(), properties.getFallbackTimestampField());
    }

    private DeterminePruningConversion determinePruningConversion() {
        return new DeterminePruningConversion(properties.getPruneMinThreshold(),
                properties.getPruneMinVariationRatio());
    }

    static List<Entry> copyOf(List<Entry> entries) {
        List<Entry> copy = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            copy.add(entry.copy());
        }
        return copy;
    }
}
