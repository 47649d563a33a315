package com.company.metrics.service;

import com.company.metrics.config.EngineProperties;
import com.company.metrics.conversion.AggregateConversion;
import com.company.metrics.conversion.CategorizeMetadataConversion;
import com.company.metrics.conversion.ChainConversion;
import com.company.metrics.conversion.Conversion;
import com.company.metrics.conversion.FilterConversion;
import com.company.metrics.domain.Condition;
import com.company.metrics.domain.Entry;
import com.company.metrics.domain.FieldValue;
import com.company.metrics.domain.enums.AbsentMetricsPolicy;
import com.company.metrics.dto.request.MovingAggregationParams;
import com.company.metrics.dto.response.MovingAggregation;
import com.company.metrics.util.ConditionParser;
import com.company.metrics.util.TimeUtils;
import com.company.metrics.util.Values;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Time series of one field over fixed-width buckets, optionally one series per slice value.
 * <p>
 * Buckets are half-open {@code (begin, begin + granulation]} and anchored on the most recent
 * entry, so that entry closes the last bucket and the oldest entry falls in the first one.
 */
@Service
@Slf4j
@Validated
@RequiredArgsConstructor
public class MovingAggregationService {

    private static final List<String> AGGREGATE_SUBFIELDS =
            List.of(FieldValue.N_SAMPLES, FieldValue.MIN_VALUE, FieldValue.MAX_VALUE);

    private final EngineProperties properties;
    private final PipelineService pipelineService;
    private final MeterRegistry meterRegistry;

    public MovingAggregation movingAggregation(List<Entry> entries, Duration granularity, String fieldName,
                                               List<Condition> globalFilters, List<Condition> localFilters,
                                               String sliceField) {
        return build(entries, granularity.toMillis(), fieldName, globalFilters, localFilters,
                sliceField == null ? "" : sliceField, properties.getRoundPrecision());
    }

    public MovingAggregation movingAggregation(List<Entry> entries, @Valid MovingAggregationParams params) {
        return build(entries, params.getTimeGranulation(), params.getFieldName(),
                ConditionParser.parseAll(params.getGlobalFilters()),
                ConditionParser.parseAll(params.getFilters()),
                params.getSliceField() == null ? "" : params.getSliceField(),
                properties.resolveRoundPrecision(params.getRoundPrecision()));
    }

    private MovingAggregation build(List<Entry> entries, long granulation, String fieldName,
                                    List<Condition> globalFilters, List<Condition> localFilters,
                                    String sliceField, int roundPrecision) {
        if (granulation <= 0) {
            throw new IllegalArgumentException("Time granulation must be positive, got " + granulation + " ms");
        }

        List<Conversion> conversions = new ArrayList<>();
        if (!globalFilters.isEmpty()) {
            conversions.add(new FilterConversion(globalFilters));
        }
        conversions.add(pipelineService.timestampSort());
        conversions.add(new CategorizeMetadataConversion());
        List<Entry> prepared = new ChainConversion(conversions).convert(PipelineService.copyOf(entries));

        List<TimedEntry> timed = new ArrayList<>(prepared.size());
        for (Entry entry : prepared) {
            Long time = TimeUtils.toEpochMillis(entry.fetchValue(properties.getTimestampField()));
            if (time == null) {
                log.warn("Skipping entry {} without a parseable {}", entry.getName(), properties.getTimestampField());
                continue;
            }
            timed.add(new TimedEntry(entry, time));
        }
        // Most recent instant first. Text order differs from it when UTC offsets differ.
        timed.sort(Comparator.comparingLong(TimedEntry::getTime).reversed());

        MovingAggregation.MovingAggregationBuilder result = MovingAggregation.builder()
                .timeGranulation(granulation)
                .fieldName(fieldName)
                .filters(localFilters)
                .sliceField(sliceField);
        if (timed.isEmpty()) {
            return result.build();
        }

        // Slice values in order of first appearance, most recent entries first
        Map<String, Integer> sliceIndex = new LinkedHashMap<>();
        if (!sliceField.isEmpty()) {
            for (TimedEntry timedEntry : timed) {
                Entry entry = timedEntry.getEntry();
                if (FilterConversion.matches(entry, localFilters)) {
                    sliceIndex.putIfAbsent(Values.toDisplayString(entry.fetchValue(sliceField)), sliceIndex.size());
                }
            }
        }

        long timeEnd = timed.get(0).getTime();
        long span = timeEnd - timed.get(timed.size() - 1).getTime();
        long buckets = span / granulation + 1;
        long timeBegin = timeEnd - buckets * granulation;

        List<List<Double>> values = new ArrayList<>();
        int series = Math.max(1, sliceIndex.size());
        for (int i = 0; i < series; i++) {
            values.add(new ArrayList<>());
        }

        String baseFieldName = extractBaseFieldName(fieldName);
        List<Condition> slices = sliceField.isEmpty() ? List.of() : List.of(Condition.slice(sliceField));
        AggregateConversion aggregation = new AggregateConversion(slices, AbsentMetricsPolicy.NULLIFY, meterRegistry);

        double minValue = Double.NaN;
        double maxValue = Double.NaN;
        int cursor = timed.size() - 1;
        for (long bucket = 0; bucket < buckets; bucket++) {
            long bucketEnd = timeBegin + (bucket + 1) * granulation;

            List<Entry> bucketEntries = new ArrayList<>();
            while (cursor >= 0 && timed.get(cursor).getTime() <= bucketEnd) {
                Entry entry = timed.get(cursor--).getEntry();
                if (FilterConversion.matches(entry, localFilters)) {
                    bucketEntries.add(narrow(entry, sliceField, baseFieldName));
                }
            }

            for (Entry aggregated : aggregation.convert(bucketEntries)) {
                Integer index = sliceField.isEmpty()
                        ? Integer.valueOf(0)
                        : sliceIndex.get(Values.toDisplayString(aggregated.fetchValue(sliceField)));
                if (index == null) {
                    log.warn("Skipping group {}: slice field {} is not a metadata field", aggregated.getName(), sliceField);
                    continue;
                }
                Object sample = aggregated.fetchValue(fieldName);
                double value = Values.isNumeric(sample)
                        ? Values.round(Values.toDouble(sample), roundPrecision)
                        : 0.0;
                values.get(index).add(value);
                minValue = Double.isNaN(minValue) ? value : Math.min(minValue, value);
                maxValue = Double.isNaN(maxValue) ? value : Math.max(maxValue, value);
            }

            // empty buckets keep every series the same length
            for (List<Double> row : values) {
                if (row.size() == bucket) {
                    row.add(0.0);
                    minValue = Double.isNaN(minValue) ? 0.0 : Math.min(minValue, 0.0);
                    maxValue = Double.isNaN(maxValue) ? 0.0 : Math.max(maxValue, 0.0);
                }
            }
        }

        if (cursor >= 0) {
            log.warn("{} entries fell outside the last bucket ending at {}", cursor + 1, timeEnd);
        }

        meterRegistry.counter("metrics.moving_aggregations.built").increment();
        log.info("Moving aggregation of {} over {} buckets of {} ({} entries, {} series)",
                fieldName, buckets, TimeUtils.formatDuration(granulation), timed.size(), values.size());

        return result
                .timeBegin(timeBegin)
                .timeEnd(timeEnd)
                .sliceValues(new ArrayList<>(sliceIndex.keySet()))
                .values(values)
                .minValue(minValue)
                .maxValue(maxValue)
                .build();
    }

    @Value
    private static class TimedEntry {
        Entry entry;
        long time;
    }

    /**
     * Copy of {@code entry} holding only the slice field and the base field.
     */
    private static Entry narrow(Entry entry, String sliceField, String baseFieldName) {
        Entry narrowed = new Entry(entry.getName());
        if (!sliceField.isEmpty() && entry.getMetadata().get(sliceField) != null) {
            narrowed.getMetadata().put(sliceField, entry.getMetadata().get(sliceField).copy());
        }
        FieldValue metadataField = entry.getMetadata().get(baseFieldName);
        if (metadataField != null) {
            narrowed.getMetadata().put(baseFieldName, metadataField.copy());
        }
        FieldValue metricsField = entry.getMetrics().get(baseFieldName);
        if (metricsField != null) {
            narrowed.getMetrics().put(baseFieldName, metricsField.copy());
        }
        return narrowed;
    }

    /**
     * Strips a trailing aggregation subfield: {@code latency/max_value} becomes {@code latency}.
     */
    static String extractBaseFieldName(String fieldName) {
        for (String subfield : AGGREGATE_SUBFIELDS) {
            String suffix = "/" + subfield;
            if (fieldName.endsWith(suffix)) {
                return fieldName.substring(0, fieldName.length() - suffix.length());
            }
        }
        return fieldName;
    }
}
