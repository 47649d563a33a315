package com.company.metrics.conversion;

import com.company.metrics.domain.AnnotatedFieldValue;
import com.company.metrics.domain.Condition;
import com.company.metrics.domain.Entry;
import com.company.metrics.domain.FieldValue;
import com.company.metrics.domain.SliceKey;
import com.company.metrics.domain.enums.AbsentMetricsPolicy;
import com.company.metrics.domain.enums.FieldCategory;
import com.company.metrics.util.Values;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Groups entries by their {@link SliceKey} and collapses each group into one entry.
 * <p>
 * Metadata identical across a group is kept as is; {@code timestamp} fields and numeric
 * {@code unique} fields get {@code min_value}, {@code max_value} and {@code n_samples}.
 * Each metric that is numeric in the first member is averaged over the members according
 * to the {@link AbsentMetricsPolicy}, with min/max/n_samples recorded. The output order
 * follows the first occurrence of each key; callers sort afterwards.
 */
@Slf4j
public class AggregateConversion implements Conversion {

    public static final String DEFAULT_NAME = "aggregated";

    private final List<Condition> slices;
    private final AbsentMetricsPolicy policy;
    private final MeterRegistry meterRegistry;

    public AggregateConversion(List<Condition> slices) {
        this(slices, AbsentMetricsPolicy.ALL_OR_NOTHING);
    }

    public AggregateConversion(List<Condition> slices, AbsentMetricsPolicy policy) {
        this(slices, policy, Metrics.globalRegistry);
    }

    public AggregateConversion(List<Condition> slices, AbsentMetricsPolicy policy, MeterRegistry meterRegistry) {
        this.slices = List.copyOf(slices);
        this.policy = policy;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public List<Entry> convert(List<Entry> entries) {
        Map<SliceKey, List<Entry>> groups = group(entries, slices);

        List<Entry> aggregated = new ArrayList<>(groups.size());
        for (Map.Entry<SliceKey, List<Entry>> group : groups.entrySet()) {
            aggregated.add(aggregate(group.getKey(), group.getValue()));
        }

        meterRegistry.counter("metrics.aggregation.groups", "policy", policy.getCode())
                .increment(aggregated.size());
        return aggregated;
    }

    /**
     * Partitions entries by slice key, keeping the order of first occurrence.
     */
    public static Map<SliceKey, List<Entry>> group(List<Entry> entries, List<Condition> slices) {
        Map<SliceKey, List<Entry>> groups = new LinkedHashMap<>();
        for (Entry entry : entries) {
            groups.computeIfAbsent(SliceKey.of(entry, slices), k -> new ArrayList<>()).add(entry);
        }
        return groups;
    }

    private Entry aggregate(SliceKey key, List<Entry> members) {
        String name = createEntryName(slices, key);
        log.debug("Aggregating {} entries into group {}", members.size(), name);

        Entry result = new Entry(name);
        result.setMetadata(sortedByKey(aggregateMetadata(members)));
        result.setMetrics(sortedByKey(aggregateMetrics(members)));
        return result;
    }

    /**
     * Builds a name out of the slice conditions and the key: {@code <field>_<value>} for slices,
     * the condition text prefixed with {@code not_} when false for boolean conditions.
     */
    public static String createEntryName(List<Condition> slices, SliceKey key) {
        if (slices.isEmpty()) {
            return DEFAULT_NAME;
        }
        List<String> nameParts = new ArrayList<>(slices.size());
        for (int i = 0; i < slices.size(); i++) {
            Condition slice = slices.get(i);
            Object keyValue = key.get(i);
            String namePart;
            if (slice.isSlice()) {
                namePart = slice.getFieldName() + "_" + Values.toDisplayString(keyValue);
            } else {
                namePart = (Boolean.TRUE.equals(keyValue) ? "" : "not_") + slice;
            }
            nameParts.add(namePart.replace('/', '_').replace(':', '_').replace(' ', '_'));
        }
        return String.join("_", nameParts);
    }

    private Map<String, FieldValue> aggregateMetadata(List<Entry> members) {
        Map<String, FieldValue> metadata = new LinkedHashMap<>();

        Set<String> fieldNames = new TreeSet<>();
        for (Entry member : members) {
            fieldNames.addAll(member.getMetadata().keySet());
        }
        fieldNames.remove(Entry.FILES_FIELD);

        for (String fieldName : fieldNames) {
            FieldValue first = members.get(0).getMetadata().get(fieldName);
            boolean sameInAll = true;
            for (Entry member : members.subList(1, members.size())) {
                if (!Objects.equals(first, member.getMetadata().get(fieldName))) {
                    sameInAll = false;
                    break;
                }
            }
            if (sameInAll && first != null) {
                metadata.put(fieldName, first.copy());
            }

            if (!(firstPresent(members, fieldName) instanceof AnnotatedFieldValue annotated)) {
                continue;
            }
            FieldCategory category = annotated.getCategory();
            if (category == FieldCategory.TIMESTAMP
                    || (category == FieldCategory.UNIQUE && Values.isNumeric(annotated.getValue()))) {
                AnnotatedFieldValue summary = summarizeMetadataField(fieldName, annotated, members);
                if (sameInAll) {
                    summary.setValue(annotated.getValue());
                }
                metadata.put(fieldName, summary);
            }
        }
        return metadata;
    }

    private static FieldValue firstPresent(List<Entry> members, String fieldName) {
        for (Entry member : members) {
            FieldValue field = member.getMetadata().get(fieldName);
            if (field != null) {
                return field;
            }
        }
        return null;
    }

    private AnnotatedFieldValue summarizeMetadataField(String fieldName, AnnotatedFieldValue first,
                                                       List<Entry> members) {
        AnnotatedFieldValue summary = first.copy();
        summary.setValue(null);
        Object min = null;
        Object max = null;
        int samples = 0;

        for (Entry member : members) {
            Object value = Entry.fetchValue(member.getMetadata(), fieldName);
            if (Values.isFalsy(value)) {
                continue;
            }
            if (min != null && !Values.isComparable(min, value)) {
                log.debug("Ignoring value {} of metadata field {}: not comparable with {}", value, fieldName, min);
                continue;
            }
            samples++;
            min = (min == null || Values.compare(value, min) < 0) ? value : min;
            max = (max == null || Values.compare(value, max) > 0) ? value : max;
        }

        summary.setMinValue(min);
        summary.setMaxValue(max);
        summary.setNSamples(samples);
        return summary;
    }

    private Map<String, FieldValue> aggregateMetrics(List<Entry> members) {
        // The first member's numeric metrics decide what is aggregated and serve as templates
        Map<String, FieldValue> templates = new LinkedHashMap<>();
        members.get(0).getMetrics().forEach((key, metric) -> {
            if (metric != null && Values.isNumeric(metric.getValue())) {
                templates.put(key, metric);
            }
        });

        Map<String, FieldValue> metrics = new LinkedHashMap<>();
        for (Map.Entry<String, FieldValue> template : templates.entrySet()) {
            AnnotatedFieldValue aggregated = aggregateMetric(template.getKey(), template.getValue(), members);
            if (aggregated != null) {
                metrics.put(template.getKey(), aggregated);
            }
        }
        return metrics;
    }

    /**
     * @return the aggregated metric, or null when the policy drops it
     */
    private AnnotatedFieldValue aggregateMetric(String key, FieldValue template, List<Entry> members) {
        double total = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int samples = 0;
        boolean pruneInAll = true;

        for (Entry member : members) {
            FieldValue metric = member.getMetrics().get(key);
            Object value = metric == null ? null : metric.getValue();

            if (!Values.isNumeric(value)) {
                String reason = value == null ? "absent" : "non_numeric";
                if (policy == AbsentMetricsPolicy.ALL_OR_NOTHING) {
                    log.debug("Dropping metric {}: {} in some grouped entries (policy {})", key, reason, policy);
                    meterRegistry.counter("metrics.aggregation.metrics.dropped",
                            "policy", policy.getCode(),
                            "reason", reason
                    ).increment();
                    return null;
                }
                if (policy == AbsentMetricsPolicy.ACCEPT_SUBSET) {
                    log.debug("Excluding {} metric {} of entry {} from samples", reason, key, member.getName());
                    continue;
                }
                value = 0.0;
            }

            double v = ((Number) value).doubleValue();
            total += v;
            samples++;
            min = Math.min(min, v);
            max = Math.max(max, v);
            if (pruneInAll && !(metric instanceof AnnotatedFieldValue annotated && annotated.isPruned())) {
                pruneInAll = false;
            }
        }

        if (samples == 0) {
            log.debug("Dropping metric {}: no samples (policy {})", key, policy);
            meterRegistry.counter("metrics.aggregation.metrics.dropped",
                    "policy", policy.getCode(),
                    "reason", "no_samples"
            ).increment();
            return null;
        }

        AnnotatedFieldValue aggregated = template.copy().promote();
        aggregated.setValue(total / samples);
        aggregated.setMinValue(min);
        aggregated.setMaxValue(max);
        aggregated.setNSamples(samples);
        aggregated.setPrune(pruneInAll ? Boolean.TRUE : null);
        return aggregated;
    }

    private static Map<String, FieldValue> sortedByKey(Map<String, FieldValue> fields) {
        return new LinkedHashMap<>(new TreeMap<>(fields));
    }

    @Override
    public String getDescription() {
        return "Aggregate by " + slices + " (" + policy.getCode() + ")";
    }
}
