package com.company.metrics.conversion;

import com.company.metrics.domain.AnnotatedFieldValue;
import com.company.metrics.domain.Entry;
import com.company.metrics.domain.FieldValue;
import com.company.metrics.util.Values;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags low-information metrics with {@code prune=true} without removing them:
 * <ul>
 *     <li>values below {@code minThreshold}</li>
 *     <li>{@code <base>_success} equal to {@code <base>_all} or {@code <base>}</li>
 *     <li>{@code <base>_min} / {@code <base>_max} within {@code minVariationRatio} of {@code <base>_avg}</li>
 * </ul>
 */
@Slf4j
public class DeterminePruningConversion implements Conversion {

    public static final double DEFAULT_MIN_THRESHOLD = 0.011;
    public static final double DEFAULT_MIN_VARIATION_RATIO = 0.33;

    private static final String ALL_SUFFIX = "_all";
    private static final String SUCCESS_SUFFIX = "_success";
    private static final String AVG_SUFFIX = "_avg";
    private static final String MIN_SUFFIX = "_min";
    private static final String MAX_SUFFIX = "_max";

    private final double minThreshold;
    private final double minVariationRatio;

    public DeterminePruningConversion() {
        this(DEFAULT_MIN_THRESHOLD, DEFAULT_MIN_VARIATION_RATIO);
    }

    public DeterminePruningConversion(double minThreshold, double minVariationRatio) {
        this.minThreshold = minThreshold;
        this.minVariationRatio = minVariationRatio;
    }

    @Override
    public List<Entry> convert(List<Entry> entries) {
        for (Entry entry : entries) {
            markBelowThreshold(entry);
            markSuccessEqualToAll(entry);
            markNarrowMinMax(entry);
        }
        return entries;
    }

    private void markBelowThreshold(Entry entry) {
        for (Map.Entry<String, FieldValue> metric : entry.getMetrics().entrySet()) {
            Double value = Values.toDouble(metric.getValue().getValue());
            if (value != null && value < minThreshold) {
                markPrune(entry, metric.getKey());
            }
        }
    }

    private void markSuccessEqualToAll(Entry entry) {
        Map<String, FieldValue> metrics = entry.getMetrics();
        Map<String, FieldValue> allMetrics = new HashMap<>();
        Map<String, String> successKeys = new HashMap<>();

        for (Map.Entry<String, FieldValue> metric : metrics.entrySet()) {
            String key = metric.getKey();
            allMetrics.put(key, metric.getValue());
            if (key.endsWith(ALL_SUFFIX)) {
                // reachable both as "<base>_all" and "<base>"
                allMetrics.put(stripSuffix(key, ALL_SUFFIX), metric.getValue());
            } else if (key.endsWith(SUCCESS_SUFFIX)) {
                successKeys.put(stripSuffix(key, SUCCESS_SUFFIX), key);
            }
        }

        for (Map.Entry<String, String> success : successKeys.entrySet()) {
            FieldValue all = allMetrics.get(success.getKey());
            if (all == null) {
                continue;
            }
            Object successValue = metrics.get(success.getValue()).getValue();
            Object allValue = all.getValue();
            if (Values.isNumeric(successValue) && Values.isNumeric(allValue)
                    && Values.valueEquals(successValue, allValue)) {
                markPrune(entry, success.getValue());
            }
        }
    }

    private void markNarrowMinMax(Entry entry) {
        Map<String, FieldValue> metrics = entry.getMetrics();
        for (String key : List.copyOf(metrics.keySet())) {
            if (!key.endsWith(AVG_SUFFIX)) {
                continue;
            }
            Double avg = Values.toDouble(metrics.get(key).getValue());
            if (avg == null || avg == 0.0) {
                continue;
            }
            String base = stripSuffix(key, AVG_SUFFIX);
            markIfNarrow(entry, base + MIN_SUFFIX, avg);
            markIfNarrow(entry, base + MAX_SUFFIX, avg);
        }
    }

    private void markIfNarrow(Entry entry, String key, double avg) {
        FieldValue metric = entry.getMetrics().get(key);
        if (metric == null) {
            return;
        }
        Double value = Values.toDouble(metric.getValue());
        if (value != null && Math.abs(avg - value) / Math.abs(avg) < minVariationRatio) {
            markPrune(entry, key);
        }
    }

    private static void markPrune(Entry entry, String key) {
        AnnotatedFieldValue metric = entry.getMetrics().get(key).promote();
        metric.setPrune(true);
        entry.getMetrics().put(key, metric);
        log.debug("Marked metric {} of entry {} for pruning", key, entry.getName());
    }

    private static String stripSuffix(String key, String suffix) {
        return key.substring(0, key.length() - suffix.length());
    }

    @Override
    public String getDescription() {
        return "Determine pruning";
    }
}
