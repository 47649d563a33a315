package com.company.metrics.conversion;

import com.company.metrics.domain.AnnotatedFieldValue;
import com.company.metrics.domain.Entry;
import com.company.metrics.domain.FieldValue;
import com.company.metrics.util.Values;

import java.util.List;
import java.util.Map;

/**
 * Rounds floating-point metric values (and their min/max) to a fixed number of decimals.
 */
public class RoundConversion implements Conversion {

    private final int precision;

    public RoundConversion(int precision) {
        this.precision = precision;
    }

    @Override
    public List<Entry> convert(List<Entry> entries) {
        for (Entry entry : entries) {
            Map<String, FieldValue> metrics = entry.getMetrics();
            metrics.replaceAll((key, metric) -> round(metric));
        }
        return entries;
    }

    private FieldValue round(FieldValue metric) {
        if (metric instanceof AnnotatedFieldValue annotated) {
            annotated.setValue(roundIfFloating(annotated.getValue()));
            annotated.setMinValue(roundIfFloating(annotated.getMinValue()));
            annotated.setMaxValue(roundIfFloating(annotated.getMaxValue()));
            return annotated;
        }
        Object value = metric.getValue();
        return isFloating(value) ? FieldValue.of(roundIfFloating(value)) : metric;
    }

    private Object roundIfFloating(Object value) {
        return isFloating(value) ? Values.round(((Number) value).doubleValue(), precision) : value;
    }

    private static boolean isFloating(Object value) {
        return value instanceof Double || value instanceof Float;
    }

    @Override
    public String getDescription() {
        return "Round numeric values to " + precision + " digits after dot";
    }
}
