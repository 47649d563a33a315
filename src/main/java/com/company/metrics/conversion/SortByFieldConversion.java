package com.company.metrics.conversion;

import com.company.metrics.domain.Entry;
import com.company.metrics.util.Values;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Sorts entries by a field, largest (most recent) first. Entries without the field
 * fall back to {@code fallbackFieldName} when given, and sort last otherwise.
 */
public class SortByFieldConversion implements Conversion {

    private final String sortFieldName;
    private final String fallbackFieldName;

    public SortByFieldConversion(String sortFieldName) {
        this(sortFieldName, null);
    }

    public SortByFieldConversion(String sortFieldName, String fallbackFieldName) {
        this.sortFieldName = sortFieldName;
        this.fallbackFieldName = fallbackFieldName;
    }

    @Override
    public List<Entry> convert(List<Entry> entries) {
        List<Entry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparing(this::sortKey, SortByFieldConversion::compareDescending));
        return sorted;
    }

    private Object sortKey(Entry entry) {
        Object key = entry.fetchValue(sortFieldName);
        if (Values.isFalsy(key) && fallbackFieldName != null) {
            key = entry.fetchValue(fallbackFieldName);
        }
        return Values.isFalsy(key) ? null : key;
    }

    /**
     * Numbers, then strings, then anything else, then missing values; descending within each group.
     */
    public static int compareDescending(Object a, Object b) {
        int tierA = tier(a);
        int tierB = tier(b);
        if (tierA != tierB) {
            return Integer.compare(tierA, tierB);
        }
        if (a == null) {
            return 0;
        }
        if (Values.isComparable(a, b)) {
            return Values.compare(b, a);
        }
        return String.valueOf(b).compareTo(String.valueOf(a));
    }

    private static int tier(Object value) {
        if (value == null) return 3;
        if (value instanceof Number) return 0;
        if (value instanceof String) return 1;
        return 2;
    }

    @Override
    public String getDescription() {
        return fallbackFieldName == null
                ? "Sort by " + sortFieldName
                : "Sort by " + sortFieldName + ", falling back to " + fallbackFieldName;
    }
}
