package com.company.metrics.conversion;

import com.company.metrics.domain.Condition;
import com.company.metrics.domain.Entry;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the entries that satisfy every condition.
 */
public class FilterConversion implements Conversion {

    private final List<Condition> conditions;

    public FilterConversion(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    @Override
    public List<Entry> convert(List<Entry> entries) {
        List<Entry> filtered = new ArrayList<>();
        for (Entry entry : entries) {
            if (matches(entry, conditions)) {
                filtered.add(entry);
            }
        }
        return filtered;
    }

    public static boolean matches(Entry entry, List<Condition> conditions) {
        for (Condition condition : conditions) {
            if (!condition.check(entry.fetchValue(condition.getFieldName()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String getDescription() {
        return "Filter " + conditions;
    }
}
