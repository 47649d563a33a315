package com.company.metrics.domain;

import com.company.metrics.util.Values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Grouping key of an entry: per slice condition, the fetched field value
 * ({@code slice}) or the boolean check result (any other operator).
 * Numeric parts compare by value, so 5 and 5.0 fall into one group.
 */
public final class SliceKey {

    private final List<Object> parts;

    private SliceKey(List<Object> parts) {
        this.parts = Collections.unmodifiableList(parts);
    }

    public static SliceKey of(Entry entry, List<Condition> slices) {
        List<Object> parts = new ArrayList<>(slices.size());
        for (Condition slice : slices) {
            Object value = entry.fetchValue(slice.getFieldName());
            parts.add(slice.isSlice() ? value : slice.check(value));
        }
        return new SliceKey(parts);
    }

    public Object get(int index) {
        return parts.get(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SliceKey other)) return false;
        if (parts.size() != other.parts.size()) return false;
        for (int i = 0; i < parts.size(); i++) {
            if (!Values.valueEquals(parts.get(i), other.parts.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (Object part : parts) {
            hash = 31 * hash + Values.valueHash(part);
        }
        return hash;
    }

    @Override
    public String toString() {
        return parts.toString();
    }
}
