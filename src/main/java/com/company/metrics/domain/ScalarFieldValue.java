package com.company.metrics.domain;

import com.company.metrics.util.Values;

import java.util.Set;

public final class ScalarFieldValue extends FieldValue {

    private final Object value;

    public ScalarFieldValue(Object value) {
        this.value = value;
    }

    @Override
    public Object getValue() {
        return value;
    }

    @Override
    public boolean isAnnotated() {
        return false;
    }

    @Override
    public FieldValue copy() {
        // Scalars are immutable
        return this;
    }

    @Override
    public AnnotatedFieldValue promote() {
        return FieldValue.annotated(value);
    }

    @Override
    public FieldValue flatten() {
        return this;
    }

    @Override
    public Object getSubfield(String name) {
        return VALUE.equals(name) ? value : null;
    }

    @Override
    public Object toPlain(Set<String> excluded) {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalarFieldValue)) return false;
        return Values.valueEquals(value, ((ScalarFieldValue) o).value);
    }

    @Override
    public int hashCode() {
        return Values.valueHash(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
