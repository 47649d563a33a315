package com.company.metrics.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Set;

/**
 * Value of a metadata or metrics field: either a bare scalar or an annotated value
 * carrying side channels (category, description, prune flag, aggregation statistics).
 */
public abstract class FieldValue {

    public static final String VALUE = "value";
    public static final String CATEGORY = "category";
    public static final String DESCRIPTION = "description";
    public static final String PRUNE = "prune";
    public static final String MIN_VALUE = "min_value";
    public static final String MAX_VALUE = "max_value";
    public static final String N_SAMPLES = "n_samples";

    /**
     * Side channels that describe a field rather than measure it. They never become table columns.
     */
    public static final Set<String> NON_SUBFIELDS = Set.of(VALUE, CATEGORY, PRUNE, DESCRIPTION);

    public abstract Object getValue();

    public abstract boolean isAnnotated();

    public abstract FieldValue copy();

    /**
     * Returns the annotated form: this instance when already annotated, a new wrapper otherwise.
     */
    public abstract AnnotatedFieldValue promote();

    /**
     * Returns the bare scalar when nothing but {@code value} is set, otherwise this instance.
     */
    public abstract FieldValue flatten();

    /**
     * Reads {@code value}, one of the side channels, or an extra subfield. Null when unset.
     */
    public abstract Object getSubfield(String name);

    /**
     * Plain Java form: the scalar itself, or an ordered map of the set subfields minus {@code excluded}.
     */
    public abstract Object toPlain(Set<String> excluded);

    @JsonValue
    public Object toJson() {
        return toPlain(Set.of());
    }

    public static FieldValue of(Object value) {
        if (value instanceof FieldValue) {
            return (FieldValue) value;
        }
        return new ScalarFieldValue(value);
    }

    public static AnnotatedFieldValue annotated(Object value) {
        AnnotatedFieldValue annotated = new AnnotatedFieldValue();
        annotated.setValue(value);
        return annotated;
    }
}
