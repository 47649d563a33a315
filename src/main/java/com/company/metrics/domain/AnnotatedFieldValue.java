package com.company.metrics.domain;

import com.company.metrics.domain.enums.FieldCategory;
import com.company.metrics.util.Values;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

@Getter
@Setter
@ToString
public final class AnnotatedFieldValue extends FieldValue {

    private Object value;
    private FieldCategory category;
    private String description;
    private Boolean prune;

    // Set by aggregation
    private Object minValue;
    private Object maxValue;
    private Integer nSamples;

    // Any other subfields found in the source record, kept in source order
    private Map<String, Object> extras = new LinkedHashMap<>();

    @Override
    public boolean isAnnotated() {
        return true;
    }

    @Override
    public AnnotatedFieldValue copy() {
        AnnotatedFieldValue copy = new AnnotatedFieldValue();
        copy.value = value;
        copy.category = category;
        copy.description = description;
        copy.prune = prune;
        copy.minValue = minValue;
        copy.maxValue = maxValue;
        copy.nSamples = nSamples;
        copy.extras = new LinkedHashMap<>(extras);
        return copy;
    }

    @Override
    public AnnotatedFieldValue promote() {
        return this;
    }

    @Override
    public FieldValue flatten() {
        boolean onlyValue = category == null && description == null && prune == null
                && minValue == null && maxValue == null && nSamples == null && extras.isEmpty();
        return onlyValue ? new ScalarFieldValue(value) : this;
    }

    public boolean isPruned() {
        return Boolean.TRUE.equals(prune);
    }

    public void setSubfield(String name, Object subfieldValue) {
        if (VALUE.equals(name)) {
            value = subfieldValue;
        } else if (CATEGORY.equals(name)) {
            category = subfieldValue instanceof FieldCategory fieldCategory
                    ? fieldCategory
                    : FieldCategory.fromString(subfieldValue == null ? null : subfieldValue.toString());
        } else if (DESCRIPTION.equals(name)) {
            description = subfieldValue == null ? null : subfieldValue.toString();
        } else if (PRUNE.equals(name)) {
            prune = subfieldValue == null ? null : Boolean.valueOf(subfieldValue.toString());
        } else if (MIN_VALUE.equals(name)) {
            minValue = subfieldValue;
        } else if (MAX_VALUE.equals(name)) {
            maxValue = subfieldValue;
        } else if (N_SAMPLES.equals(name)) {
            nSamples = subfieldValue instanceof Number number ? number.intValue() : null;
        } else {
            extras.put(name, subfieldValue);
        }
    }

    @Override
    public Object getSubfield(String name) {
        if (VALUE.equals(name)) return value;
        if (CATEGORY.equals(name)) return category == null ? null : category.getCode();
        if (DESCRIPTION.equals(name)) return description;
        if (PRUNE.equals(name)) return prune;
        if (MIN_VALUE.equals(name)) return minValue;
        if (MAX_VALUE.equals(name)) return maxValue;
        if (N_SAMPLES.equals(name)) return nSamples;
        return extras.get(name);
    }

    /**
     * Names of the subfields that are set, in canonical order followed by extras.
     */
    public Set<String> getSubfieldNames() {
        return toMap(Set.of()).keySet();
    }

    @Override
    public Object toPlain(Set<String> excluded) {
        return toMap(excluded);
    }

    public Map<String, Object> toMap(Set<String> excluded) {
        Map<String, Object> map = new LinkedHashMap<>();
        // value is always present, even when null
        putIfAllowed(map, excluded, VALUE, value, true);
        putIfAllowed(map, excluded, CATEGORY, category == null ? null : category.getCode(), false);
        putIfAllowed(map, excluded, DESCRIPTION, description, false);
        putIfAllowed(map, excluded, PRUNE, prune, false);
        putIfAllowed(map, excluded, MIN_VALUE, minValue, false);
        putIfAllowed(map, excluded, MAX_VALUE, maxValue, false);
        putIfAllowed(map, excluded, N_SAMPLES, nSamples, false);
        extras.forEach((k, v) -> putIfAllowed(map, excluded, k, v, true));
        return map;
    }

    private static void putIfAllowed(Map<String, Object> map, Set<String> excluded,
                                     String key, Object v, boolean keepNull) {
        if (excluded.contains(key)) return;
        if (v == null && !keepNull) return;
        map.put(key, v);
    }

    /**
     * Numeric value, min and max compare by value, so 5 and 5.0 are equal.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnnotatedFieldValue other)) return false;
        return Values.valueEquals(value, other.value)
                && category == other.category
                && Objects.equals(description, other.description)
                && Objects.equals(prune, other.prune)
                && Values.valueEquals(minValue, other.minValue)
                && Values.valueEquals(maxValue, other.maxValue)
                && Objects.equals(nSamples, other.nSamples)
                && Objects.equals(extras, other.extras);
    }

    @Override
    public int hashCode() {
        int hash = Values.valueHash(value);
        hash = 31 * hash + Objects.hash(category, description, prune, nSamples, extras);
        hash = 31 * hash + Values.valueHash(minValue);
        return 31 * hash + Values.valueHash(maxValue);
    }
}
