package com.company.metrics.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One measurement record: descriptive metadata plus measured metrics.
 * Both maps share the same shape and are kept apart only by convention.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Entry {

    /**
     * Metadata field listing the files attached to an entry. Never categorized, aggregated or tabulated.
     */
    public static final String FILES_FIELD = "files";

    private String name;

    @Builder.Default
    private Map<String, FieldValue> metadata = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, FieldValue> metrics = new LinkedHashMap<>();

    public Entry(String name) {
        this(name, new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    /**
     * Fetches {@code fieldName} from metadata, then from metrics.
     * A bare name yields the field's value; {@code name/subfield} yields that subfield.
     */
    public Object fetchValue(String fieldName) {
        Object value = fetchValue(metadata, fieldName);
        if (value == null) {
            value = fetchValue(metrics, fieldName);
        }
        return value;
    }

    public Entry putMetadata(String fieldName, Object value) {
        metadata.put(fieldName, FieldValue.of(value));
        return this;
    }

    public Entry putMetric(String fieldName, Object value) {
        metrics.put(fieldName, FieldValue.of(value));
        return this;
    }

    /**
     * Deep copy: annotated values are copied, scalars are shared.
     */
    public Entry copy() {
        return new Entry(name, copyFields(metadata), copyFields(metrics));
    }

    public void flattenValues() {
        metadata.replaceAll((k, v) -> v.flatten());
        metrics.replaceAll((k, v) -> v.flatten());
    }

    public void removeSubfields(Set<String> subfields) {
        removeSubfields(metadata, subfields);
        removeSubfields(metrics, subfields);
    }

    public static Object fetchValue(Map<String, FieldValue> fields, String fieldName) {
        FieldValue field = fields.get(fieldName);
        if (field != null) {
            return field.getValue();
        }
        int slash = fieldName.lastIndexOf('/');
        if (slash < 0) {
            return null;
        }
        FieldValue parent = fields.get(fieldName.substring(0, slash));
        if (parent == null || !parent.isAnnotated()) {
            return null;
        }
        return parent.getSubfield(fieldName.substring(slash + 1));
    }

    private static Map<String, FieldValue> copyFields(Map<String, FieldValue> fields) {
        Map<String, FieldValue> copy = new LinkedHashMap<>();
        fields.forEach((k, v) -> copy.put(k, v == null ? null : v.copy()));
        return copy;
    }

    private static void removeSubfields(Map<String, FieldValue> fields, Set<String> subfields) {
        for (FieldValue field : fields.values()) {
            if (field instanceof AnnotatedFieldValue annotated) {
                for (String subfield : subfields) {
                    annotated.setSubfield(subfield, null);
                    annotated.getExtras().remove(subfield);
                }
            }
        }
    }
}
