package com.company.metrics.util;

import com.company.metrics.domain.AnnotatedFieldValue;
import com.company.metrics.domain.Entry;
import com.company.metrics.domain.FieldValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts entries from and to their JSON form:
 * <pre>
 * {"metadata": {"agent": "a", "time_end_utc": {"value": "...", "category": "timestamp"}},
 *  "metrics":  {"latency_ms": {"value": 12.5, "min_value": 10, "max_value": 15, "n_samples": 2}}}
 * </pre>
 * A field is either a bare scalar or an object whose keys are subfields.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EntryMapper {

    private static final String NAME = "name";
    private static final String METADATA = "metadata";
    private static final String METRICS = "metrics";

    private final ObjectMapper objectMapper;

    public Entry fromJson(JsonNode node) {
        String name = node.hasNonNull(NAME) ? node.get(NAME).asText() : null;
        return fromJson(name, node);
    }

    public Entry fromJson(String name, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Entry must be a JSON object, got " + (node == null ? "null" : node.getNodeType()));
        }
        Entry entry = new Entry(name);
        readFields(node.get(METADATA), entry.getMetadata());
        readFields(node.get(METRICS), entry.getMetrics());
        return entry;
    }

    /**
     * Reads a JSON array of entries. Items that are not objects are skipped with a warning.
     */
    public List<Entry> fromJsonArray(JsonNode array) {
        List<Entry> entries = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return entries;
        }
        for (JsonNode item : array) {
            if (!item.isObject()) {
                log.warn("Skipping non-object entry of type {}", item.getNodeType());
                continue;
            }
            entries.add(fromJson(item));
        }
        return entries;
    }

    public ObjectNode toJson(Entry entry) {
        ObjectNode node = objectMapper.createObjectNode();
        if (entry.getName() != null) {
            node.put(NAME, entry.getName());
        }
        node.set(METADATA, objectMapper.valueToTree(entry.getMetadata()));
        node.set(METRICS, objectMapper.valueToTree(entry.getMetrics()));
        return node;
    }

    private void readFields(JsonNode fields, Map<String, FieldValue> target) {
        if (fields == null || fields.isNull()) {
            return;
        }
        if (!fields.isObject()) {
            log.warn("Ignoring field map of type {}", fields.getNodeType());
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            target.put(field.getKey(), readField(field.getValue()));
        }
    }

    private FieldValue readField(JsonNode node) {
        if (!node.isObject()) {
            return FieldValue.of(toJava(node));
        }
        AnnotatedFieldValue annotated = new AnnotatedFieldValue();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> subfield = it.next();
            annotated.setSubfield(subfield.getKey(), toJava(subfield.getValue()));
        }
        return annotated;
    }

    private Object toJava(JsonNode node) {
        return node == null || node.isNull() ? null : objectMapper.convertValue(node, Object.class);
    }
}
