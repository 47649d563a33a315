package com.company.metrics.util;

import com.company.metrics.domain.AnnotatedFieldValue;
import com.company.metrics.domain.Entry;
import com.company.metrics.domain.enums.FieldCategory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntryMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EntryMapper mapper = new EntryMapper(objectMapper);

    @Test
    void readsScalarAndAnnotatedFields() throws Exception {
        JsonNode node = objectMapper.readTree("""
                {
                  "name": "run-1",
                  "metadata": {
                    "agent": "a",
                    "time_end_utc": {"value": "2025-01-01T00:00:00", "category": "timestamp"}
                  },
                  "metrics": {
                    "latency_ms": {"value": 12.5, "min_value": 10, "max_value": 15, "n_samples": 2, "prune": true},
                    "errors": 3
                  }
                }
                """);

        Entry entry = mapper.fromJson(node);

        assertThat(entry.getName()).isEqualTo("run-1");
        assertThat(entry.fetchValue("agent")).isEqualTo("a");
        assertThat(entry.getMetadata().get("time_end_utc")).isInstanceOfSatisfying(AnnotatedFieldValue.class,
                field -> assertThat(field.getCategory()).isEqualTo(FieldCategory.TIMESTAMP));
        assertThat(entry.getMetrics().get("latency_ms")).isInstanceOfSatisfying(AnnotatedFieldValue.class, field -> {
            assertThat(field.getValue()).isEqualTo(12.5);
            assertThat(field.getMaxValue()).isEqualTo(15);
            assertThat(field.getNSamples()).isEqualTo(2);
            assertThat(field.isPruned()).isTrue();
        });
        assertThat(entry.fetchValue("errors")).isEqualTo(3);
    }

    @Test
    void unknownSubfieldsAreKept() throws Exception {
        Entry entry = mapper.fromJson("named", objectMapper.readTree("""
                {"metrics": {"score": {"value": 0.5, "source": "judge"}}}
                """));

        assertThat(entry.getName()).isEqualTo("named");
        assertThat(entry.fetchValue("score/source")).isEqualTo("judge");
        assertThat(entry.getMetadata()).isEmpty();
    }

    @Test
    void writesFieldsInTheirReadForm() throws Exception {
        Entry entry = new Entry("run-1")
                .putMetadata("agent", "a")
                .putMetric("errors", 3);
        AnnotatedFieldValue latency = new AnnotatedFieldValue();
        latency.setValue(12.5);
        latency.setMinValue(10.0);
        entry.getMetrics().put("latency", latency);

        ObjectNode json = mapper.toJson(entry);

        assertThat(json.get("name").asText()).isEqualTo("run-1");
        assertThat(json.at("/metadata/agent").asText()).isEqualTo("a");
        assertThat(json.at("/metrics/errors").asInt()).isEqualTo(3);
        assertThat(json.at("/metrics/latency/value").asDouble()).isEqualTo(12.5);
        assertThat(json.at("/metrics/latency/min_value").asDouble()).isEqualTo(10.0);
        assertThat(json.at("/metrics/latency").has("max_value")).isFalse();
    }

    @Test
    void arraysSkipNonObjects() throws Exception {
        List<Entry> entries = mapper.fromJsonArray(objectMapper.readTree("""
                [{"name": "a", "metrics": {"x": 1}}, 42, {"name": "b"}]
                """));

        assertThat(entries).extracting(Entry::getName).containsExactly("a", "b");
    }

    @Test
    void rejectsNonObjectEntries() throws Exception {
        JsonNode node = objectMapper.readTree("[1, 2]");

        assertThatThrownBy(() -> mapper.fromJson(node))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("JSON object");
    }
}
