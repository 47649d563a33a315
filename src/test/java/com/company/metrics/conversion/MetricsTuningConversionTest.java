package com.company.metrics.conversion;

import com.company.metrics.domain.AnnotatedFieldValue;
import com.company.metrics.domain.Entry;
import com.company.metrics.domain.FieldValue;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsTuningConversionTest {

    @Test
    void millisecondMetricsBecomeSeconds() {
        AnnotatedFieldValue latency = FieldValue.annotated(1500);
        latency.setDescription("Latency in ms");
        latency.setMaxValue(3000.0);
        Entry entry = new Entry("e")
                .putMetric("api/latency_ms", latency)
                .putMetric("total_ms", 250)
                .putMetric("msgs_count", 3);

        new MsToSecondsConversion().convert(List.of(entry));

        assertThat(entry.getMetrics()).containsOnlyKeys("api/latency_s", "total_s", "msgs_count");
        AnnotatedFieldValue seconds = (AnnotatedFieldValue) entry.getMetrics().get("api/latency_s");
        assertThat(seconds.getValue()).isEqualTo(1.5);
        assertThat(seconds.getMaxValue()).isEqualTo(3.0);
        assertThat(seconds.getDescription()).isEqualTo("Latency in s");
        assertThat(entry.getMetrics().get("total_s").isAnnotated()).isFalse();
        assertThat(entry.getMetrics().get("total_s").getValue()).isEqualTo(0.25);
    }

    @Test
    void renameOnlyTouchesTheLastSegment() {
        assertThat(MsToSecondsConversion.renameKey("ms/latency_ms")).isEqualTo("ms/latency_s");
        assertThat(MsToSecondsConversion.renameKey("ms_total")).isEqualTo("s_total");
        assertThat(MsToSecondsConversion.renameKey("items")).isEqualTo("items");
    }

    @Test
    void roundingKeepsIntegers() {
        AnnotatedFieldValue score = FieldValue.annotated(0.123456);
        score.setMinValue(0.1111);
        Entry entry = new Entry("e").putMetric("score", score).putMetric("count", 7).putMetric("ratio", 2.0 / 3);

        new RoundConversion(2).convert(List.of(entry));

        assertThat(score.getValue()).isEqualTo(0.12);
        assertThat(score.getMinValue()).isEqualTo(0.11);
        assertThat(entry.getMetrics().get("count").getValue()).isEqualTo(7);
        assertThat(entry.getMetrics().get("ratio").getValue()).isEqualTo(0.67);
    }

    @Test
    void chainRunsInOrderAndEmptyChainIsIdentity() {
        List<String> calls = new ArrayList<>();
        Conversion first = entries -> {
            calls.add("first");
            return entries;
        };
        Conversion second = entries -> {
            calls.add("second");
            return entries.subList(0, 1);
        };
        List<Entry> entries = List.of(new Entry("a"), new Entry("b"));

        assertThat(new ChainConversion(List.of(first, second)).convert(entries)).hasSize(1);
        assertThat(calls).containsExactly("first", "second");
        assertThat(new ChainConversion(List.of()).convert(entries)).isSameAs(entries);
    }
}
