package com.company.metrics.conversion;

import com.company.metrics.domain.AnnotatedFieldValue;
import com.company.metrics.domain.Entry;
import com.company.metrics.domain.FieldValue;
import com.company.metrics.domain.enums.PruneMode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PruningConversionTest {

    private final DeterminePruningConversion determinePruning = new DeterminePruningConversion();

    @Test
    void successEqualToAllIsMarked() {
        Entry entry = new Entry("e").putMetric("success_all", 10).putMetric("success_success", 10);

        determinePruning.convert(List.of(entry));

        assertThat(isMarked(entry, "success_success")).isTrue();
        assertThat(isMarked(entry, "success_all")).isFalse();
    }

    @Test
    void successComparedWithBareBaseName() {
        Entry same = new Entry("a").putMetric("calls", 4).putMetric("calls_success", 4);
        Entry differs = new Entry("b").putMetric("calls", 4).putMetric("calls_success", 3);

        determinePruning.convert(List.of(same, differs));

        assertThat(isMarked(same, "calls_success")).isTrue();
        assertThat(isMarked(differs, "calls_success")).isFalse();
    }

    @Test
    void valuesBelowThresholdAreMarked() {
        Entry entry = new Entry("e").putMetric("tiny", 0.01).putMetric("zero", 0).putMetric("fine", 0.02)
                .putMetric("text", "abc");

        determinePruning.convert(List.of(entry));

        assertThat(isMarked(entry, "tiny")).isTrue();
        assertThat(isMarked(entry, "zero")).isTrue();
        assertThat(isMarked(entry, "fine")).isFalse();
        assertThat(isMarked(entry, "text")).isFalse();
    }

    @Test
    void minAndMaxCloseToAverageAreMarked() {
        Entry entry = new Entry("e")
                .putMetric("latency_avg", 100.0)
                .putMetric("latency_min", 80.0)
                .putMetric("latency_max", 200.0);

        determinePruning.convert(List.of(entry));

        assertThat(isMarked(entry, "latency_min")).isTrue();
        assertThat(isMarked(entry, "latency_max")).isFalse();
        assertThat(isMarked(entry, "latency_avg")).isFalse();
    }

    @Test
    void thresholdsAreConfigurable() {
        Entry entry = new Entry("e").putMetric("small", 0.5);

        new DeterminePruningConversion(1.0, 0.0).convert(List.of(entry));

        assertThat(isMarked(entry, "small")).isTrue();
    }

    @Test
    void individualModeDropsFlagsPerEntry() {
        List<Entry> entries = flaggedBatch(true, false);

        new PruneConversion(PruneMode.INDIVIDUAL).convert(entries);

        assertThat(entries.get(0).getMetrics()).containsOnlyKeys("success_all");
        assertThat(entries.get(1).getMetrics()).containsOnlyKeys("success_all", "success_success");
    }

    @Test
    void columnModeDropsOnlyWhenFlaggedEverywhere() {
        List<Entry> mixed = flaggedBatch(true, false);
        new PruneConversion(PruneMode.COLUMN).convert(mixed);
        assertThat(mixed.get(0).getMetrics()).containsKey("success_success");

        List<Entry> everywhere = flaggedBatch(true, true);
        new PruneConversion(PruneMode.COLUMN).convert(everywhere);
        assertThat(everywhere).allSatisfy(entry -> assertThat(entry.getMetrics()).containsOnlyKeys("success_all"));
    }

    @Test
    void columnModeIgnoresEntriesWithoutTheMetric() {
        AnnotatedFieldValue flagged = FieldValue.annotated(1.0);
        flagged.setPrune(true);
        List<Entry> entries = List.of(new Entry("a").putMetric("x", flagged), new Entry("b").putMetric("y", 1.0));

        new PruneConversion(PruneMode.COLUMN).convert(entries);

        assertThat(entries.get(0).getMetrics()).isEmpty();
        assertThat(entries.get(1).getMetrics()).containsOnlyKeys("y");
    }

    @Test
    void noneModeKeepsEverything() {
        List<Entry> entries = flaggedBatch(true, true);

        new PruneConversion(PruneMode.NONE).convert(entries);

        assertThat(entries.get(0).getMetrics()).hasSize(2);
    }

    private List<Entry> flaggedBatch(boolean firstEqual, boolean secondEqual) {
        List<Entry> entries = List.of(
                new Entry("a").putMetric("success_all", 10).putMetric("success_success", firstEqual ? 10 : 7),
                new Entry("b").putMetric("success_all", 10).putMetric("success_success", secondEqual ? 10 : 7));
        return determinePruning.convert(entries);
    }

    private static boolean isMarked(Entry entry, String metric) {
        return entry.getMetrics().get(metric) instanceof AnnotatedFieldValue annotated && annotated.isPruned();
    }
}
