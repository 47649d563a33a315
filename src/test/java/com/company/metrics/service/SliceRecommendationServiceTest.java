package com.company.metrics.service;

import com.company.metrics.domain.Condition;
import com.company.metrics.domain.Entry;
import com.company.metrics.domain.enums.SliceRecommendationStrategy;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SliceRecommendationServiceTest {

    private final SliceRecommendationService service = new SliceRecommendationService();

    @Test
    void recommendsFieldsThatSplitTheCurrentGroups() {
        List<Entry> entries = List.of(
                entry("r1", "agent", "a", "model", "m1", "dataset", "d1"),
                entry("r2", "agent", "a", "model", "m2", "dataset", "d1"),
                entry("r3", "agent", "b", "model", "m1", "dataset", "d1"),
                entry("r4", "agent", "b", "model", "m2", "dataset", "d2"));

        List<String> recommendations = service.recommendSlices(entries, List.of(Condition.slice("agent")),
                SliceRecommendationStrategy.FIRST_ALPHABETICAL);

        assertThat(recommendations).containsExactly("dataset", "model");
    }

    @Test
    void fieldsConstantWithinEveryGroupAreNotCandidates() {
        List<Entry> entries = List.of(
                entry("r1", "agent", "a", "team", "t1"),
                entry("r2", "agent", "a", "team", "t1"),
                entry("r3", "agent", "b", "team", "t2"));

        assertThat(service.recommendSlices(entries, List.of(Condition.slice("agent")),
                SliceRecommendationStrategy.CONCISE)).isEmpty();
    }

    @Test
    void fieldsUsedByAnyConditionAreExcluded() {
        List<Entry> entries = List.of(
                entry("r1", "agent", "a", "model", "m1"),
                entry("r2", "agent", "a", "model", "m2"),
                entry("r3", "agent", "a", "model", "m1"));

        List<String> recommendations = service.recommendSlices(entries,
                List.of(Condition.in("model", List.of("m1"))), SliceRecommendationStrategy.FIRST_ALPHABETICAL);

        assertThat(recommendations).isEmpty();
    }

    @Test
    void uniqueAndSameFieldsAreNeverRecommended() {
        List<Entry> entries = List.of(
                entry("r1", "env", "prod", "model", "m1"),
                entry("r2", "env", "prod", "model", "m1"),
                entry("r3", "env", "prod", "model", "m2"));

        assertThat(service.recommendSlices(entries, List.of(), SliceRecommendationStrategy.FIRST_ALPHABETICAL))
                .containsExactly("model");
    }

    @Test
    void redundantCandidatesAreDropped() {
        List<Entry> entries = versionedBuilds();

        assertThat(service.recommendSlices(entries, List.of(), SliceRecommendationStrategy.FIRST_ALPHABETICAL))
                .containsExactly("agent_version");
    }

    @Test
    void conciseStrategyPrefersShortNonVersionFields() {
        List<Entry> entries = versionedBuilds();

        assertThat(service.recommendSlices(entries, List.of(), SliceRecommendationStrategy.CONCISE))
                .containsExactly("build");
    }

    @Test
    void independentCandidatesAreAllKept() {
        List<Entry> entries = List.of(
                entry("r1", "agent", "a", "model", "m1"),
                entry("r2", "agent", "a", "model", "m2"),
                entry("r3", "agent", "b", "model", "m1"),
                entry("r4", "agent", "b", "model", "m2"));

        assertThat(service.recommendSlices(entries, List.of(), SliceRecommendationStrategy.CONCISE))
                .containsExactlyInAnyOrder("agent", "model");
    }

    @Test
    void noneStrategyRecommendsNothing() {
        assertThat(service.recommendSlices(versionedBuilds(), List.of(), SliceRecommendationStrategy.NONE)).isEmpty();
    }

    @Test
    void callerEntriesStayUncategorized() {
        List<Entry> entries = versionedBuilds();

        service.recommendSlices(entries, List.of(), SliceRecommendationStrategy.CONCISE);

        assertThat(entries.get(0).getMetadata().get("build").isAnnotated()).isFalse();
    }

    private static List<Entry> versionedBuilds() {
        return List.of(
                entry("r1", "build", "b1", "agent_version", "1.0.0"),
                entry("r2", "build", "b1", "agent_version", "1.0.0"),
                entry("r3", "build", "b2", "agent_version", "2.0.0"),
                entry("r4", "build", "b2", "agent_version", "2.0.0"));
    }

    private static Entry entry(String runId, String... metadata) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < metadata.length; i += 2) {
            fields.put(metadata[i], metadata[i + 1]);
        }
        Entry entry = new Entry(runId);
        fields.forEach(entry::putMetadata);
        return entry.putMetric("score", 1.0);
    }
}
