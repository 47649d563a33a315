package com.company.metrics.service;

import com.company.metrics.conversion.CategorizeMetadataConversion;
import com.company.metrics.domain.AnnotatedFieldValue;
import com.company.metrics.domain.Condition;
import com.company.metrics.domain.Entry;
import com.company.metrics.domain.FieldValue;
import com.company.metrics.domain.SliceKey;
import com.company.metrics.domain.enums.FieldCategory;
import com.company.metrics.domain.enums.SliceRecommendationStrategy;
import com.company.metrics.util.Values;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Suggests metadata fields that would split the current groups further.
 */
@Service
@Slf4j
public class SliceRecommendationService {

    private static final String VERSION_MARKER = "_version";
    private static final int VERSION_PENALTY = 20;

    /**
     * Recommends slice fields for {@code entries}, expected most recent first.
     */
    public List<String> recommendSlices(List<Entry> entries, List<Condition> currentSlices,
                                        SliceRecommendationStrategy strategy) {
        if (strategy == SliceRecommendationStrategy.NONE) {
            return new ArrayList<>();
        }
        List<Entry> categorized = new CategorizeMetadataConversion().convert(PipelineService.copyOf(entries));
        return recommendForCategorized(categorized, currentSlices, strategy);
    }

    /**
     * Same as {@link #recommendSlices} for entries whose metadata is already categorized.
     */
    List<String> recommendForCategorized(List<Entry> entries, List<Condition> currentSlices,
                                         SliceRecommendationStrategy strategy) {
        if (strategy == SliceRecommendationStrategy.NONE) {
            return new ArrayList<>();
        }
        List<String> candidates = determinePossibleNewSlices(entries, currentSlices);
        List<String> recommendations = dedupeSlices(candidates, entries, strategy);
        log.debug("Slice candidates {}, recommended {}", candidates, recommendations);
        return recommendations;
    }

    /**
     * {@code group} metadata fields not used by the current slices that take two different values
     * within one current group. Sorted alphabetically.
     */
    static List<String> determinePossibleNewSlices(List<Entry> entries, List<Condition> currentSlices) {
        Set<String> sliced = new HashSet<>();
        for (Condition slice : currentSlices) {
            // any operator counts
            sliced.add(slice.getFieldName());
        }

        Set<String> accepted = new LinkedHashSet<>();
        Map<String, Map<SliceKey, Object>> firstValues = new HashMap<>();

        for (Entry entry : entries) {
            SliceKey key = SliceKey.of(entry, currentSlices);
            for (Map.Entry<String, FieldValue> field : entry.getMetadata().entrySet()) {
                String fieldName = field.getKey();
                if (Entry.FILES_FIELD.equals(fieldName) || accepted.contains(fieldName) || sliced.contains(fieldName)) {
                    continue;
                }
                if (!(field.getValue() instanceof AnnotatedFieldValue annotated)
                        || annotated.getCategory() != FieldCategory.GROUP) {
                    continue;
                }
                if (currentSlices.isEmpty()) {
                    accepted.add(fieldName);
                    continue;
                }
                Map<SliceKey, Object> seen = firstValues.computeIfAbsent(fieldName, f -> new HashMap<>());
                if (!seen.containsKey(key)) {
                    seen.put(key, annotated.getValue());
                } else if (!Values.valueEquals(seen.get(key), annotated.getValue())) {
                    accepted.add(fieldName);
                }
            }
        }

        List<String> sorted = new ArrayList<>(accepted);
        sorted.sort(Comparator.naturalOrder());
        return sorted;
    }

    /**
     * Keeps the first candidate, then each candidate that still discriminates between entries sharing
     * the values of every candidate kept so far. {@code CONCISE} first orders candidates by
     * name length plus first seen value length, with a penalty for version fields.
     */
    static List<String> dedupeSlices(List<String> candidates, List<Entry> entries,
                                     SliceRecommendationStrategy strategy) {
        if (candidates.isEmpty() || strategy == SliceRecommendationStrategy.NONE) {
            return new ArrayList<>();
        }
        List<String> ordered = new ArrayList<>(candidates);
        if (strategy == SliceRecommendationStrategy.CONCISE) {
            Map<String, Integer> sortKeys = new HashMap<>();
            for (String candidate : ordered) {
                sortKeys.put(candidate, conciseSortKey(candidate, entries));
            }
            // stable, so ties stay alphabetical
            ordered.sort(Comparator.comparing(sortKeys::get));
        }

        List<String> kept = new ArrayList<>();
        List<Condition> keptSlices = new ArrayList<>();
        kept.add(ordered.get(0));
        keptSlices.add(Condition.slice(ordered.get(0)));

        for (String candidate : ordered.subList(1, ordered.size())) {
            Map<SliceKey, Object> seen = new HashMap<>();
            for (Entry entry : entries) {
                SliceKey key = SliceKey.of(entry, keptSlices);
                Object value = entry.fetchValue(candidate);
                if (!seen.containsKey(key)) {
                    seen.put(key, value);
                } else if (!Values.valueEquals(seen.get(key), value)) {
                    kept.add(candidate);
                    keptSlices.add(Condition.slice(candidate));
                    break;
                }
            }
        }
        return kept;
    }

    private static int conciseSortKey(String candidate, List<Entry> entries) {
        int valueLength = 0;
        for (Entry entry : entries) {
            Object value = entry.fetchValue(candidate);
            if (value != null) {
                valueLength = Values.toDisplayString(value).length();
                break;
            }
        }
        int penalty = candidate.contains(VERSION_MARKER) ? VERSION_PENALTY : 0;
        return candidate.length() + valueLength + penalty;
    }
}
