package com.company.metrics.service;

import com.company.metrics.config.EngineProperties;
import com.company.metrics.conversion.AggregateConversion;
import com.company.metrics.conversion.ChainConversion;
import com.company.metrics.conversion.Conversion;
import com.company.metrics.conversion.PruneConversion;
import com.company.metrics.conversion.RoundConversion;
import com.company.metrics.conversion.SortByFieldConversion;
import com.company.metrics.domain.Condition;
import com.company.metrics.domain.Entry;
import com.company.metrics.domain.FieldValue;
import com.company.metrics.domain.SliceKey;
import com.company.metrics.domain.enums.AbsentMetricsPolicy;
import com.company.metrics.domain.enums.PruneMode;
import com.company.metrics.domain.enums.SliceRecommendationStrategy;
import com.company.metrics.dto.request.LogsListParams;
import com.company.metrics.dto.response.GroupedEntries;
import com.company.metrics.dto.response.GroupedEntriesList;
import com.company.metrics.util.ConditionParser;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups entries and summarizes every group with one aggregated entry, keeping the members.
 */
@Service
@Slf4j
@Validated
@RequiredArgsConstructor
public class LogsListService {

    private static final Set<String> HIDDEN_SUBFIELDS = Set.of(FieldValue.PRUNE, FieldValue.CATEGORY);

    private final EngineProperties properties;
    private final PipelineService pipelineService;
    private final SliceRecommendationService sliceRecommendationService;
    private final MeterRegistry meterRegistry;

    public GroupedEntriesList createLogsList(List<Entry> entries, @Valid LogsListParams params) {
        List<Condition> filters = ConditionParser.parseAll(params.getFilters());
        List<Condition> groupConditions = ConditionParser.parseAll(params.getGroups());

        List<Entry> prepared = pipelineService.createPreprocessing(filters)
                .convert(PipelineService.copyOf(entries));
        Map<SliceKey, List<Entry>> groups = AggregateConversion.group(prepared, groupConditions);

        PruneMode pruneMode = params.getPruneMode() == null ? PruneMode.NONE : params.getPruneMode();
        PruneConversion prune = new PruneConversion(pruneMode);
        List<Conversion> conversions = new ArrayList<>();
        conversions.add(new AggregateConversion(List.of(), AbsentMetricsPolicy.ALL_OR_NOTHING, meterRegistry));
        if (pruneMode != PruneMode.NONE) {
            conversions.add(prune);
        }
        conversions.add(new RoundConversion(properties.resolveRoundPrecision(params.getRoundPrecision())));
        Conversion summarize = new ChainConversion(conversions);

        List<GroupedEntries> grouped = new ArrayList<>(groups.size());
        for (List<Entry> members : groups.values()) {
            // members come from a private copy, safe to summarize in place
            Entry summary = summarize.convert(members).get(0);
            grouped.add(new GroupedEntries(summary, prune.convert(members)));
        }

        String latest = properties.getAggregatedTimestampField();
        grouped.sort((a, b) -> SortByFieldConversion.compareDescending(
                a.getAggrEntry().fetchValue(latest), b.getAggrEntry().fetchValue(latest)));

        SliceRecommendationStrategy strategy = params.getGroupRecommendationStrategy();
        List<String> recommendations = sliceRecommendationService.recommendForCategorized(prepared, groupConditions,
                strategy == null ? SliceRecommendationStrategy.NONE : strategy);

        for (GroupedEntries group : grouped) {
            tidy(group.getAggrEntry());
            group.getEntries().forEach(LogsListService::tidy);
        }

        log.info("Listed {} groups from {} entries", grouped.size(), prepared.size());
        return new GroupedEntriesList(grouped, recommendations);
    }

    private static void tidy(Entry entry) {
        entry.removeSubfields(HIDDEN_SUBFIELDS);
        entry.flattenValues();
    }
}
