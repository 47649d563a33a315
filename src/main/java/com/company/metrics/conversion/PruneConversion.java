package com.company.metrics.conversion;

import com.company.metrics.domain.AnnotatedFieldValue;
import com.company.metrics.domain.Entry;
import com.company.metrics.domain.FieldValue;
import com.company.metrics.domain.enums.PruneMode;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes metrics flagged with {@code prune}.
 * {@link PruneMode#INDIVIDUAL} decides per entry; {@link PruneMode#COLUMN} removes a metric
 * from the whole batch only when every entry that carries it has it flagged.
 */
@Slf4j
public class PruneConversion implements Conversion {

    private final PruneMode mode;

    public PruneConversion(PruneMode mode) {
        this.mode = mode;
    }

    @Override
    public List<Entry> convert(List<Entry> entries) {
        if (mode == PruneMode.INDIVIDUAL) {
            for (Entry entry : entries) {
                entry.getMetrics().entrySet().removeIf(metric -> {
                    boolean pruned = isPruned(metric.getValue());
                    if (pruned) {
                        log.debug("Pruning {} from entry {}", metric.getKey(), entry.getName());
                    }
                    return pruned;
                });
            }
        } else if (mode == PruneMode.COLUMN) {
            Set<String> prunedColumns = new LinkedHashSet<>();
            Set<String> keptColumns = new HashSet<>();
            for (Entry entry : entries) {
                entry.getMetrics().forEach((key, metric) -> {
                    if (isPruned(metric)) {
                        prunedColumns.add(key);
                    } else {
                        keptColumns.add(key);
                    }
                });
            }
            prunedColumns.removeAll(keptColumns);
            if (!prunedColumns.isEmpty()) {
                log.debug("Pruning columns {}", prunedColumns);
            }
            for (Entry entry : entries) {
                entry.getMetrics().keySet().removeAll(prunedColumns);
            }
        }
        return entries;
    }

    private static boolean isPruned(FieldValue metric) {
        return metric instanceof AnnotatedFieldValue annotated && annotated.isPruned();
    }

    @Override
    public String getDescription() {
        return "Prune (" + mode.getCode() + ")";
    }
}
