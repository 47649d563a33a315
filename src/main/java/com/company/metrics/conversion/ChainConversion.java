package com.company.metrics.conversion;

import com.company.metrics.domain.Entry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs conversions strictly in order, each consuming the previous one's output.
 * An empty chain returns its input unchanged.
 */
@Slf4j
public class ChainConversion implements Conversion {

    private final List<Conversion> conversions;

    public ChainConversion(List<Conversion> conversions) {
        this.conversions = List.copyOf(conversions);
    }

    @Override
    public List<Entry> convert(List<Entry> entries) {
        List<Entry> result = entries;
        for (Conversion conversion : conversions) {
            result = conversion.convert(result);
            log.debug("{}: {} entries", conversion.getDescription(), result.size());
        }
        return result;
    }

    @Override
    public String getDescription() {
        return "Chain: " + conversions.stream()
                .map(Conversion::getDescription)
                .collect(Collectors.joining(" -> "));
    }
}
