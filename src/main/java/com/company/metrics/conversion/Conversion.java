package com.company.metrics.conversion;

import com.company.metrics.domain.Entry;

import java.util.List;

/**
 * One step of an entry pipeline: consumes an ordered list of entries and returns one.
 * Implementations may modify the entries they are given; callers that need the input
 * untouched pass copies.
 */
public interface Conversion {

    List<Entry> convert(List<Entry> entries);

    default String getDescription() {
        return getClass().getSimpleName();
    }
}
