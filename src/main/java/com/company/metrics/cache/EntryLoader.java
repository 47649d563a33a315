package com.company.metrics.cache;

import com.company.metrics.domain.Entry;

import java.util.List;

/**
 * Loads the full record set behind an opaque source id (a directory, a bucket prefix, a table name).
 */
@FunctionalInterface
public interface EntryLoader {

    List<Entry> load(String sourceId);
}
