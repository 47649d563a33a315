package com.company.metrics.conversion;

import com.company.metrics.domain.AnnotatedFieldValue;
import com.company.metrics.domain.Entry;
import com.company.metrics.domain.FieldValue;
import com.company.metrics.domain.enums.FieldCategory;
import com.company.metrics.util.TimeUtils;
import com.company.metrics.util.Values;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Assigns a {@link FieldCategory} to every metadata field from its value distribution
 * across all entries, and writes it back onto each entry (bare scalars are promoted).
 */
@Slf4j
public class CategorizeMetadataConversion implements Conversion {

    @Override
    public List<Entry> convert(List<Entry> entries) {
        if (entries.isEmpty()) {
            return entries;
        }

        Set<String> fieldNames = new LinkedHashSet<>();
        for (Entry entry : entries) {
            for (String fieldName : entry.getMetadata().keySet()) {
                if (!Entry.FILES_FIELD.equals(fieldName)) {
                    fieldNames.add(fieldName);
                }
            }
        }

        Map<String, FieldCategory> categories = new LinkedHashMap<>();
        for (String fieldName : fieldNames) {
            List<Object> values = new ArrayList<>(entries.size());
            for (Entry entry : entries) {
                // absent fields contribute null
                values.add(Entry.fetchValue(entry.getMetadata(), fieldName));
            }
            categories.put(fieldName, categorize(values));
        }
        log.debug("Metadata categories: {}", categories);

        for (Entry entry : entries) {
            Map<String, FieldValue> metadata = entry.getMetadata();
            for (Map.Entry<String, FieldCategory> category : categories.entrySet()) {
                FieldValue field = metadata.get(category.getKey());
                if (field == null) {
                    continue;
                }
                AnnotatedFieldValue annotated = field.promote();
                annotated.setCategory(category.getValue());
                metadata.put(category.getKey(), annotated);
            }
        }
        return entries;
    }

    static FieldCategory categorize(List<Object> values) {
        List<Object> present = new ArrayList<>();
        for (Object value : values) {
            if (value != null) {
                present.add(value);
            }
        }
        if (present.isEmpty()) {
            return FieldCategory.SAME;
        }

        Set<String> distinct = new HashSet<>();
        for (Object value : present) {
            distinct.add(Values.toDisplayString(value));
        }

        if (distinct.size() == 1) {
            // one value, possibly missing in some entries
            return present.size() == values.size() ? FieldCategory.SAME : FieldCategory.GROUP;
        }
        if (distinct.size() == present.size()) {
            return TimeUtils.isTimestampLike(present.get(0)) ? FieldCategory.TIMESTAMP : FieldCategory.UNIQUE;
        }
        return FieldCategory.GROUP;
    }

    @Override
    public String getDescription() {
        return "Categorize metadata fields";
    }
}
