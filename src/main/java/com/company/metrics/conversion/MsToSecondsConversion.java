package com.company.metrics.conversion;

import com.company.metrics.domain.AnnotatedFieldValue;
import com.company.metrics.domain.Entry;
import com.company.metrics.domain.FieldValue;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts millisecond metrics to seconds. A metric qualifies when the last {@code /}-segment
 * of its name contains the token {@code ms} delimited by {@code _}, {@code /} or the name edges,
 * e.g. {@code latency_ms} or {@code api/ms_total}.
 */
@Slf4j
public class MsToSecondsConversion implements Conversion {

    private static final Pattern MS_TOKEN = Pattern.compile("(^|[_/])(ms)(?=[_/]|$)");

    @Override
    public List<Entry> convert(List<Entry> entries) {
        for (Entry entry : entries) {
            Map<String, FieldValue> converted = new LinkedHashMap<>();
            for (Map.Entry<String, FieldValue> metric : entry.getMetrics().entrySet()) {
                String key = metric.getKey();
                FieldValue value = metric.getValue();
                String newKey = renameKey(key);

                if (!newKey.equals(key) && value.getValue() instanceof Number number) {
                    AnnotatedFieldValue seconds = value.copy().promote();
                    seconds.setValue(number.doubleValue() / 1000);
                    if (seconds.getMinValue() instanceof Number min) {
                        seconds.setMinValue(min.doubleValue() / 1000);
                    }
                    if (seconds.getMaxValue() instanceof Number max) {
                        seconds.setMaxValue(max.doubleValue() / 1000);
                    }
                    if (seconds.getDescription() != null) {
                        seconds.setDescription(renameDescription(seconds.getDescription()));
                    }
                    log.debug("Converting {} -> {}", key, newKey);
                    converted.put(newKey, value.isAnnotated() ? seconds : seconds.flatten());
                } else {
                    converted.put(key, value);
                }
            }
            entry.setMetrics(converted);
        }
        return entries;
    }

    static String renameKey(String key) {
        int slash = key.lastIndexOf('/');
        String head = key.substring(0, slash + 1);
        String last = key.substring(slash + 1);
        return head + replaceMsToken(last);
    }

    static String renameDescription(String description) {
        String result = description.replaceAll("\\bms\\b", "s")
                .replaceAll("\\bmilliseconds\\b", "seconds")
                .replaceAll("\\bMilliseconds\\b", "Seconds");
        // metric names quoted in descriptions
        return replaceMsToken(result);
    }

    private static String replaceMsToken(String text) {
        Matcher matcher = MS_TOKEN.matcher(text);
        return matcher.replaceAll(m -> Matcher.quoteReplacement(m.group(1) + "s"));
    }

    @Override
    public String getDescription() {
        return "Millisecond fields to seconds";
    }
}
