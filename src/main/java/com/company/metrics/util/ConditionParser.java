package com.company.metrics.util;

import com.company.metrics.domain.Condition;
import com.company.metrics.domain.enums.ConditionOperator;
import com.company.metrics.exception.InvalidConditionException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Parses and formats condition strings.
 * <p>
 * Format: {@code field[:operator[:values]]}, conditions separated by {@code ;}.
 * <pre>
 *   agent_name                           slice
 *   agent_name:in:agent1,agent2          in
 *   model:not_in:gpt-3.5;author:in:u1    two conditions
 *   value:range:10:100                   range, either side optional ("10:", ":100")
 *   time_end_utc:range:(2025-05-23T04:00:00):
 * </pre>
 * A value wrapped in parentheses is taken literally: separators inside it are not split on,
 * and it is never coerced to a number.
 * <p>
 * Parsing is best-effort: a malformed condition is logged and skipped, the rest are kept.
 */
@Slf4j
public final class ConditionParser {

    private static final String SPECIAL_CHARACTERS = ":,;()";

    private ConditionParser() {
    }

    public static List<Condition> parse(String conditions) {
        List<Condition> result = new ArrayList<>();
        if (conditions == null || conditions.isBlank()) {
            return result;
        }

        for (String part : splitTopLevel(conditions, ';', -1)) {
            part = part.trim();
            if (part.isEmpty()) {
                continue;
            }
            try {
                result.add(parseOne(part));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping condition '{}': {}", part, e.getMessage());
            }
        }
        return result;
    }

    public static List<Condition> parseAll(List<String> conditions) {
        List<Condition> result = new ArrayList<>();
        if (conditions == null) {
            return result;
        }
        for (String condition : conditions) {
            result.addAll(parse(condition));
        }
        return result;
    }

    /**
     * Parses a single condition, throwing instead of skipping.
     *
     * @throws InvalidConditionException if the text is not a valid condition
     */
    public static Condition parseOne(String condition) {
        List<String> components = splitTopLevel(condition.trim(), ':', 3);
        String fieldName = components.get(0).trim();
        if (components.size() == 1) {
            return Condition.slice(fieldName);
        }

        String operatorText = components.get(1).trim();
        String valuesText = components.size() > 2 ? components.get(2).trim() : "";

        ConditionOperator operator;
        try {
            operator = ConditionOperator.fromString(operatorText);
        } catch (IllegalArgumentException e) {
            throw new InvalidConditionException(e.getMessage() + " for field '" + fieldName + "'");
        }

        if (operator == ConditionOperator.SLICE) {
            if (!valuesText.isEmpty()) {
                throw new InvalidConditionException("'slice' operator takes no values for field '" + fieldName + "'");
            }
            return Condition.slice(fieldName);
        }
        if (operator == ConditionOperator.IN || operator == ConditionOperator.NOT_IN) {
            List<String> values = new ArrayList<>();
            for (String value : splitTopLevel(valuesText, ',', -1)) {
                value = value.trim();
                if (!value.isEmpty()) {
                    values.add(unwrap(value));
                }
            }
            if (values.isEmpty()) {
                throw new InvalidConditionException(String.format(
                        "'%s' operator requires values for field '%s'", operator.getCode(), fieldName));
            }
            return new Condition(fieldName, operator, values);
        }

        List<String> bounds = valuesText.isEmpty() ? List.of("", "") : splitTopLevel(valuesText, ':', -1);
        if (bounds.size() > 2) {
            throw new InvalidConditionException(String.format(
                    "range for '%s' has more than two bounds in '%s'; wrap values containing ':' in parentheses",
                    fieldName, valuesText));
        }
        Object min = parseBound(bounds.get(0));
        Object max = bounds.size() > 1 ? parseBound(bounds.get(1)) : null;
        return Condition.range(fieldName, min, max);
    }

    public static String format(Condition condition) {
        String fieldName = condition.getFieldName();
        ConditionOperator operator = condition.getOperator();
        if (operator == ConditionOperator.SLICE) {
            return fieldName;
        }
        if (operator == ConditionOperator.IN || operator == ConditionOperator.NOT_IN) {
            String values = condition.getValues().stream()
                    .map(value -> escape(value, false))
                    .collect(Collectors.joining(","));
            return fieldName + ":" + operator.getCode() + ":" + values;
        }
        return fieldName + ":" + operator.getCode() + ":"
                + escape(condition.getMin(), true) + ":" + escape(condition.getMax(), true);
    }

    public static String formatAll(List<Condition> conditions) {
        return conditions.stream().map(ConditionParser::format).collect(Collectors.joining(";"));
    }

    /**
     * Splits on {@code separator} outside parentheses. {@code limit} caps the number of parts, -1 for no cap.
     */
    static List<String> splitTopLevel(String text, char separator, int limit) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')' && depth > 0) {
                depth--;
            } else if (c == separator && depth == 0 && (limit < 0 || parts.size() < limit - 1)) {
                parts.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        parts.add(current.toString());
        return parts;
    }

    private static Object parseBound(String text) {
        text = text.trim();
        if (text.isEmpty()) {
            return null;
        }
        if (isWrapped(text)) {
            return text.substring(1, text.length() - 1);
        }
        Double number = Values.parseNumber(text);
        return number != null ? number : text;
    }

    private static String unwrap(String text) {
        return isWrapped(text) ? text.substring(1, text.length() - 1) : text;
    }

    /**
     * True when the text is one parenthesized group, e.g. "(a:b)" but not "(a)(b)".
     */
    private static boolean isWrapped(String text) {
        if (text.length() < 2 || text.charAt(0) != '(' || text.charAt(text.length() - 1) != ')') {
            return false;
        }
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0 && i < text.length() - 1) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    private static String escape(Object value, boolean rangeBound) {
        if (value == null) {
            return "";
        }
        String text = Values.toDisplayString(value);
        boolean needsWrapping = text.chars().anyMatch(c -> SPECIAL_CHARACTERS.indexOf(c) >= 0)
                || !text.equals(text.trim())
                || text.isEmpty()
                // keeps a numeric-looking string bound a string after re-parsing
                || (rangeBound && value instanceof String && Values.parseNumber(text) != null);
        return needsWrapping ? "(" + text + ")" : text;
    }
}
