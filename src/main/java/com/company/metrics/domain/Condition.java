package com.company.metrics.domain;

import com.company.metrics.domain.enums.ConditionOperator;
import com.company.metrics.exception.InvalidConditionException;
import com.company.metrics.exception.SliceConditionCheckException;
import com.company.metrics.util.ConditionParser;
import com.company.metrics.util.Values;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A filter or grouping condition on one field.
 * <ul>
 *     <li>{@code slice}: no values, used only as a grouping key</li>
 *     <li>{@code in} / {@code not_in}: non-empty list of values</li>
 *     <li>{@code range}: {@code [min, max]} pair, either bound nullable</li>
 * </ul>
 */
@Getter
@EqualsAndHashCode
public final class Condition {

    private final String fieldName;
    private final ConditionOperator operator;
    private final List<Object> values;

    public Condition(String fieldName, ConditionOperator operator, List<?> values) {
        if (fieldName == null || fieldName.isBlank()) {
            throw new InvalidConditionException("Condition field name cannot be empty");
        }
        if (operator == null) {
            throw new InvalidConditionException("Condition operator is required for field '" + fieldName + "'");
        }
        this.fieldName = fieldName;
        this.operator = operator;
        if (operator == ConditionOperator.RANGE && values == null) {
            // open range on both sides
            values = Arrays.asList(null, null);
        }
        this.values = values == null ? null : Collections.unmodifiableList(new ArrayList<>(values));
        validate();
    }

    public static Condition slice(String fieldName) {
        return new Condition(fieldName, ConditionOperator.SLICE, null);
    }

    public static Condition in(String fieldName, List<?> values) {
        return new Condition(fieldName, ConditionOperator.IN, values);
    }

    public static Condition notIn(String fieldName, List<?> values) {
        return new Condition(fieldName, ConditionOperator.NOT_IN, values);
    }

    public static Condition range(String fieldName, Object min, Object max) {
        return new Condition(fieldName, ConditionOperator.RANGE, Arrays.asList(min, max));
    }

    public boolean isSlice() {
        return operator == ConditionOperator.SLICE;
    }

    public Object getMin() {
        return values == null ? null : values.get(0);
    }

    public Object getMax() {
        return values == null ? null : values.get(1);
    }

    /**
     * Evaluates the condition against a fetched field value. Incomparable values fail a range check.
     *
     * @throws SliceConditionCheckException for slice conditions, which are not predicates
     */
    public boolean check(Object fieldValue) {
        if (operator == ConditionOperator.SLICE) {
            throw new SliceConditionCheckException(fieldName);
        }
        if (operator == ConditionOperator.IN) {
            return contains(fieldValue);
        }
        if (operator == ConditionOperator.NOT_IN) {
            return !contains(fieldValue);
        }
        return checkRange(fieldValue);
    }

    private boolean contains(Object fieldValue) {
        for (Object candidate : values) {
            if (Values.valueEquals(candidate, fieldValue)) {
                return true;
            }
            // Parsed lists hold strings; let "5" match a numeric 5
            if (candidate instanceof String text && fieldValue instanceof Number) {
                Double number = Values.parseNumber(text);
                if (number != null && Values.valueEquals(number, fieldValue)) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean checkRange(Object fieldValue) {
        Object min = getMin();
        Object max = getMax();
        if (min != null) {
            if (!Values.isComparable(fieldValue, min) || Values.compare(fieldValue, min) < 0) {
                return false;
            }
        }
        if (max != null) {
            if (!Values.isComparable(fieldValue, max) || Values.compare(fieldValue, max) > 0) {
                return false;
            }
        }
        return true;
    }

    private void validate() {
        if (operator == ConditionOperator.SLICE) {
            if (values != null) {
                throw new InvalidConditionException("For 'slice' operator, no values should be given");
            }
        } else if (operator == ConditionOperator.IN || operator == ConditionOperator.NOT_IN) {
            if (values == null || values.isEmpty()) {
                throw new InvalidConditionException(String.format(
                        "For '%s' operator on '%s', values cannot be empty", operator.getCode(), fieldName));
            }
        } else if (values.size() != 2) {
            throw new InvalidConditionException(
                    "For 'range' operator, values must contain exactly 2 elements (min, max)");
        }
    }

    /**
     * Parseable form, see {@link ConditionParser}.
     */
    @JsonValue
    @Override
    public String toString() {
        return ConditionParser.format(this);
    }
}
