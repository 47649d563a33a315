package com.company.metrics.domain;

import com.company.metrics.domain.enums.ConditionOperator;
import com.company.metrics.exception.InvalidConditionException;
import com.company.metrics.exception.SliceConditionCheckException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConditionTest {

    @Test
    void inAndNotInCompareNumbersAcrossTypes() {
        Condition in = Condition.in("x", List.of("5", "a"));

        assertThat(in.check(5)).isTrue();
        assertThat(in.check(5.0)).isTrue();
        assertThat(in.check("a")).isTrue();
        assertThat(in.check("b")).isFalse();
        assertThat(in.check(null)).isFalse();
        assertThat(Condition.notIn("x", List.of("a")).check("b")).isTrue();
        assertThat(Condition.notIn("x", List.of("a")).check("a")).isFalse();
    }

    @Test
    void rangeIsInclusiveAndRejectsIncomparableValues() {
        Condition range = Condition.range("x", 10.0, 20.0);

        assertThat(range.check(10)).isTrue();
        assertThat(range.check(20.0)).isTrue();
        assertThat(range.check(9.99)).isFalse();
        assertThat(range.check(21)).isFalse();
        assertThat(range.check("15")).isFalse();
        assertThat(range.check(null)).isFalse();
    }

    @Test
    void openRangeAcceptsAnything() {
        assertThat(Condition.range("x", null, null).check("anything")).isTrue();
        assertThat(Condition.range("x", null, 5.0).check(-100)).isTrue();
    }

    @Test
    void timestampRangeComparesStrings() {
        Condition range = Condition.range("time", "2025-01-01T00:00:00", null);

        assertThat(range.check("2025-03-01T10:00:00")).isTrue();
        assertThat(range.check("2024-12-31T23:59:59")).isFalse();
    }

    @Test
    void checkingASliceFailsLoudly() {
        assertThatThrownBy(() -> Condition.slice("agent").check("a"))
                .isInstanceOf(SliceConditionCheckException.class);
    }

    @Test
    void constructionValidatesValues() {
        assertThatThrownBy(() -> new Condition("x", ConditionOperator.SLICE, List.of("a")))
                .isInstanceOf(InvalidConditionException.class);
        assertThatThrownBy(() -> Condition.in("x", List.of()))
                .isInstanceOf(InvalidConditionException.class);
        assertThatThrownBy(() -> new Condition("x", ConditionOperator.RANGE, List.of(1)))
                .isInstanceOf(InvalidConditionException.class);
        assertThatThrownBy(() -> Condition.slice(" "))
                .isInstanceOf(InvalidConditionException.class);
    }

    @Test
    void toStringIsTheParseableForm() {
        assertThat(Condition.in("model", List.of("a", "b"))).hasToString("model:in:a,b");
    }
}
