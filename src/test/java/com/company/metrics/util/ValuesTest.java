package com.company.metrics.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ValuesTest {

    @Test
    void signedZerosAreEqualWithEqualHashes() {
        assertThat(Values.valueEquals(0.0, -0.0)).isTrue();
        assertThat(Values.valueHash(-0.0)).isEqualTo(Values.valueHash(0.0));
        assertThat(Values.valueHash(0)).isEqualTo(Values.valueHash(-0.0));
    }

    @Test
    void mixedNumericBoxingComparesByValue() {
        assertThat(Values.valueEquals(5, 5.0)).isTrue();
        assertThat(Values.valueHash(5L)).isEqualTo(Values.valueHash(5.0));
        assertThat(Values.valueEquals(5, "5")).isFalse();
    }
}
