package com.company.metrics.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void recognizesTimestampShapes() {
        assertThat(TimeUtils.isTimestampLike("2025-05-23T11:48:26.341261+00:00")).isTrue();
        assertThat(TimeUtils.isTimestampLike("2025-05-23T11:48:26")).isTrue();
        assertThat(TimeUtils.isTimestampLike("2025-05-23")).isTrue();
        assertThat(TimeUtils.isTimestampLike("1716464906")).isTrue();
        assertThat(TimeUtils.isTimestampLike("run-42")).isFalse();
        assertThat(TimeUtils.isTimestampLike(1716464906L)).isFalse();
    }

    @Test
    void naiveTimesAreReadAsUtc() {
        assertThat(TimeUtils.toEpochMillis("2025-01-01T00:00:00"))
                .isEqualTo(Instant.parse("2025-01-01T00:00:00Z").toEpochMilli());
        assertThat(TimeUtils.toEpochMillis("2025-01-01T02:00:00+02:00"))
                .isEqualTo(Instant.parse("2025-01-01T00:00:00Z").toEpochMilli());
        assertThat(TimeUtils.toEpochMillis("2025-01-01"))
                .isEqualTo(Instant.parse("2025-01-01T00:00:00Z").toEpochMilli());
    }

    @Test
    void unparseableTimesGiveNull() {
        assertThat(TimeUtils.toEpochMillis("yesterday")).isNull();
        assertThat(TimeUtils.toEpochMillis("")).isNull();
        assertThat(TimeUtils.toEpochMillis(42)).isNull();
    }

    @Test
    void formatsDurations() {
        assertThat(TimeUtils.formatDuration(3_600_000L + 120_000L)).isEqualTo("1h 2m");
        assertThat(TimeUtils.formatDuration(90_000L)).isEqualTo("1m 30s");
        assertThat(TimeUtils.formatDuration(5_000L)).isEqualTo("5s");
        assertThat(TimeUtils.formatDuration(null)).isNull();
    }
}
