package com.company.metrics.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Heuristic constants of the engine, bound from {@code metrics.engine.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "metrics.engine")
public class EngineProperties {

    // metrics below this absolute value are marked for pruning
    @PositiveOrZero
    private double pruneMinThreshold = 0.011;

    // _min/_max metrics closer than this ratio to _avg are marked for pruning
    @PositiveOrZero
    private double pruneMinVariationRatio = 0.33;

    @Min(0)
    @Max(10)
    private int roundPrecision = 2;

    @NotBlank
    private String timestampField = "time_end_utc";

    private String fallbackTimestampField = "instance_updated_at";

    @NotNull
    private Duration cacheStaleness = Duration.ofMinutes(5);

    /**
     * Field holding the latest timestamp of an aggregated entry.
     */
    public String getAggregatedTimestampField() {
        return timestampField + "/max_value";
    }

    public int resolveRoundPrecision(Integer requested) {
        return requested != null ? requested : roundPrecision;
    }
}
