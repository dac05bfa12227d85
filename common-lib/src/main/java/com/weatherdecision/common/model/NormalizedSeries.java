package com.weatherdecision.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Samples on a fixed-interval grid.
 *
 * <p>Construction enforces the grid: timestamps strictly increasing and exactly
 * {@code interval} apart. Fields inside each sample may still be missing.
 */
public record NormalizedSeries(
    @JsonProperty("interval") Duration interval,
    @JsonProperty("samples") List<WeatherSample> samples
) {

    public NormalizedSeries {
        Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Series interval must be positive, got " + interval);
        }
        samples = samples == null ? List.of() : List.copyOf(samples);
        for (int i = 1; i < samples.size(); i++) {
            Instant prev = samples.get(i - 1).timestamp();
            Instant curr = samples.get(i).timestamp();
            if (!Duration.between(prev, curr).equals(interval)) {
                throw new IllegalArgumentException(String.format(
                    "Series is not on a %s grid: %s followed by %s", interval, prev, curr));
            }
        }
    }

    public static NormalizedSeries empty(Duration interval) {
        return new NormalizedSeries(interval, List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return samples.isEmpty();
    }

    /** First timestamp, {@code null} for an empty series. */
    public Instant start() {
        return samples.isEmpty() ? null : samples.get(0).timestamp();
    }

    /** Exclusive end of coverage: last timestamp plus one interval; {@code null} when empty. */
    public Instant coverageEnd() {
        return samples.isEmpty() ? null : samples.get(samples.size() - 1).timestamp().plus(interval);
    }
}
