package com.weatherdecision.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of evaluating one index at one timestamp.
 *
 * <p>{@code value} is {@code null} when the index could not be computed; otherwise it
 * lies in [0,100]. {@code confidence} is 1 for a fully computed result, 0 for a fully
 * degraded one, and in between when the formula accepts partial inputs.
 *
 * @param band          category label for the value ({@code null} when degraded)
 * @param details       auxiliary named outputs, e.g. {@code minutesToDiscomfort}
 * @param missingFields required inputs that were absent
 * @param warning       {@link WarningTag#COMPUTATION_DEGRADED} whenever confidence is below 1
 */
public record ScoreResult(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("indexId") IndexId indexId,
    @JsonProperty("value") Double value,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("band") String band,
    @JsonProperty("details") Map<String, Double> details,
    @JsonProperty("missingFields") Set<WeatherField> missingFields,
    @JsonProperty("warning") WarningTag warning
) {

    public static final double MIN_VALUE = 0.0;
    public static final double MAX_VALUE = 100.0;

    public ScoreResult {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(indexId, "indexId");
        if (value != null && !(value >= MIN_VALUE && value <= MAX_VALUE)) {
            throw new IllegalArgumentException(
                "Score for " + indexId.key() + " outside [0,100]: " + value);
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("Confidence outside [0,1]: " + confidence);
        }
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        missingFields = missingFields == null || missingFields.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(missingFields));
    }

    /** Fully degraded result: no value, confidence 0. */
    public static ScoreResult degraded(Instant timestamp, IndexId indexId, Set<WeatherField> missing) {
        return new ScoreResult(timestamp, indexId, null, 0.0, null, Map.of(), missing,
            WarningTag.COMPUTATION_DEGRADED);
    }

    public boolean hasValue() {
        return value != null;
    }
}
