package com.weatherdecision.scoring.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/** Half-open range {@code [from, to)}. */
public record TimeRange(
    @JsonProperty("from") Instant from,
    @JsonProperty("to")   Instant to
) {

    public TimeRange {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (!to.isAfter(from)) {
            throw new IllegalArgumentException("Time range end " + to + " is not after start " + from);
        }
    }
}
