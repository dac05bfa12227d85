package com.weatherdecision.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Discrete recommendation derived from one or more {@link ScoreResult}s of the same index.
 *
 * @param category label from the index's ordered category list
 * @param rank     position of {@code category} in that list (0 = lowest band)
 * @param from     earliest timestamp the recommendation was derived from
 * @param to       latest timestamp the recommendation was derived from
 * @param basedOn  number of computed results that contributed
 */
public record Recommendation(
    @JsonProperty("indexId") IndexId indexId,
    @JsonProperty("category") String category,
    @JsonProperty("rank") int rank,
    @JsonProperty("polarity") Polarity polarity,
    @JsonProperty("from") Instant from,
    @JsonProperty("to") Instant to,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("basedOn") int basedOn
) {}
