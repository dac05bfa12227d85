package com.weatherdecision.common.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw, unvalidated user preferences as received from the dashboard.
 * Keys are free strings here; {@link UserProfileResolver} maps them onto
 * {@link ProfileMetric} and {@link ProfileThreshold}.
 */
public record UserProfile(
    @JsonProperty("userId")     String userId,
    @JsonProperty("weights")    Map<String, Double> weights,
    @JsonProperty("thresholds") Map<String, Double> thresholds
) {

    public UserProfile {
        weights = copy(weights);
        thresholds = copy(thresholds);
    }

    /** Null values are kept so the resolver can name the offending key. */
    private static Map<String, Double> copy(Map<String, Double> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
