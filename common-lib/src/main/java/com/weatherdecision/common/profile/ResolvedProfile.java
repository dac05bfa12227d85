package com.weatherdecision.common.profile;

import com.weatherdecision.common.model.IndexId;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Canonical profile consumed by the formulas: per index, weights normalized to sum to 1,
 * and every threshold resolved to either the user's value or the catalog default.
 */
public record ResolvedProfile(
    String userId,
    Map<IndexId, Map<ProfileMetric, Double>> weights,
    Map<ProfileThreshold, Double> thresholds
) {

    public ResolvedProfile {
        Map<IndexId, Map<ProfileMetric, Double>> weightCopy = new EnumMap<>(IndexId.class);
        weights.forEach((id, w) -> weightCopy.put(id, Collections.unmodifiableMap(new EnumMap<>(w))));
        weights = Collections.unmodifiableMap(weightCopy);
        Map<ProfileThreshold, Double> thresholdCopy = new EnumMap<>(ProfileThreshold.class);
        thresholdCopy.putAll(thresholds);
        thresholds = Collections.unmodifiableMap(thresholdCopy);
    }

    /** Normalized weights of {@code index}; empty when the index was not resolved or has none. */
    public Map<ProfileMetric, Double> weightsFor(IndexId index) {
        return weights.getOrDefault(index, Map.of());
    }

    public double weight(ProfileMetric metric) {
        return weightsFor(metric.index()).getOrDefault(metric, 0.0);
    }

    /**
     * @throws IllegalStateException when the threshold was not resolved, which means the
     *         profile was resolved for a different set of indices
     */
    public double threshold(ProfileThreshold threshold) {
        Double value = thresholds.get(threshold);
        if (value == null) {
            throw new IllegalStateException("Threshold not resolved: " + threshold.key());
        }
        return value;
    }
}
