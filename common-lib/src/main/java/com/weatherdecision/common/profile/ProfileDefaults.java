package com.weatherdecision.common.profile;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Catalog-level fallbacks used when a profile leaves weights or thresholds unspecified.
 */
public record ProfileDefaults(
    Map<ProfileMetric, Double> weights,
    Map<ProfileThreshold, Double> thresholds
) {

    public ProfileDefaults {
        weights = Collections.unmodifiableMap(copy(weights, ProfileMetric.class));
        thresholds = Collections.unmodifiableMap(copy(thresholds, ProfileThreshold.class));
        weights.forEach((metric, w) -> {
            if (!(w >= 0.0 && w <= 1.0)) {
                throw new IllegalArgumentException("Default weight out of [0,1] for " + metric.key() + ": " + w);
            }
        });
        thresholds.forEach((threshold, v) -> {
            if (!threshold.inRange(v)) {
                throw new IllegalArgumentException("Default threshold out of range for " + threshold.key() + ": " + v);
            }
        });
    }

    public static ProfileDefaults defaults() {
        Map<ProfileMetric, Double> weights = new EnumMap<>(ProfileMetric.class);
        weights.put(ProfileMetric.TEMPERATURE, 0.4);
        weights.put(ProfileMetric.WIND, 0.25);
        weights.put(ProfileMetric.RAIN, 0.25);
        weights.put(ProfileMetric.FOG, 0.1);
        weights.put(ProfileMetric.VISIBILITY_FOG, 0.6);
        weights.put(ProfileMetric.VISIBILITY_RAIN, 0.25);
        weights.put(ProfileMetric.VISIBILITY_CLOUD, 0.15);

        Map<ProfileThreshold, Double> thresholds = new EnumMap<>(ProfileThreshold.class);
        thresholds.put(ProfileThreshold.COMFORT_WIND_MAX, 15.0);
        thresholds.put(ProfileThreshold.COMFORT_RAIN_MAX, 0.2);
        thresholds.put(ProfileThreshold.COMFORT_FOG_MAX, 0.1);
        thresholds.put(ProfileThreshold.CLOTHING_WARMTH_OFFSET, 0.0);
        thresholds.put(ProfileThreshold.COLD_SHOCK_SENSITIVITY, 1.0);
        return new ProfileDefaults(weights, thresholds);
    }

    private static <K extends Enum<K>> Map<K, Double> copy(Map<K, Double> source, Class<K> type) {
        Map<K, Double> copy = new EnumMap<>(type);
        if (source != null) {
            copy.putAll(source);
        }
        return copy;
    }
}
