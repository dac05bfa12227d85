package com.weatherdecision.common.profile;

import com.weatherdecision.common.model.IndexId;

import java.util.Collection;
import java.util.Optional;

/**
 * Recognized threshold keys with their documented ranges.
 *
 * <p>{@code requiredFor} names the index that cannot be resolved without the threshold;
 * such thresholds have no catalog default and must come from the user.
 */
public enum ProfileThreshold {

    /** Lower end of the comfortable temperature range, °C. */
    COMFORT_TEMP_MIN("comfort.temp.min", -30.0, 45.0, IndexId.DAY_QUALITY),
    /** Upper end of the comfortable temperature range, °C. */
    COMFORT_TEMP_MAX("comfort.temp.max", -30.0, 45.0, IndexId.DAY_QUALITY),
    /** Highest wind speed still fully comfortable, km/h. */
    COMFORT_WIND_MAX("comfort.wind.max", 0.0, 150.0, null),
    /** Highest precipitation rate still fully comfortable, mm/h. */
    COMFORT_RAIN_MAX("comfort.rain.max", 0.0, 50.0, null),
    /** Highest fog density still fully comfortable. */
    COMFORT_FOG_MAX("comfort.fog.max", 0.0, 1.0, null),
    /** Personal warmth offset added to the clothing effective temperature, °C. Positive runs warm. */
    CLOTHING_WARMTH_OFFSET("clothing.warmth.offset", -10.0, 10.0, null),
    /**
     * Multiplier applied to the cold-shock risk. Bounded so that cold, windy water stays at
     * least "high" and mild, calm water stays "low" under the default catalog parameters.
     */
    COLD_SHOCK_SENSITIVITY("coldshock.sensitivity", 0.7, 1.3, null);

    private final String key;
    private final double min;
    private final double max;
    private final IndexId requiredFor;

    ProfileThreshold(String key, double min, double max, IndexId requiredFor) {
        this.key = key;
        this.min = min;
        this.max = max;
        this.requiredFor = requiredFor;
    }

    public String key() { return key; }
    public double min() { return min; }
    public double max() { return max; }

    public boolean inRange(double value) {
        return value >= min && value <= max;
    }

    public boolean isRequiredFor(Collection<IndexId> indices) {
        return requiredFor != null && indices.contains(requiredFor);
    }

    public static Optional<ProfileThreshold> fromKey(String key) {
        for (ProfileThreshold threshold : values()) {
            if (threshold.key.equals(key)) {
                return Optional.of(threshold);
            }
        }
        return Optional.empty();
    }
}
