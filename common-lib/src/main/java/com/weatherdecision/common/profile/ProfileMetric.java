package com.weatherdecision.common.profile;

import com.weatherdecision.common.model.IndexId;
import com.weatherdecision.common.model.WeatherField;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recognized weight keys. Each weight belongs to exactly one index; within an index the
 * resolved weights are normalized to sum to 1.
 */
public enum ProfileMetric {

    /** Day-quality: weight of the temperature comfort sub-score. */
    TEMPERATURE("temp", IndexId.DAY_QUALITY, WeatherField.TEMPERATURE),
    /** Day-quality: weight of the wind comfort sub-score. */
    WIND("wind", IndexId.DAY_QUALITY, WeatherField.WIND_SPEED),
    /** Day-quality: weight of the precipitation comfort sub-score. */
    RAIN("rain", IndexId.DAY_QUALITY, WeatherField.PRECIPITATION_RATE),
    /** Day-quality: weight of the fog comfort sub-score. */
    FOG("fog", IndexId.DAY_QUALITY, WeatherField.FOG_DENSITY),

    /** Maritime visibility: share of the obstruction attributed to fog density. */
    VISIBILITY_FOG("visibility.fog", IndexId.MARITIME_VISIBILITY, WeatherField.FOG_DENSITY),
    /** Maritime visibility: share attributed to precipitation intensity. */
    VISIBILITY_RAIN("visibility.rain", IndexId.MARITIME_VISIBILITY, WeatherField.PRECIPITATION_RATE),
    /** Maritime visibility: share attributed to cloud cover. */
    VISIBILITY_CLOUD("visibility.cloud", IndexId.MARITIME_VISIBILITY, WeatherField.CLOUD_COVER);

    private final String key;
    private final IndexId index;
    private final WeatherField field;

    ProfileMetric(String key, IndexId index, WeatherField field) {
        this.key = key;
        this.index = index;
        this.field = field;
    }

    public String key()         { return key; }
    public IndexId index()      { return index; }
    public WeatherField field() { return field; }

    public static Optional<ProfileMetric> fromKey(String key) {
        for (ProfileMetric metric : values()) {
            if (metric.key.equals(key)) {
                return Optional.of(metric);
            }
        }
        return Optional.empty();
    }

    /** Metrics weighted by {@code index}, in declaration order. */
    public static List<ProfileMetric> forIndex(IndexId index) {
        List<ProfileMetric> metrics = new ArrayList<>();
        for (ProfileMetric metric : values()) {
            if (metric.index == index) {
                metrics.add(metric);
            }
        }
        return metrics;
    }
}
