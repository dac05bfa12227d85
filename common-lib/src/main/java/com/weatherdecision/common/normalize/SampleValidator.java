package com.weatherdecision.common.normalize;

import com.weatherdecision.common.exception.ValidationException;
import com.weatherdecision.common.model.WeatherField;
import com.weatherdecision.common.model.WeatherSample;

/**
 * Physical plausibility checks applied to every raw sample before normalization.
 *
 * <pre>
 *   windSpeed          ≥ 0
 *   windDirection      ∈ [0, 360]
 *   precipitationRate  ≥ 0
 *   fogDensity         ∈ [0, 1]
 *   visibilityMeters   ≥ 0
 *   cloudCoverPercent  ∈ [0, 100]
 *   relativeHumidity   ∈ [0, 100]
 *   waveHeight         ≥ 0
 *   any present value  finite
 * </pre>
 */
public final class SampleValidator {

    private SampleValidator() {}

    /**
     * @throws ValidationException naming the first offending field
     */
    public static void validate(WeatherSample sample) {
        if (sample == null) {
            throw new ValidationException(null, null, null, "Sample is null");
        }
        if (sample.timestamp() == null) {
            throw new ValidationException(null, null, null, "Sample has no timestamp");
        }
        for (WeatherField field : WeatherField.values()) {
            Double value = sample.value(field);
            if (value == null) {
                continue;
            }
            if (!Double.isFinite(value)) {
                throw reject(sample, field, value, "non-finite value");
            }
            switch (field) {
                case WIND_SPEED, PRECIPITATION_RATE, VISIBILITY_METERS, WAVE_HEIGHT -> {
                    if (value < 0.0) throw reject(sample, field, value, "must not be negative");
                }
                case WIND_DIRECTION -> {
                    if (value < 0.0 || value > 360.0) throw reject(sample, field, value, "must be within [0,360]");
                }
                case FOG_DENSITY -> {
                    if (value < 0.0 || value > 1.0) throw reject(sample, field, value, "must be within [0,1]");
                }
                case CLOUD_COVER, RELATIVE_HUMIDITY -> {
                    if (value < 0.0 || value > 100.0) throw reject(sample, field, value, "must be within [0,100]");
                }
                default -> { }
            }
        }
    }

    private static ValidationException reject(WeatherSample sample, WeatherField field,
                                              double value, String reason) {
        return new ValidationException(sample.timestamp(), field, value,
            String.format("%s=%s %s", field.fieldName(), value, reason));
    }
}
