package com.weatherdecision.common.exception;

import com.weatherdecision.common.model.WeatherField;

import java.time.Instant;

/**
 * A sample carries a malformed or physically impossible value. Raised during
 * normalization; the normalizer never clamps.
 */
public class ValidationException extends WeatherScoringException {

    private final Instant sampleTimestamp;
    private final WeatherField field;
    private final Double rejectedValue;

    /**
     * @param field {@code null} when the timestamp itself is the problem
     */
    public ValidationException(Instant sampleTimestamp, WeatherField field,
                               Double rejectedValue, String message) {
        super(subjectOf(sampleTimestamp, field), message);
        this.sampleTimestamp = sampleTimestamp;
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    private static String subjectOf(Instant timestamp, WeatherField field) {
        String fieldName = field == null ? "timestamp" : field.fieldName();
        return "sample@" + timestamp + "." + fieldName;
    }

    public Instant getSampleTimestamp() {
        return sampleTimestamp;
    }

    public WeatherField getField() {
        return field;
    }

    public Double getRejectedValue() {
        return rejectedValue;
    }
}
