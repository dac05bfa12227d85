package com.weatherdecision.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * One weather observation or forecast step.
 *
 * <p>Every field except {@code timestamp} may be {@code null}, which marks it as
 * explicitly missing. Samples are never mutated once ingested: {@link #withTimestamp}
 * and the {@link Builder} always produce a new instance.
 */
public record WeatherSample(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("temperature") Double temperature,
    @JsonProperty("windSpeed") Double windSpeed,
    @JsonProperty("windDirection") Double windDirection,
    @JsonProperty("precipitationRate") Double precipitationRate,
    @JsonProperty("fogDensity") Double fogDensity,
    @JsonProperty("visibilityMeters") Double visibilityMeters,
    @JsonProperty("cloudCoverPercent") Double cloudCoverPercent,
    @JsonProperty("relativeHumidity") Double relativeHumidity,
    @JsonProperty("waveHeight") Double waveHeight,
    @JsonProperty("waterTemperature") Double waterTemperature
) {

    /** Value of {@code field}, or {@code null} when missing. */
    public Double value(WeatherField field) {
        return switch (field) {
            case TEMPERATURE        -> temperature;
            case WIND_SPEED         -> windSpeed;
            case WIND_DIRECTION     -> windDirection;
            case PRECIPITATION_RATE -> precipitationRate;
            case FOG_DENSITY        -> fogDensity;
            case VISIBILITY_METERS  -> visibilityMeters;
            case CLOUD_COVER        -> cloudCoverPercent;
            case RELATIVE_HUMIDITY  -> relativeHumidity;
            case WAVE_HEIGHT        -> waveHeight;
            case WATER_TEMPERATURE  -> waterTemperature;
        };
    }

    public boolean has(WeatherField field) {
        return value(field) != null;
    }

    /** The subset of {@code required} this sample does not carry. */
    public Set<WeatherField> missingOf(Collection<WeatherField> required) {
        Set<WeatherField> missing = EnumSet.noneOf(WeatherField.class);
        for (WeatherField field : required) {
            if (!has(field)) {
                missing.add(field);
            }
        }
        return missing;
    }

    /** Present fields only, in declaration order. */
    public Map<WeatherField, Double> presentValues() {
        Map<WeatherField, Double> values = new EnumMap<>(WeatherField.class);
        for (WeatherField field : WeatherField.values()) {
            Double v = value(field);
            if (v != null) {
                values.put(field, v);
            }
        }
        return values;
    }

    public WeatherSample withTimestamp(Instant newTimestamp) {
        return of(newTimestamp, presentValues());
    }

    public static WeatherSample of(Instant timestamp, Map<WeatherField, Double> values) {
        return new WeatherSample(timestamp,
            values.get(WeatherField.TEMPERATURE),
            values.get(WeatherField.WIND_SPEED),
            values.get(WeatherField.WIND_DIRECTION),
            values.get(WeatherField.PRECIPITATION_RATE),
            values.get(WeatherField.FOG_DENSITY),
            values.get(WeatherField.VISIBILITY_METERS),
            values.get(WeatherField.CLOUD_COVER),
            values.get(WeatherField.RELATIVE_HUMIDITY),
            values.get(WeatherField.WAVE_HEIGHT),
            values.get(WeatherField.WATER_TEMPERATURE));
    }

    public static Builder builder(Instant timestamp) {
        return new Builder(timestamp);
    }

    public static final class Builder {

        private final Instant timestamp;
        private final Map<WeatherField, Double> values = new EnumMap<>(WeatherField.class);

        private Builder(Instant timestamp) {
            this.timestamp = timestamp;
        }

        public Builder with(WeatherField field, Double value) {
            if (value == null) {
                values.remove(field);
            } else {
                values.put(field, value);
            }
            return this;
        }

        public Builder temperature(double v)       { return with(WeatherField.TEMPERATURE, v); }
        public Builder windSpeed(double v)         { return with(WeatherField.WIND_SPEED, v); }
        public Builder windDirection(double v)     { return with(WeatherField.WIND_DIRECTION, v); }
        public Builder precipitationRate(double v) { return with(WeatherField.PRECIPITATION_RATE, v); }
        public Builder fogDensity(double v)        { return with(WeatherField.FOG_DENSITY, v); }
        public Builder visibilityMeters(double v)  { return with(WeatherField.VISIBILITY_METERS, v); }
        public Builder cloudCover(double v)        { return with(WeatherField.CLOUD_COVER, v); }
        public Builder relativeHumidity(double v)  { return with(WeatherField.RELATIVE_HUMIDITY, v); }
        public Builder waveHeight(double v)        { return with(WeatherField.WAVE_HEIGHT, v); }
        public Builder waterTemperature(double v)  { return with(WeatherField.WATER_TEMPERATURE, v); }

        public WeatherSample build() {
            return of(timestamp, values);
        }
    }
}
