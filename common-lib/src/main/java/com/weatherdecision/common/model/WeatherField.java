package com.weatherdecision.common.model;

/**
 * Raw weather fields a {@link WeatherSample} may carry.
 *
 * <p>Units: temperature and water temperature in °C, wind speed in km/h, wind direction
 * in degrees, precipitation in mm/h, fog density as a fraction [0,1], visibility in
 * metres, cloud cover and relative humidity in percent, wave height in metres.
 */
public enum WeatherField {
    TEMPERATURE("temperature"),
    WIND_SPEED("windSpeed"),
    WIND_DIRECTION("windDirection"),
    PRECIPITATION_RATE("precipitationRate"),
    FOG_DENSITY("fogDensity"),
    VISIBILITY_METERS("visibilityMeters"),
    CLOUD_COVER("cloudCoverPercent"),
    RELATIVE_HUMIDITY("relativeHumidity"),
    WAVE_HEIGHT("waveHeight"),
    WATER_TEMPERATURE("waterTemperature");

    private final String fieldName;

    WeatherField(String fieldName) {
        this.fieldName = fieldName;
    }

    /** Name of the field as it appears on the wire. */
    public String fieldName() {
        return fieldName;
    }
}
