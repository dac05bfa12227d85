package com.weatherdecision.scoring.ingest;

import com.weatherdecision.common.model.WeatherField;

import java.util.Optional;

/**
 * MeteoSIX forecast variables this service understands, with the sample field each one feeds.
 * {@code wind} is the only vector variable: its {@code moduleValue} feeds wind speed and its
 * {@code directionValue} feeds wind direction.
 */
public enum MeteoSixVariable {
    TEMPERATURE("temperature", WeatherField.TEMPERATURE),
    RELATIVE_HUMIDITY("relative_humidity", WeatherField.RELATIVE_HUMIDITY),
    PRECIPITATION_AMOUNT("precipitation_amount", WeatherField.PRECIPITATION_RATE),
    CLOUD_AREA_FRACTION("cloud_area_fraction", WeatherField.CLOUD_COVER),
    WIND("wind", WeatherField.WIND_SPEED),
    SIGNIFICATIVE_WAVE_HEIGHT("significative_wave_height", WeatherField.WAVE_HEIGHT),
    SEA_WATER_TEMPERATURE("sea_water_temperature", WeatherField.WATER_TEMPERATURE);

    private final String apiName;
    private final WeatherField field;

    MeteoSixVariable(String apiName, WeatherField field) {
        this.apiName = apiName;
        this.field = field;
    }

    public String apiName()     { return apiName; }
    public WeatherField field() { return field; }

    public static Optional<MeteoSixVariable> fromApiName(String name) {
        for (MeteoSixVariable v : values()) {
            if (v.apiName.equals(name)) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }

    /**
     * Converts a raw value in {@code units} into the unit the sample field expects:
     * km/h for wind, °C for temperatures, percent for cloud cover.
     */
    public double toSampleUnits(double raw, String units) {
        String u = units == null ? "" : units.trim().toLowerCase();
        return switch (this) {
            case WIND -> switch (u) {
                case "m/s", "m s-1", "ms-1" -> raw * 3.6;
                case "kt", "kn", "knots"    -> raw * 1.852;
                default                     -> raw;
            };
            case TEMPERATURE, SEA_WATER_TEMPERATURE -> u.equals("k") || u.equals("kelvin") ? raw - 273.15 : raw;
            case CLOUD_AREA_FRACTION -> u.equals("%") ? raw : raw * 100.0;
            default -> raw;
        };
    }
}
