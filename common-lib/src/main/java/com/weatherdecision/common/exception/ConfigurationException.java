package com.weatherdecision.common.exception;

/**
 * A user profile (or requested index list) cannot be resolved: negative or out-of-range
 * weight, unknown key, or a required threshold is absent. Raised before any scoring.
 */
public class ConfigurationException extends WeatherScoringException {

    private final String key;

    public ConfigurationException(String key, String message) {
        super(key, message);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
