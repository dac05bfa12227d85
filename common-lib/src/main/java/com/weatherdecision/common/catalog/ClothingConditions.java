package com.weatherdecision.common.catalog;

/**
 * Derived inputs the clothing rules are evaluated against.
 */
public record ClothingConditions(
    double temperature,
    double effectiveTemperature,
    double windSpeed,
    double precipitationRate,
    boolean wet,
    boolean windy
) {}
