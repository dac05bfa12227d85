package com.weatherdecision.common.catalog;

/**
 * Trapezoidal comfort function: 100 inside {@code [optimalMin, optimalMax]}, falling
 * linearly to 0 at {@code hardMin} and {@code hardMax}, 0 beyond.
 */
record ComfortCurve(double hardMin, double optimalMin, double optimalMax, double hardMax) {

    ComfortCurve {
        if (!(hardMin <= optimalMin && optimalMin <= optimalMax && optimalMax <= hardMax)) {
            throw new IllegalArgumentException(String.format(
                "Comfort curve out of order: %.2f ≤ %.2f ≤ %.2f ≤ %.2f", hardMin, optimalMin, optimalMax, hardMax));
        }
    }

    /** Curve with no lower penalty: optimal from 0 up to {@code optimalMax}. */
    static ComfortCurve upTo(double optimalMax, double falloff) {
        return new ComfortCurve(0.0, 0.0, optimalMax, optimalMax + falloff);
    }

    double score(double x) {
        if (x >= optimalMin && x <= optimalMax) {
            return 100.0;
        }
        if (x < optimalMin) {
            return x <= hardMin ? 0.0 : 100.0 * (x - hardMin) / (optimalMin - hardMin);
        }
        return x >= hardMax ? 0.0 : 100.0 * (hardMax - x) / (hardMax - optimalMax);
    }
}
