package com.weatherdecision.common.catalog;

import java.util.Map;

/**
 * Raw output of an {@link IndexFormula} before it is wrapped into a score result.
 *
 * @param value      0–100 score (exposure score for clothing)
 * @param confidence share of the formula's inputs actually available, [0,1]
 * @param band       category label chosen by the formula
 * @param details    auxiliary named numbers for explanation (never null)
 */
public record IndexOutput(
    double value,
    double confidence,
    String band,
    Map<String, Double> details
) {

    public IndexOutput {
        if (!(value >= 0.0 && value <= 100.0)) {
            throw new IllegalArgumentException("Index value outside [0,100]: " + value);
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("Index confidence outside [0,1]: " + confidence);
        }
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    static double clampScore(double raw) {
        return Math.max(0.0, Math.min(100.0, raw));
    }
}
