package com.weatherdecision.common.catalog;

import com.weatherdecision.common.model.WeatherSample;
import com.weatherdecision.common.profile.ResolvedProfile;

/**
 * Pure index formula.
 *
 * <p>Implementations must be deterministic and side-effect free: the same sample and
 * profile always yield an equal output, and nothing outside the return value changes.
 * That is what lets the engine evaluate (timestamp, index) pairs in any order and on
 * any thread.
 */
@FunctionalInterface
public interface IndexFormula {

    /**
     * @return the computed output, or {@code null} when the available inputs are not
     *         enough to compute anything (only reachable for formulas that accept partial inputs)
     */
    IndexOutput apply(WeatherSample sample, ResolvedProfile profile);
}
