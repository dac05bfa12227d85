package com.weatherdecision.common.scoring;

import com.weatherdecision.common.catalog.IndexDefinition;
import com.weatherdecision.common.catalog.IndexOutput;
import com.weatherdecision.common.model.ScoreResult;
import com.weatherdecision.common.model.WarningTag;
import com.weatherdecision.common.model.WeatherField;
import com.weatherdecision.common.model.WeatherSample;
import com.weatherdecision.common.profile.ResolvedProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Evaluates one (sample, index) pair.
 *
 * <ul>
 *   <li>All required fields present → computed result, confidence 1.</li>
 *   <li>Fields missing, formula accepts partial inputs → computed with the formula's
 *       confidence; tagged degraded when that confidence is below 1.</li>
 *   <li>Fields missing otherwise, or the formula declines → value {@code null},
 *       confidence 0, degraded, missing fields listed.</li>
 * </ul>
 * A missing field never throws. Pure: no logging, no reactive types.
 */
public final class IndexEvaluator {

    private IndexEvaluator() {}

    public static ScoreResult evaluate(WeatherSample sample, IndexDefinition definition, ResolvedProfile profile) {
        Set<WeatherField> missing = sample.missingOf(definition.requiredFields());
        if (!missing.isEmpty() && !definition.partialInputs()) {
            return ScoreResult.degraded(sample.timestamp(), definition.id(), missing);
        }
        IndexOutput output = definition.formula().apply(sample, profile);
        if (output == null) {
            return ScoreResult.degraded(sample.timestamp(), definition.id(), missing);
        }
        double confidence = missing.isEmpty() ? 1.0 : output.confidence();
        WarningTag warning = confidence < 1.0 ? WarningTag.COMPUTATION_DEGRADED : null;
        return new ScoreResult(sample.timestamp(), definition.id(), output.value(), confidence,
            output.band(), output.details(), missing, warning);
    }

    /** Every pair, ordered by sample order then by definition order. Sequential reference path. */
    public static List<ScoreResult> evaluateAll(Iterable<WeatherSample> samples,
                                                List<IndexDefinition> definitions,
                                                ResolvedProfile profile) {
        List<ScoreResult> results = new ArrayList<>();
        for (WeatherSample sample : samples) {
            for (IndexDefinition definition : definitions) {
                results.add(evaluate(sample, definition, profile));
            }
        }
        return results;
    }
}
