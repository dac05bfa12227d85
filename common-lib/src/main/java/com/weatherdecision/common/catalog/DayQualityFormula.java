package com.weatherdecision.common.catalog;

import com.weatherdecision.common.model.IndexId;
import com.weatherdecision.common.model.WeatherSample;
import com.weatherdecision.common.profile.ProfileMetric;
import com.weatherdecision.common.profile.ProfileThreshold;
import com.weatherdecision.common.profile.ResolvedProfile;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Personalized "good day" score.
 *
 * <p>Each metric gets a trapezoidal comfort sub-score whose optimal range comes from the
 * profile thresholds and whose fall-off width comes from {@link CatalogParameters.DayQuality}.
 * The score is the weighted mean of the present sub-scores:
 * <pre>
 *   score      = Σ(w_i × sub_i) / Σ w_i   over present metrics
 *   confidence = Σ w_i                    over present metrics (weights already sum to 1)
 * </pre>
 * Temperature must be present; without it the formula declines to compute.
 */
public final class DayQualityFormula implements IndexFormula {

    private final CatalogParameters.DayQuality params;

    public DayQualityFormula(CatalogParameters.DayQuality params) {
        this.params = params;
    }

    @Override
    public IndexOutput apply(WeatherSample sample, ResolvedProfile profile) {
        if (sample.temperature() == null) {
            return null;
        }
        Map<ProfileMetric, Double> weights = profile.weightsFor(IndexId.DAY_QUALITY);
        Map<String, Double> details = new LinkedHashMap<>();

        double weighted = 0.0;
        double presentWeight = 0.0;
        for (Map.Entry<ProfileMetric, Double> entry : weights.entrySet()) {
            ProfileMetric metric = entry.getKey();
            Double observed = sample.value(metric.field());
            if (observed == null) {
                continue;
            }
            double sub = curveFor(metric, profile).score(observed);
            details.put(metric.key() + "Score", sub);
            weighted += entry.getValue() * sub;
            presentWeight += entry.getValue();
        }
        if (presentWeight <= 0.0) {
            return null;
        }
        double score = IndexOutput.clampScore(weighted / presentWeight);
        double confidence = presentWeight >= 1.0 - 1e-9 ? 1.0 : presentWeight;
        details.put("presentWeight", confidence);
        return new IndexOutput(score, confidence, params.bands().bandFor(score).label(), details);
    }

    ComfortCurve curveFor(ProfileMetric metric, ResolvedProfile profile) {
        return switch (metric) {
            case TEMPERATURE -> {
                double lo = profile.threshold(ProfileThreshold.COMFORT_TEMP_MIN);
                double hi = profile.threshold(ProfileThreshold.COMFORT_TEMP_MAX);
                yield new ComfortCurve(lo - params.temperatureFalloff(), lo, hi, hi + params.temperatureFalloff());
            }
            case WIND -> ComfortCurve.upTo(profile.threshold(ProfileThreshold.COMFORT_WIND_MAX), params.windFalloff());
            case RAIN -> ComfortCurve.upTo(profile.threshold(ProfileThreshold.COMFORT_RAIN_MAX), params.rainFalloff());
            case FOG  -> ComfortCurve.upTo(profile.threshold(ProfileThreshold.COMFORT_FOG_MAX), params.fogFalloff());
            default -> throw new IllegalArgumentException("Not a day-quality metric: " + metric.key());
        };
    }
}
