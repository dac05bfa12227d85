package com.weatherdecision.common.catalog;

import com.weatherdecision.common.model.IndexId;
import com.weatherdecision.common.model.WeatherSample;
import com.weatherdecision.common.profile.ProfileMetric;
import com.weatherdecision.common.profile.ResolvedProfile;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maritime visibility quality.
 *
 * <pre>
 *   obstruction = w_fog × fog + w_rain × min(1, rate / heavyRate) + w_cloud × cloud / 100
 *   obstruction = max(obstruction, 1 − min(1, visibility / clearVisibility))   when visibility is known
 *   score       = 100 × (1 − obstruction)
 * </pre>
 */
public final class MaritimeVisibilityFormula implements IndexFormula {

    private final CatalogParameters.Visibility params;

    public MaritimeVisibilityFormula(CatalogParameters.Visibility params) {
        this.params = params;
    }

    @Override
    public IndexOutput apply(WeatherSample sample, ResolvedProfile profile) {
        Map<ProfileMetric, Double> weights = profile.weightsFor(IndexId.MARITIME_VISIBILITY);
        double fog = sample.fogDensity();
        double rain = Math.min(1.0, sample.precipitationRate() / params.heavyPrecipitationRate());
        double cloud = sample.cloudCoverPercent() / 100.0;

        double obstruction = weights.getOrDefault(ProfileMetric.VISIBILITY_FOG, 0.0) * fog
            + weights.getOrDefault(ProfileMetric.VISIBILITY_RAIN, 0.0) * rain
            + weights.getOrDefault(ProfileMetric.VISIBILITY_CLOUD, 0.0) * cloud;

        Map<String, Double> details = new LinkedHashMap<>();
        if (sample.visibilityMeters() != null) {
            double measured = 1.0 - Math.min(1.0, sample.visibilityMeters() / params.clearVisibilityMeters());
            obstruction = Math.max(obstruction, measured);
            details.put("visibilityMeters", sample.visibilityMeters());
        }
        obstruction = Math.max(0.0, Math.min(1.0, obstruction));
        double score = IndexOutput.clampScore(100.0 * (1.0 - obstruction));
        details.put("obstruction", obstruction);
        return new IndexOutput(score, 1.0, params.bands().bandFor(score).label(), details);
    }
}
