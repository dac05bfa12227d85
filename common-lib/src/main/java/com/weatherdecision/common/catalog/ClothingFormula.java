package com.weatherdecision.common.catalog;

import com.weatherdecision.common.model.WeatherSample;
import com.weatherdecision.common.profile.ProfileThreshold;
import com.weatherdecision.common.profile.ResolvedProfile;

import java.util.List;
import java.util.Map;

/**
 * Clothing recommendation.
 *
 * <pre>
 *   effective = T − windChillCoefficient × max(0, wind − calmWind) + warmthOffset
 *   wet       = precipitation ≥ wetThreshold
 *   windy     = wind ≥ windyThreshold
 *   exposure  = clamp((exposureComfortTemperature − effective) / exposureRange × 100 + wetPenalty)
 * </pre>
 *
 * <p>The rules are listed heaviest layer first and every guard is "effective temperature
 * below a cut-off" plus a fixed flag, so lowering the temperature with wind and
 * precipitation held constant can only keep or raise the chosen layer.
 */
public final class ClothingFormula implements IndexFormula {

    private final CatalogParameters.Clothing params;
    private final List<ClothingRule> rules;

    public ClothingFormula(CatalogParameters.Clothing params) {
        this.params = params;
        this.rules = List.of(
            new ClothingRule("freezing", ClothingLayer.INSULATED,
                c -> c.effectiveTemperature() < params.insulatedBelow()),
            new ClothingRule("wet", ClothingLayer.WATERPROOF,
                c -> c.wet() && c.effectiveTemperature() < params.waterproofBelow()),
            new ClothingRule("windy-cool", ClothingLayer.WINDPROOF,
                c -> c.windy() && c.effectiveTemperature() < params.windyWindproofBelow()),
            new ClothingRule("cool", ClothingLayer.WINDPROOF,
                c -> c.effectiveTemperature() < params.windproofBelow()),
            new ClothingRule("mild", ClothingLayer.LIGHT_LAYER,
                c -> c.effectiveTemperature() < params.lightLayerBelow()),
            new ClothingRule("warm", ClothingLayer.NONE, c -> true));
    }

    public List<ClothingRule> rules() {
        return rules;
    }

    public ClothingConditions conditions(double temperature, double windSpeed,
                                         double precipitationRate, double warmthOffset) {
        double effective = temperature
            - params.windChillCoefficient() * Math.max(0.0, windSpeed - params.calmWind())
            + warmthOffset;
        return new ClothingConditions(temperature, effective, windSpeed, precipitationRate,
            precipitationRate >= params.wetThreshold(),
            windSpeed >= params.windyThreshold());
    }

    /** First matching rule; the catch-all last rule guarantees a match. */
    public ClothingRule match(ClothingConditions conditions) {
        for (ClothingRule rule : rules) {
            if (rule.matches(conditions)) {
                return rule;
            }
        }
        throw new IllegalStateException("No clothing rule matched " + conditions);
    }

    @Override
    public IndexOutput apply(WeatherSample sample, ResolvedProfile profile) {
        ClothingConditions c = conditions(
            sample.temperature(), sample.windSpeed(), sample.precipitationRate(),
            profile.threshold(ProfileThreshold.CLOTHING_WARMTH_OFFSET));
        ClothingRule rule = match(c);
        double exposure = IndexOutput.clampScore(
            (params.exposureComfortTemperature() - c.effectiveTemperature()) / params.exposureRange() * 100.0
                + (c.wet() ? params.wetExposurePenalty() : 0.0));
        return new IndexOutput(exposure, 1.0, rule.layer().label(), Map.of(
            "effectiveTemperature", c.effectiveTemperature(),
            "exposureScore", exposure,
            "rank", (double) rule.layer().ordinal()));
    }
}
