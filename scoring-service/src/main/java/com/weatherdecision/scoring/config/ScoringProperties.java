package com.weatherdecision.scoring.config;

import com.weatherdecision.common.catalog.BandScale;
import com.weatherdecision.common.catalog.CatalogParameters;
import com.weatherdecision.common.exception.ConfigurationException;
import com.weatherdecision.common.normalize.NormalizerSettings;
import com.weatherdecision.common.profile.ProfileDefaults;
import com.weatherdecision.common.profile.ProfileMetric;
import com.weatherdecision.common.profile.ProfileThreshold;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code scoring.*} block of {@code application.yml}.
 *
 * <p>Every field starts at the value of {@link CatalogParameters#defaults()}, so an empty
 * block yields the stock catalog. Profile keys containing dots must be bracketed in YAML,
 * e.g. {@code "[comfort.wind.max]": 20}.
 */
@Data
@ConfigurationProperties(prefix = "scoring")
public class ScoringProperties {

    private static final CatalogParameters DEFAULTS = CatalogParameters.defaults();

    private Engine engine = new Engine();
    private Normalizer normalizer = new Normalizer();
    private Catalog catalog = new Catalog();

    @Data
    public static class Engine {
        /** Worker threads for (timestamp, index) evaluation; 0 means one per core. */
        private int parallelism = 0;

        public int effectiveParallelism() {
            return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
        }
    }

    @Data
    public static class Normalizer {
        private Duration interval = NormalizerSettings.defaults().interval();
        private int maxGapIntervals = NormalizerSettings.defaults().maxGapIntervals();
    }

    @Data
    public static class Catalog {
        private DayQuality dayQuality = new DayQuality();
        private Clothing clothing = new Clothing();
        private ColdShock coldShock = new ColdShock();
        private Visibility visibility = new Visibility();
        private Profile profile = new Profile();
    }

    @Data
    public static class DayQuality {
        private double temperatureFalloff = DEFAULTS.dayQuality().temperatureFalloff();
        private double windFalloff = DEFAULTS.dayQuality().windFalloff();
        private double rainFalloff = DEFAULTS.dayQuality().rainFalloff();
        private double fogFalloff = DEFAULTS.dayQuality().fogFalloff();
        /** Label → lower bound; replaces the default scale as a whole when set. */
        private Map<String, Double> bands;
    }

    @Data
    public static class Clothing {
        private double windChillCoefficient = DEFAULTS.clothing().windChillCoefficient();
        private double calmWind = DEFAULTS.clothing().calmWind();
        private double wetThreshold = DEFAULTS.clothing().wetThreshold();
        private double windyThreshold = DEFAULTS.clothing().windyThreshold();
        private double insulatedBelow = DEFAULTS.clothing().insulatedBelow();
        private double waterproofBelow = DEFAULTS.clothing().waterproofBelow();
        private double windyWindproofBelow = DEFAULTS.clothing().windyWindproofBelow();
        private double windproofBelow = DEFAULTS.clothing().windproofBelow();
        private double lightLayerBelow = DEFAULTS.clothing().lightLayerBelow();
        private double exposureComfortTemperature = DEFAULTS.clothing().exposureComfortTemperature();
        private double exposureRange = DEFAULTS.clothing().exposureRange();
        private double wetExposurePenalty = DEFAULTS.clothing().wetExposurePenalty();
    }

    @Data
    public static class ColdShock {
        private double neutralTemperature = DEFAULTS.coldShock().neutralTemperature();
        private double temperatureCoefficient = DEFAULTS.coldShock().temperatureCoefficient();
        private double windCoefficient = DEFAULTS.coldShock().windCoefficient();
        private double humidityCoefficient = DEFAULTS.coldShock().humidityCoefficient();
        private double referenceHumidity = DEFAULTS.coldShock().referenceHumidity();
        private double airProxyConfidence = DEFAULTS.coldShock().airProxyConfidence();
        private double missingHumidityConfidence = DEFAULTS.coldShock().missingHumidityConfidence();
        private double maxMinutes = DEFAULTS.coldShock().maxMinutes();
        private double decayScale = DEFAULTS.coldShock().decayScale();
        /** Label → lower bound; replaces the default scale as a whole when set. */
        private Map<String, Double> bands;
    }

    @Data
    public static class Visibility {
        private double heavyPrecipitationRate = DEFAULTS.visibility().heavyPrecipitationRate();
        private double clearVisibilityMeters = DEFAULTS.visibility().clearVisibilityMeters();
        /** Label → lower bound; replaces the default scale as a whole when set. */
        private Map<String, Double> bands;
    }

    /** Catalog-level profile fallbacks, keyed by the public profile keys. */
    @Data
    public static class Profile {
        private Map<String, Double> weights = keyed(DEFAULTS.profileDefaults().weights());
        private Map<String, Double> thresholds = keyed(DEFAULTS.profileDefaults().thresholds());
    }

    // ── Conversion ────────────────────────────────────────────────────────────

    public NormalizerSettings toNormalizerSettings() {
        return new NormalizerSettings(normalizer.getInterval(), normalizer.getMaxGapIntervals());
    }

    /**
     * @throws ConfigurationException for an unknown profile key
     * @throws IllegalArgumentException for out-of-range coefficients or malformed bands
     */
    public CatalogParameters toCatalogParameters() {
        DayQuality dq = catalog.getDayQuality();
        Clothing cl = catalog.getClothing();
        ColdShock cs = catalog.getColdShock();
        Visibility vi = catalog.getVisibility();
        return new CatalogParameters(
            new CatalogParameters.DayQuality(dq.getTemperatureFalloff(), dq.getWindFalloff(),
                dq.getRainFalloff(), dq.getFogFalloff(), bandsOr(dq.getBands(), DEFAULTS.dayQuality().bands())),
            new CatalogParameters.Clothing(cl.getWindChillCoefficient(), cl.getCalmWind(),
                cl.getWetThreshold(), cl.getWindyThreshold(), cl.getInsulatedBelow(),
                cl.getWaterproofBelow(), cl.getWindyWindproofBelow(), cl.getWindproofBelow(),
                cl.getLightLayerBelow(), cl.getExposureComfortTemperature(), cl.getExposureRange(),
                cl.getWetExposurePenalty()),
            new CatalogParameters.ColdShock(cs.getNeutralTemperature(), cs.getTemperatureCoefficient(),
                cs.getWindCoefficient(), cs.getHumidityCoefficient(), cs.getReferenceHumidity(),
                cs.getAirProxyConfidence(), cs.getMissingHumidityConfidence(), cs.getMaxMinutes(),
                cs.getDecayScale(), bandsOr(cs.getBands(), DEFAULTS.coldShock().bands())),
            new CatalogParameters.Visibility(vi.getHeavyPrecipitationRate(), vi.getClearVisibilityMeters(),
                bandsOr(vi.getBands(), DEFAULTS.visibility().bands())),
            toProfileDefaults(catalog.getProfile()));
    }

    private static ProfileDefaults toProfileDefaults(Profile profile) {
        Map<ProfileMetric, Double> weights = new EnumMap<>(ProfileMetric.class);
        profile.getWeights().forEach((key, value) -> weights.put(
            ProfileMetric.fromKey(key).orElseThrow(() ->
                new ConfigurationException("scoring.catalog.profile.weights." + key, "Unknown weight key")),
            value));
        Map<ProfileThreshold, Double> thresholds = new EnumMap<>(ProfileThreshold.class);
        profile.getThresholds().forEach((key, value) -> thresholds.put(
            ProfileThreshold.fromKey(key).orElseThrow(() ->
                new ConfigurationException("scoring.catalog.profile.thresholds." + key, "Unknown threshold key")),
            value));
        return new ProfileDefaults(weights, thresholds);
    }

    private static BandScale bandsOr(Map<String, Double> configured, BandScale fallback) {
        return configured == null || configured.isEmpty() ? fallback : BandScale.of(configured);
    }

    private static Map<String, Double> keyed(Map<? extends Enum<?>, Double> source) {
        Map<String, Double> keyed = new LinkedHashMap<>();
        source.forEach((k, v) -> keyed.put(
            k instanceof ProfileMetric m ? m.key() : ((ProfileThreshold) k).key(), v));
        return keyed;
    }
}
