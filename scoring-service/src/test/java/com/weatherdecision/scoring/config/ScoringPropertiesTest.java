package com.weatherdecision.scoring.config;

import com.weatherdecision.common.catalog.CatalogParameters;
import com.weatherdecision.common.catalog.IndexCatalog;
import com.weatherdecision.common.exception.ConfigurationException;
import com.weatherdecision.common.model.IndexId;
import com.weatherdecision.common.profile.ProfileMetric;
import com.weatherdecision.common.profile.ProfileThreshold;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScoringPropertiesTest {

    @Test
    @DisplayName("untouched properties reproduce the stock catalog parameters")
    void defaults() {
        assertEquals(CatalogParameters.defaults(), new ScoringProperties().toCatalogParameters());
    }

    @Test
    @DisplayName("profile fallbacks are keyed by public profile keys")
    void profileKeys() {
        ScoringProperties properties = new ScoringProperties();
        properties.getCatalog().getProfile().getWeights().put("wind", 0.5);
        properties.getCatalog().getProfile().getThresholds().put("comfort.wind.max", 20.0);

        CatalogParameters parameters = properties.toCatalogParameters();

        assertEquals(0.5, parameters.profileDefaults().weights().get(ProfileMetric.WIND));
        assertEquals(20.0, parameters.profileDefaults().thresholds().get(ProfileThreshold.COMFORT_WIND_MAX));
    }

    @Test
    @DisplayName("configured bands replace the default scale")
    void customBands() {
        ScoringProperties properties = new ScoringProperties();
        Map<String, Double> bands = new LinkedHashMap<>();
        bands.put("calm", 0.0);
        bands.put("rough", 50.0);
        properties.getCatalog().getColdShock().setBands(bands);

        IndexCatalog catalog = IndexCatalog.build(properties.toCatalogParameters());

        assertEquals(List.of("calm", "rough"), catalog.definition(IndexId.COLD_SHOCK).categories());
    }

    @Test
    @DisplayName("unknown profile key is a configuration error")
    void unknownKey() {
        ScoringProperties properties = new ScoringProperties();
        properties.getCatalog().getProfile().getWeights().put("humidity", 0.2);

        ConfigurationException ex = assertThrows(ConfigurationException.class, properties::toCatalogParameters);
        assertEquals("scoring.catalog.profile.weights.humidity", ex.getKey());
    }

    @Test
    @DisplayName("normalizer settings and engine parallelism")
    void engineAndNormalizer() {
        ScoringProperties properties = new ScoringProperties();
        properties.getNormalizer().setInterval(Duration.ofMinutes(30));
        properties.getEngine().setParallelism(3);

        assertEquals(Duration.ofMinutes(30), properties.toNormalizerSettings().interval());
        assertEquals(3, properties.getEngine().effectiveParallelism());
        properties.getEngine().setParallelism(0);
        assertTrue(properties.getEngine().effectiveParallelism() >= 1);
    }
}
