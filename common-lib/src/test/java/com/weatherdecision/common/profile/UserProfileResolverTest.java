package com.weatherdecision.common.profile;

import com.weatherdecision.common.exception.ConfigurationException;
import com.weatherdecision.common.model.IndexId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UserProfileResolverTest {

    private static final Map<String, Double> COMFORT = Map.of("comfort.temp.min", 15.0, "comfort.temp.max", 25.0);

    private final UserProfileResolver resolver = new UserProfileResolver(ProfileDefaults.defaults());

    private static UserProfile profile(Map<String, Double> weights, Map<String, Double> thresholds) {
        return new UserProfile("u-1", weights, thresholds);
    }

    // ── Weights ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("weights")
    class WeightTests {

        @Test
        @DisplayName("supplied weights are normalized to sum 1, unspecified ones count as 0")
        void normalizedSuppliedWeights() {
            ResolvedProfile resolved = resolver.resolve(
                profile(Map.of("temp", 0.5, "wind", 0.3, "rain", 0.2), COMFORT), List.of(IndexId.DAY_QUALITY));

            Map<ProfileMetric, Double> w = resolved.weightsFor(IndexId.DAY_QUALITY);
            assertEquals(0.5, w.get(ProfileMetric.TEMPERATURE), 1e-9);
            assertEquals(0.0, w.get(ProfileMetric.FOG), 1e-9);
            assertEquals(1.0, w.values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);
        }

        @Test
        @DisplayName("non-unit sums are rescaled")
        void rescaled() {
            ResolvedProfile resolved = resolver.resolve(
                profile(Map.of("temp", 0.2, "wind", 0.2), COMFORT), List.of(IndexId.DAY_QUALITY));

            assertEquals(0.5, resolved.weight(ProfileMetric.TEMPERATURE), 1e-9);
            assertEquals(0.5, resolved.weight(ProfileMetric.WIND), 1e-9);
        }

        @Test
        @DisplayName("no weights for an index → catalog defaults")
        void defaultsApply() {
            ResolvedProfile resolved = resolver.resolve(
                profile(Map.of("temp", 1.0), Map.of()), List.of(IndexId.MARITIME_VISIBILITY));

            assertEquals(0.6, resolved.weight(ProfileMetric.VISIBILITY_FOG), 1e-9);
            assertEquals(0.15, resolved.weight(ProfileMetric.VISIBILITY_CLOUD), 1e-9);
        }

        @Test
        @DisplayName("weight -0.1 → ConfigurationException naming the key")
        void negativeWeight() {
            ConfigurationException ex = assertThrows(ConfigurationException.class, () ->
                resolver.resolve(profile(Map.of("temp", -0.1), COMFORT), List.of(IndexId.DAY_QUALITY)));
            assertEquals("temp", ex.getKey());
        }

        @Test
        @DisplayName("negative weight of a non-requested index is still rejected")
        void negativeWeightOtherIndex() {
            assertThrows(ConfigurationException.class, () ->
                resolver.resolve(profile(Map.of("visibility.fog", -0.1), COMFORT), List.of(IndexId.DAY_QUALITY)));
        }

        @Test
        @DisplayName("weight above 1 and NaN are rejected")
        void outOfRangeWeights() {
            assertThrows(ConfigurationException.class, () ->
                resolver.resolve(profile(Map.of("wind", 1.5), COMFORT), List.of(IndexId.DAY_QUALITY)));
            assertThrows(ConfigurationException.class, () ->
                resolver.resolve(profile(Map.of("wind", Double.NaN), COMFORT), List.of(IndexId.DAY_QUALITY)));
        }

        @Test
        @DisplayName("unknown weight key is rejected")
        void unknownKey() {
            ConfigurationException ex = assertThrows(ConfigurationException.class, () ->
                resolver.resolve(profile(Map.of("humidity", 0.4), COMFORT), List.of(IndexId.DAY_QUALITY)));
            assertEquals("humidity", ex.getKey());
        }

        @Test
        @DisplayName("all weights of a requested index zero → rejected")
        void allZero() {
            ConfigurationException ex = assertThrows(ConfigurationException.class, () ->
                resolver.resolve(profile(Map.of("temp", 0.0, "wind", 0.0), COMFORT), List.of(IndexId.DAY_QUALITY)));
            assertEquals("day-quality", ex.getKey());
        }
    }

    // ── Thresholds ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("thresholds")
    class ThresholdTests {

        @Test
        @DisplayName("day-quality without comfort temperature range → rejected")
        void requiredThresholdMissing() {
            ConfigurationException ex = assertThrows(ConfigurationException.class, () ->
                resolver.resolve(profile(Map.of(), Map.of()), List.of(IndexId.DAY_QUALITY)));
            assertTrue(ex.getKey().startsWith("comfort.temp"));
        }

        @Test
        @DisplayName("comfort range is not needed when day-quality is not requested")
        void requiredOnlyForRequestedIndex() {
            ResolvedProfile resolved = resolver.resolve(profile(Map.of(), Map.of()), List.of(IndexId.COLD_SHOCK));
            assertEquals(1.0, resolved.threshold(ProfileThreshold.COLD_SHOCK_SENSITIVITY));
        }

        @Test
        @DisplayName("empty index list means all indices")
        void emptyMeansAll() {
            assertThrows(ConfigurationException.class, () ->
                resolver.resolve(profile(Map.of(), Map.of()), List.of()));
            ResolvedProfile resolved = resolver.resolve(profile(Map.of(), COMFORT), List.of());
            assertFalse(resolved.weightsFor(IndexId.DAY_QUALITY).isEmpty());
            assertFalse(resolved.weightsFor(IndexId.MARITIME_VISIBILITY).isEmpty());
        }

        @Test
        @DisplayName("min above max → rejected")
        void minAboveMax() {
            assertThrows(ConfigurationException.class, () ->
                resolver.resolve(profile(Map.of(), Map.of("comfort.temp.min", 26.0, "comfort.temp.max", 20.0)),
                    List.of(IndexId.DAY_QUALITY)));
        }

        @Test
        @DisplayName("threshold outside its documented range → rejected")
        void outOfRange() {
            ConfigurationException ex = assertThrows(ConfigurationException.class, () ->
                resolver.resolve(profile(Map.of(), Map.of("coldshock.sensitivity", 3.0)), List.of(IndexId.COLD_SHOCK)));
            assertEquals("coldshock.sensitivity", ex.getKey());
        }

        @Test
        @DisplayName("user threshold overrides the default")
        void override() {
            ResolvedProfile resolved = resolver.resolve(
                profile(Map.of(), Map.of("clothing.warmth.offset", -2.0)), List.of(IndexId.CLOTHING));
            assertEquals(-2.0, resolved.threshold(ProfileThreshold.CLOTHING_WARMTH_OFFSET));
        }
    }

    // ── Validate ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("validate")
    class ValidateTests {

        @Test
        @DisplayName("accepts a profile without the comfort range")
        void noRequiredThresholds() {
            assertDoesNotThrow(() -> resolver.validate(profile(Map.of("wind", 0.4), Map.of())));
        }

        @Test
        @DisplayName("rejects unknown keys and out-of-range values")
        void keyAndRangeChecks() {
            assertEquals("humidity", assertThrows(ConfigurationException.class, () ->
                resolver.validate(profile(Map.of("humidity", 0.3), Map.of()))).getKey());
            assertEquals("rain", assertThrows(ConfigurationException.class, () ->
                resolver.validate(profile(Map.of("rain", 1.5), Map.of()))).getKey());
            assertEquals("coldshock.sensitivity", assertThrows(ConfigurationException.class, () ->
                resolver.validate(profile(Map.of(), Map.of("coldshock.sensitivity", 3.0)))).getKey());
        }
    }

    @Test
    @DisplayName("resolved profile is immutable")
    void immutable() {
        ResolvedProfile resolved = resolver.resolve(profile(Map.of(), COMFORT), List.of(IndexId.DAY_QUALITY));
        assertThrows(UnsupportedOperationException.class, () ->
            resolved.weightsFor(IndexId.DAY_QUALITY).put(ProfileMetric.FOG, 1.0));
        assertThrows(UnsupportedOperationException.class, () ->
            resolved.thresholds().put(ProfileThreshold.COMFORT_FOG_MAX, 0.5));
    }
}
