package com.weatherdecision.common.catalog;

import com.weatherdecision.common.profile.ProfileDefaults;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative inputs of {@link IndexCatalog#build}. Every coefficient, fall-off and band
 * boundary used by the formulas lives here; the formulas themselves hold no literals.
 */
public record CatalogParameters(
    DayQuality dayQuality,
    Clothing clothing,
    ColdShock coldShock,
    Visibility visibility,
    ProfileDefaults profileDefaults
) {

    public CatalogParameters {
        Objects.requireNonNull(dayQuality, "dayQuality");
        Objects.requireNonNull(clothing, "clothing");
        Objects.requireNonNull(coldShock, "coldShock");
        Objects.requireNonNull(visibility, "visibility");
        Objects.requireNonNull(profileDefaults, "profileDefaults");
    }

    public static CatalogParameters defaults() {
        return new CatalogParameters(
            DayQuality.defaults(), Clothing.defaults(), ColdShock.defaults(),
            Visibility.defaults(), ProfileDefaults.defaults());
    }

    /**
     * Fall-off widths: distance past the comfortable limit at which a sub-score reaches 0.
     */
    public record DayQuality(
        double temperatureFalloff,
        double windFalloff,
        double rainFalloff,
        double fogFalloff,
        BandScale bands
    ) {
        public DayQuality {
            requirePositive("temperatureFalloff", temperatureFalloff);
            requirePositive("windFalloff", windFalloff);
            requirePositive("rainFalloff", rainFalloff);
            requirePositive("fogFalloff", fogFalloff);
            Objects.requireNonNull(bands, "bands");
        }

        public static DayQuality defaults() {
            return new DayQuality(12.0, 35.0, 5.0, 0.6,
                bandScale("poor", 0.0, "fair", 40.0, "good", 60.0, "excellent", 80.0));
        }
    }

    /**
     * Effective temperature, wet/windy flags and rule cut-offs (all °C, km/h, mm/h).
     */
    public record Clothing(
        double windChillCoefficient,
        double calmWind,
        double wetThreshold,
        double windyThreshold,
        double insulatedBelow,
        double waterproofBelow,
        double windyWindproofBelow,
        double windproofBelow,
        double lightLayerBelow,
        double exposureComfortTemperature,
        double exposureRange,
        double wetExposurePenalty
    ) {
        public Clothing {
            requireNonNegative("windChillCoefficient", windChillCoefficient);
            requireNonNegative("calmWind", calmWind);
            requireNonNegative("wetThreshold", wetThreshold);
            requireNonNegative("windyThreshold", windyThreshold);
            requirePositive("exposureRange", exposureRange);
            requireNonNegative("wetExposurePenalty", wetExposurePenalty);
        }

        public static Clothing defaults() {
            return new Clothing(0.2, 5.0, 0.5, 25.0,
                5.0, 24.0, 18.0, 15.0, 21.0,
                24.0, 40.0, 10.0);
        }
    }

    public record ColdShock(
        double neutralTemperature,
        double temperatureCoefficient,
        double windCoefficient,
        double humidityCoefficient,
        double referenceHumidity,
        double airProxyConfidence,
        double missingHumidityConfidence,
        double maxMinutes,
        double decayScale,
        BandScale bands
    ) {
        public ColdShock {
            requireNonNegative("temperatureCoefficient", temperatureCoefficient);
            requireNonNegative("windCoefficient", windCoefficient);
            requireNonNegative("humidityCoefficient", humidityCoefficient);
            if (!(referenceHumidity >= 0.0 && referenceHumidity <= 100.0)) {
                throw new IllegalArgumentException("referenceHumidity must be within [0,100]: " + referenceHumidity);
            }
            requireFraction("airProxyConfidence", airProxyConfidence);
            requireFraction("missingHumidityConfidence", missingHumidityConfidence);
            requirePositive("maxMinutes", maxMinutes);
            requirePositive("decayScale", decayScale);
            Objects.requireNonNull(bands, "bands");
        }

        public static ColdShock defaults() {
            return new ColdShock(22.0, 5.0, 1.2, 0.5, 70.0, 0.7, 0.9, 60.0, 35.0,
                bandScale("low", 0.0, "moderate", 25.0, "high", 50.0, "severe", 75.0));
        }
    }

    public record Visibility(
        double heavyPrecipitationRate,
        double clearVisibilityMeters,
        BandScale bands
    ) {
        public Visibility {
            requirePositive("heavyPrecipitationRate", heavyPrecipitationRate);
            requirePositive("clearVisibilityMeters", clearVisibilityMeters);
            Objects.requireNonNull(bands, "bands");
        }

        public static Visibility defaults() {
            return new Visibility(8.0, 10_000.0,
                bandScale("hazardous", 0.0, "poor", 25.0, "reduced", 50.0, "clear", 75.0));
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static BandScale bandScale(Object... labelsAndBounds) {
        Map<String, Double> bounds = new LinkedHashMap<>();
        for (int i = 0; i < labelsAndBounds.length; i += 2) {
            bounds.put((String) labelsAndBounds[i], (Double) labelsAndBounds[i + 1]);
        }
        return BandScale.of(bounds);
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
    }

    private static void requireFraction(String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be within [0,1]: " + value);
        }
    }
}
