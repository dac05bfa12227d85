package com.weatherdecision.common.catalog;

import com.weatherdecision.common.model.IndexId;
import com.weatherdecision.common.model.WeatherSample;
import com.weatherdecision.common.profile.ProfileDefaults;
import com.weatherdecision.common.profile.ProfileThreshold;
import com.weatherdecision.common.profile.ResolvedProfile;
import com.weatherdecision.common.profile.UserProfile;
import com.weatherdecision.common.profile.UserProfileResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ColdShockFormulaTest {

    private static final Instant TS = Instant.parse("2024-08-03T17:00:00Z");

    private final ColdShockFormula formula = new ColdShockFormula(CatalogParameters.ColdShock.defaults());
    private final UserProfileResolver resolver = new UserProfileResolver(ProfileDefaults.defaults());

    private ResolvedProfile profile(double sensitivity) {
        return resolver.resolve(new UserProfile("u", Map.of(), Map.of("coldshock.sensitivity", sensitivity)),
            List.of(IndexId.COLD_SHOCK));
    }

    @Nested
    @DisplayName("bands")
    class BandTests {

        @Test
        @DisplayName("12°C water, 20 km/h exit wind → high or severe")
        void coldWaterWindy() {
            for (double humidity : new double[] {0, 50, 70, 100}) {
                WeatherSample sample = WeatherSample.builder(TS)
                    .waterTemperature(12).windSpeed(20).relativeHumidity(humidity).build();
                String band = formula.apply(sample, profile(1.0)).band();
                assertTrue(Set.of("high", "severe").contains(band), "RH " + humidity + " → " + band);
            }
        }

        @Test
        @DisplayName("20°C water, 5 km/h → low")
        void mildWaterCalm() {
            for (double humidity : new double[] {0, 50, 100}) {
                WeatherSample sample = WeatherSample.builder(TS)
                    .waterTemperature(20).windSpeed(5).relativeHumidity(humidity).build();
                assertEquals("low", formula.apply(sample, profile(1.0)).band());
            }
        }

        @Test
        @DisplayName("sensitivity scales the risk")
        void sensitivity() {
            WeatherSample sample = WeatherSample.builder(TS).waterTemperature(20).windSpeed(5).relativeHumidity(70).build();
            double base = formula.apply(sample, profile(1.0)).value();
            double raised = formula.apply(sample, profile(1.25)).value();
            assertEquals(1.25 * base, raised, 1e-9);
        }

        @Test
        @DisplayName("lowest allowed sensitivity keeps cold, windy water high or severe")
        void lowestSensitivityStillHigh() {
            double lowest = ProfileThreshold.COLD_SHOCK_SENSITIVITY.min();
            for (double humidity : new double[] {0, 70, 100}) {
                WeatherSample sample = WeatherSample.builder(TS)
                    .waterTemperature(12).windSpeed(20).relativeHumidity(humidity).build();
                String band = formula.apply(sample, profile(lowest)).band();
                assertTrue(Set.of("high", "severe").contains(band), "RH " + humidity + " → " + band);
            }
        }

        @Test
        @DisplayName("highest allowed sensitivity keeps mild, calm water low")
        void highestSensitivityStillLow() {
            double highest = ProfileThreshold.COLD_SHOCK_SENSITIVITY.max();
            for (double humidity : new double[] {0, 70, 100}) {
                WeatherSample sample = WeatherSample.builder(TS)
                    .waterTemperature(20).windSpeed(5).relativeHumidity(humidity).build();
                assertEquals("low", formula.apply(sample, profile(highest)).band(), "RH " + humidity);
            }
        }
    }

    @Nested
    @DisplayName("minutes to discomfort")
    class MinutesTests {

        @Test
        @DisplayName("higher risk → fewer minutes")
        void decreasesWithRisk() {
            double mild = formula.apply(WeatherSample.builder(TS).waterTemperature(20).windSpeed(5).relativeHumidity(70).build(),
                profile(1.0)).details().get("minutesToDiscomfort");
            double harsh = formula.apply(WeatherSample.builder(TS).waterTemperature(12).windSpeed(20).relativeHumidity(70).build(),
                profile(1.0)).details().get("minutesToDiscomfort");
            assertTrue(harsh < mild);
            assertTrue(mild <= 60.0);
        }

        @Test
        @DisplayName("neutral water and no wind → full budget")
        void noRisk() {
            IndexOutput out = formula.apply(
                WeatherSample.builder(TS).waterTemperature(25).windSpeed(0).relativeHumidity(70).build(), profile(1.0));
            assertEquals(0.0, out.value());
            assertEquals(60.0, out.details().get("minutesToDiscomfort"), 1e-9);
        }
    }

    @Nested
    @DisplayName("partial inputs")
    class PartialTests {

        @Test
        @DisplayName("air temperature proxy lowers confidence")
        void airProxy() {
            IndexOutput out = formula.apply(
                WeatherSample.builder(TS).temperature(12).windSpeed(20).relativeHumidity(70).build(), profile(1.0));
            assertEquals(0.7, out.confidence(), 1e-9);
            assertEquals(1.0, out.details().get("airTemperatureProxy"));
        }

        @Test
        @DisplayName("missing humidity uses the reference value with reduced confidence")
        void missingHumidity() {
            IndexOutput withReference = formula.apply(
                WeatherSample.builder(TS).waterTemperature(12).windSpeed(20).build(), profile(1.0));
            IndexOutput explicit = formula.apply(
                WeatherSample.builder(TS).waterTemperature(12).windSpeed(20).relativeHumidity(70).build(), profile(1.0));
            assertEquals(explicit.value(), withReference.value(), 1e-9);
            assertEquals(0.9, withReference.confidence(), 1e-9);
        }

        @Test
        @DisplayName("missing wind → formula declines")
        void missingWind() {
            assertNull(formula.apply(WeatherSample.builder(TS).waterTemperature(12).build(), profile(1.0)));
        }
    }
}
