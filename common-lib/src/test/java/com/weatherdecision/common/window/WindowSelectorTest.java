package com.weatherdecision.common.window;

import com.weatherdecision.common.model.NormalizedSeries;
import com.weatherdecision.common.model.WeatherSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WindowSelectorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    /** 24 hourly samples starting at NOW; temperature = hour index. */
    private static NormalizedSeries hourlyDay() {
        List<WeatherSample> samples = new ArrayList<>();
        for (int h = 0; h < 24; h++) {
            samples.add(WeatherSample.builder(NOW.plus(Duration.ofHours(h)))
                .temperature(h).windDirection(h % 2 == 0 ? 350 : 10).build());
        }
        return new NormalizedSeries(Duration.ofHours(1), samples);
    }

    @Nested
    @DisplayName("coverage")
    class CoverageTests {

        @Test
        @DisplayName("window inside coverage → samples, no warning")
        void insideCoverage() {
            WindowSelection selection = WindowSelector.select(hourlyDay(),
                ForecastWindow.of(Duration.ofHours(2), Duration.ofHours(3)), NOW);

            List<WeatherSample> samples = selection.toList();
            assertEquals(3, samples.size());
            assertEquals(2.0, samples.get(0).temperature());
            assertTrue(selection.coverageWarning().isEmpty());
        }

        @Test
        @DisplayName("window entirely beyond coverage → empty + warning, no exception")
        void beyondCoverage() {
            WindowSelection selection = WindowSelector.select(hourlyDay(),
                ForecastWindow.of(Duration.ofDays(3), Duration.ofHours(6)), NOW);

            assertTrue(selection.toList().isEmpty());
            assertTrue(selection.coverageWarning().isPresent());
            assertEquals("Requested window lies entirely outside stored data",
                selection.coverageWarning().get().message());
        }

        @Test
        @DisplayName("window partially beyond coverage → overlap + warning")
        void partialCoverage() {
            WindowSelection selection = WindowSelector.select(hourlyDay(),
                ForecastWindow.of(Duration.ofHours(20), Duration.ofHours(10)), NOW);

            assertEquals(4, selection.toList().size());
            assertEquals(NOW.plus(Duration.ofHours(24)), selection.coverageWarning().get().coveredTo());
        }

        @Test
        @DisplayName("empty series → warning without covered range")
        void emptySeries() {
            WindowSelection selection = WindowSelector.select(NormalizedSeries.empty(Duration.ofHours(1)),
                ForecastWindow.of(Duration.ZERO, Duration.ofHours(6)), NOW);

            assertFalse(selection.iterator().hasNext());
            assertNull(selection.coverageWarning().get().coveredFrom());
        }
    }

    @Nested
    @DisplayName("resampling")
    class ResampleTests {

        @Test
        @DisplayName("granularity finer than series interval → IllegalArgumentException")
        void granularityTooFine() {
            ForecastWindow window = new ForecastWindow(Duration.ZERO, Duration.ofHours(6),
                Duration.ofMinutes(30), ResampleMode.PICK_FIRST);
            assertThrows(IllegalArgumentException.class, () -> WindowSelector.select(hourlyDay(), window, NOW));
        }

        @Test
        @DisplayName("PICK_FIRST keeps the first sample of each bucket")
        void pickFirst() {
            ForecastWindow window = new ForecastWindow(Duration.ZERO, Duration.ofHours(6),
                Duration.ofHours(3), ResampleMode.PICK_FIRST);
            List<WeatherSample> samples = WindowSelector.select(hourlyDay(), window, NOW).toList();

            assertEquals(2, samples.size());
            assertEquals(0.0, samples.get(0).temperature());
            assertEquals(3.0, samples.get(1).temperature());
            assertEquals(NOW.plus(Duration.ofHours(3)), samples.get(1).timestamp());
        }

        @Test
        @DisplayName("PICK_FIRST with an off-grid start never reaches back before the bucket")
        void pickFirstOffGrid() {
            ForecastWindow window = new ForecastWindow(Duration.ofMinutes(10), Duration.ofHours(4),
                Duration.ofHours(2), ResampleMode.PICK_FIRST);
            List<WeatherSample> samples = WindowSelector.select(hourlyDay(), window, NOW).toList();

            // buckets [00:10, 02:10) and [02:10, 04:10); 02:00 sits closer to the second start but outside it
            assertEquals(2, samples.size());
            assertEquals(NOW.plus(Duration.ofHours(1)), samples.get(0).timestamp());
            assertEquals(NOW.plus(Duration.ofHours(3)), samples.get(1).timestamp());
            assertEquals(3.0, samples.get(1).temperature());
        }

        @Test
        @DisplayName("AVERAGE takes per-field mean and circular mean of direction")
        void average() {
            ForecastWindow window = new ForecastWindow(Duration.ZERO, Duration.ofHours(4),
                Duration.ofHours(2), ResampleMode.AVERAGE);
            List<WeatherSample> samples = WindowSelector.select(hourlyDay(), window, NOW).toList();

            assertEquals(2, samples.size());
            assertEquals(0.5, samples.get(0).temperature(), 1e-9);
            double direction = samples.get(0).windDirection();
            assertTrue(direction < 1e-6 || direction > 360.0 - 1e-6, "mean of 350° and 10° is north, got " + direction);
            assertEquals(NOW.plus(Duration.ofHours(2)), samples.get(1).timestamp());
        }

        @Test
        @DisplayName("selection is restartable")
        void restartable() {
            WindowSelection selection = WindowSelector.select(hourlyDay(),
                ForecastWindow.of(Duration.ZERO, Duration.ofHours(5)), NOW);

            assertEquals(selection.toList(), selection.toList());
            assertEquals(5, selection.stream().count());
        }
    }
}
