package com.weatherdecision.common.window;

import com.weatherdecision.common.model.DataCoverageWarning;
import com.weatherdecision.common.model.NormalizedSeries;

import java.time.Instant;

/**
 * Extracts the requested forecast horizon from a normalized series.
 *
 * <p>A window reaching beyond the stored coverage is not an error: the selection holds
 * whatever overlaps (possibly nothing) and carries a {@link DataCoverageWarning}.
 *
 * <p>Pure and stateless.
 */
public final class WindowSelector {

    private WindowSelector() {}

    /**
     * @param now reference instant the window offset is measured from
     * @throws IllegalArgumentException when the window granularity is finer than the series interval
     */
    public static WindowSelection select(NormalizedSeries series, ForecastWindow window, Instant now) {
        if (window.granularity().compareTo(series.interval()) < 0) {
            throw new IllegalArgumentException(String.format(
                "Window granularity %s is finer than series interval %s",
                window.granularity(), series.interval()));
        }
        Instant from = now.plus(window.startOffset());
        Instant to   = from.plus(window.duration());

        DataCoverageWarning warning = null;
        if (series.isEmpty()) {
            warning = DataCoverageWarning.of(from, to, null, null);
        } else if (from.isBefore(series.start()) || to.isAfter(series.coverageEnd())) {
            warning = DataCoverageWarning.of(from, to, series.start(), series.coverageEnd());
        }

        return new WindowSelection(series, from, to, window.granularity(), window.resampleMode(), warning);
    }
}
