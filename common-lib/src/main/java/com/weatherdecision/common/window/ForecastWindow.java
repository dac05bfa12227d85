package com.weatherdecision.common.window;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.Objects;

/**
 * The forecast horizon a user asked for, relative to "now".
 *
 * @param startOffset   offset of the window start from now (may be negative to look back)
 * @param duration      window length, positive
 * @param granularity   bucket size, positive; must be at or coarser than the series interval
 * @param resampleMode  defaults to {@link ResampleMode#PICK_FIRST}
 */
public record ForecastWindow(
    @JsonProperty("startOffset") Duration startOffset,
    @JsonProperty("duration") Duration duration,
    @JsonProperty("granularity") Duration granularity,
    @JsonProperty("resampleMode") ResampleMode resampleMode
) {

    public ForecastWindow {
        startOffset = startOffset == null ? Duration.ZERO : startOffset;
        Objects.requireNonNull(duration, "duration");
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("Window duration must be positive, got " + duration);
        }
        granularity = granularity == null ? Duration.ofHours(1) : granularity;
        if (granularity.isZero() || granularity.isNegative()) {
            throw new IllegalArgumentException("Window granularity must be positive, got " + granularity);
        }
        resampleMode = resampleMode == null ? ResampleMode.PICK_FIRST : resampleMode;
    }

    /** Hourly window starting {@code startOffset} from now. */
    public static ForecastWindow of(Duration startOffset, Duration duration) {
        return new ForecastWindow(startOffset, duration, Duration.ofHours(1), ResampleMode.PICK_FIRST);
    }
}
