package com.weatherdecision.common.normalize;

import java.time.Duration;
import java.util.Objects;

/**
 * @param interval        grid spacing of the normalized series
 * @param maxGapIntervals longest run of consecutive missing grid slots that is still
 *                        filled by interpolation
 */
public record NormalizerSettings(Duration interval, int maxGapIntervals) {

    public static final Duration DEFAULT_INTERVAL = Duration.ofHours(1);
    public static final int DEFAULT_MAX_GAP_INTERVALS = 3;

    public NormalizerSettings {
        Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Normalizer interval must be positive, got " + interval);
        }
        if (maxGapIntervals < 0) {
            throw new IllegalArgumentException("maxGapIntervals must be >= 0, got " + maxGapIntervals);
        }
    }

    public static NormalizerSettings defaults() {
        return new NormalizerSettings(DEFAULT_INTERVAL, DEFAULT_MAX_GAP_INTERVALS);
    }
}
