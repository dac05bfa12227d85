package com.weatherdecision.common.normalize;

import com.weatherdecision.common.exception.ValidationException;
import com.weatherdecision.common.model.NormalizedSeries;
import com.weatherdecision.common.model.WeatherField;
import com.weatherdecision.common.model.WeatherSample;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aligns raw, possibly irregular samples to a fixed, epoch-aligned grid.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Validate every sample ({@link SampleValidator}); the first violation aborts with
 *       a {@link ValidationException}.</li>
 *   <li>De-duplicate by timestamp, last write in input order wins.</li>
 *   <li>Grid runs from the earliest to the latest timestamp, each rounded to the nearest
 *       multiple of the interval.</li>
 *   <li>Per field, every sample is snapped onto its nearest slot (at most half an interval
 *       away). When several samples land on one slot the nearest wins; on a tie the later
 *       timestamp wins.</li>
 *   <li>Slots without a snapped value are linearly interpolated between the nearest snapped
 *       neighbours when those are at most {@code maxGap + 1} slots apart (wind direction
 *       along the shortest arc); otherwise the field stays missing.</li>
 * </ol>
 *
 * <p>Re-normalizing a normalized series with the same interval returns an equal series:
 * every value then sits exactly on its slot, and the gaps left missing are measured
 * between the same slots on both passes.
 *
 * <p>Stateless and thread-safe. No logging.
 */
public final class TimeSeriesNormalizer {

    private final NormalizerSettings settings;
    private final long intervalMillis;
    private final long maxSpanMillis;

    public TimeSeriesNormalizer(NormalizerSettings settings) {
        this.settings       = settings;
        this.intervalMillis = settings.interval().toMillis();
        this.maxSpanMillis  = (settings.maxGapIntervals() + 1L) * intervalMillis;
    }

    public TimeSeriesNormalizer() {
        this(NormalizerSettings.defaults());
    }

    public Duration interval() {
        return settings.interval();
    }

    public NormalizedSeries normalize(NormalizedSeries series) {
        return normalize(series.samples());
    }

    public NormalizedSeries normalize(Collection<WeatherSample> raw) {
        if (raw == null || raw.isEmpty()) {
            return NormalizedSeries.empty(settings.interval());
        }

        TreeMap<Instant, WeatherSample> byTimestamp = new TreeMap<>();
        for (WeatherSample sample : raw) {
            SampleValidator.validate(sample);
            byTimestamp.put(sample.timestamp(), sample);
        }

        Map<WeatherField, FieldTrack> tracks = new EnumMap<>(WeatherField.class);
        for (WeatherField field : WeatherField.values()) {
            tracks.put(field, track(field, byTimestamp.values()));
        }

        long first = roundToGrid(byTimestamp.firstKey().toEpochMilli());
        long last  = roundToGrid(byTimestamp.lastKey().toEpochMilli());

        List<WeatherSample> out = new ArrayList<>();
        for (long slot = first; slot <= last; slot += intervalMillis) {
            Map<WeatherField, Double> values = new EnumMap<>(WeatherField.class);
            for (Map.Entry<WeatherField, FieldTrack> entry : tracks.entrySet()) {
                Double v = resolve(entry.getKey(), entry.getValue(), slot);
                if (v != null) {
                    values.put(entry.getKey(), v);
                }
            }
            out.add(WeatherSample.of(Instant.ofEpochMilli(slot), values));
        }
        return new NormalizedSeries(settings.interval(), out);
    }

    // ── per-slot resolution ─────────────────────────────────────────────────

    private Double resolve(WeatherField field, FieldTrack track, long slot) {
        if (track.size == 0) {
            return null;
        }
        int idx = Arrays.binarySearch(track.slots, 0, track.size, slot);
        if (idx >= 0) {
            return track.values[idx];
        }
        int after  = -idx - 1;
        int before = after - 1;
        if (before < 0 || after >= track.size || track.slots[after] - track.slots[before] > maxSpanMillis) {
            return null;
        }
        double fraction = (double) (slot - track.slots[before])
            / (double) (track.slots[after] - track.slots[before]);
        return field == WeatherField.WIND_DIRECTION
            ? interpolateBearing(track.values[before], track.values[after], fraction)
            : track.values[before] + (track.values[after] - track.values[before]) * fraction;
    }

    static double interpolateBearing(double from, double to, double fraction) {
        double delta = ((to - from + 540.0) % 360.0) - 180.0;
        double v = (from + delta * fraction) % 360.0;
        return v < 0 ? v + 360.0 : v;
    }

    private long roundToGrid(long epochMillis) {
        return Math.floorDiv(epochMillis + intervalMillis / 2, intervalMillis) * intervalMillis;
    }

    /** Snapped slots and values of the samples that carry one field, ascending by slot. */
    private static final class FieldTrack {
        final long[]   slots;
        final double[] values;
        final int      size;

        private FieldTrack(long[] slots, double[] values, int size) {
            this.slots  = slots;
            this.values = values;
            this.size   = size;
        }
    }

    private FieldTrack track(WeatherField field, Collection<WeatherSample> ordered) {
        long[]   slots    = new long[ordered.size()];
        double[] values   = new double[ordered.size()];
        long[]   distance = new long[ordered.size()];
        int n = 0;
        for (WeatherSample sample : ordered) {
            Double v = sample.value(field);
            if (v == null) {
                continue;
            }
            long time = sample.timestamp().toEpochMilli();
            long slot = roundToGrid(time);
            long dist = Math.abs(time - slot);
            if (n > 0 && slots[n - 1] == slot) {
                if (dist <= distance[n - 1]) {
                    values[n - 1]   = v;
                    distance[n - 1] = dist;
                }
                continue;
            }
            slots[n]    = slot;
            values[n]   = v;
            distance[n] = dist;
            n++;
        }
        return new FieldTrack(slots, values, n);
    }
}
