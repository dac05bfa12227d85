package com.weatherdecision.common.window;

import com.weatherdecision.common.model.DataCoverageWarning;
import com.weatherdecision.common.model.NormalizedSeries;
import com.weatherdecision.common.model.WeatherField;
import com.weatherdecision.common.model.WeatherSample;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, restartable view of the samples inside {@code [from, to)}, resampled to the
 * window granularity.
 *
 * <p>Nothing is computed until iteration; every call to {@link #iterator()} starts a
 * fresh pass over the (immutable) source series. Empty buckets are skipped.
 */
public final class WindowSelection implements Iterable<WeatherSample> {

    private final NormalizedSeries series;
    private final Instant from;
    private final Instant to;
    private final Duration granularity;
    private final ResampleMode mode;
    private final DataCoverageWarning coverageWarning;

    WindowSelection(NormalizedSeries series, Instant from, Instant to,
                    Duration granularity, ResampleMode mode,
                    DataCoverageWarning coverageWarning) {
        this.series          = series;
        this.from            = from;
        this.to              = to;
        this.granularity     = granularity;
        this.mode            = mode;
        this.coverageWarning = coverageWarning;
    }

    public Instant from() {
        return from;
    }

    public Instant to() {
        return to;
    }

    public Optional<DataCoverageWarning> coverageWarning() {
        return Optional.ofNullable(coverageWarning);
    }

    @Override
    public Iterator<WeatherSample> iterator() {
        return new BucketIterator(firstIndexAtOrAfter(from));
    }

    public Stream<WeatherSample> stream() {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    public List<WeatherSample> toList() {
        List<WeatherSample> out = new ArrayList<>();
        forEach(out::add);
        return out;
    }

    private int firstIndexAtOrAfter(Instant t) {
        List<WeatherSample> samples = series.samples();
        int lo = 0;
        int hi = samples.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (samples.get(mid).timestamp().isBefore(t)) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    private final class BucketIterator implements Iterator<WeatherSample> {

        private int cursor;
        private Instant bucketStart = from;
        private WeatherSample next;

        BucketIterator(int cursor) {
            this.cursor = cursor;
            advance();
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public WeatherSample next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            WeatherSample current = next;
            advance();
            return current;
        }

        private void advance() {
            next = null;
            List<WeatherSample> samples = series.samples();
            while (next == null && cursor < samples.size() && bucketStart.isBefore(to)) {
                Instant bucketEnd = bucketStart.plus(granularity);
                if (bucketEnd.isAfter(to)) {
                    bucketEnd = to;
                }
                List<WeatherSample> bucket = new ArrayList<>();
                while (cursor < samples.size() && samples.get(cursor).timestamp().isBefore(bucketEnd)) {
                    bucket.add(samples.get(cursor));
                    cursor++;
                }
                if (!bucket.isEmpty()) {
                    next = mode == ResampleMode.AVERAGE ? average(bucketStart, bucket) : bucket.get(0);
                }
                bucketStart = bucketStart.plus(granularity);
            }
        }
    }

    static WeatherSample average(Instant stamp, List<WeatherSample> bucket) {
        if (bucket.size() == 1) {
            return bucket.get(0).withTimestamp(stamp);
        }
        Map<WeatherField, Double> values = new EnumMap<>(WeatherField.class);
        for (WeatherField field : WeatherField.values()) {
            double sum = 0.0;
            double sin = 0.0;
            double cos = 0.0;
            int n = 0;
            for (WeatherSample s : bucket) {
                Double v = s.value(field);
                if (v == null) continue;
                if (field == WeatherField.WIND_DIRECTION) {
                    sin += Math.sin(Math.toRadians(v));
                    cos += Math.cos(Math.toRadians(v));
                } else {
                    sum += v;
                }
                n++;
            }
            if (n == 0) continue;
            if (field == WeatherField.WIND_DIRECTION) {
                double deg = Math.toDegrees(Math.atan2(sin / n, cos / n));
                values.put(field, deg < 0 ? deg + 360.0 : deg);
            } else {
                values.put(field, sum / n);
            }
        }
        return WeatherSample.of(stamp, values);
    }
}
