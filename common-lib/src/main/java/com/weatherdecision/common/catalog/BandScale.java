package com.weatherdecision.common.catalog;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered bands over a 0–100 score.
 *
 * <p>Bands are sorted by strictly increasing {@code lowerBound}; the first starts at 0.
 * A value belongs to the last band whose lower bound is {@code <=} the value, so a value
 * sitting exactly on a boundary always resolves to the upper band:
 * <ul>
 *   <li>quality indices: the more favorable band</li>
 *   <li>risk indices: the higher, more cautious band</li>
 * </ul>
 * The comparison is an exact {@code >=} against the configured bound, not a rounded one.
 */
public record BandScale(List<Band> bands) {

    public record Band(String label, double lowerBound) {}

    public BandScale {
        if (bands == null || bands.isEmpty()) {
            throw new IllegalArgumentException("Band scale needs at least one band");
        }
        bands = List.copyOf(bands);
        if (bands.get(0).lowerBound() != 0.0) {
            throw new IllegalArgumentException("First band must start at 0, got " + bands.get(0).lowerBound());
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < bands.size(); i++) {
            Band band = bands.get(i);
            if (band.label() == null || band.label().isBlank() || !seen.add(band.label())) {
                throw new IllegalArgumentException("Band labels must be unique and non-blank: " + band.label());
            }
            if (i > 0 && !(band.lowerBound() > bands.get(i - 1).lowerBound())) {
                throw new IllegalArgumentException("Band bounds must be strictly increasing at " + band.label());
            }
            if (band.lowerBound() > 100.0) {
                throw new IllegalArgumentException("Band bound above 100: " + band.label());
            }
        }
    }

    /** Builds a scale from label → lower bound pairs in any order. */
    public static BandScale of(Map<String, Double> lowerBounds) {
        List<Band> bands = new ArrayList<>();
        lowerBounds.forEach((label, bound) -> bands.add(new Band(label, bound)));
        bands.sort(Comparator.comparingDouble(Band::lowerBound));
        return new BandScale(bands);
    }

    public Band bandFor(double value) {
        for (int i = bands.size() - 1; i > 0; i--) {
            if (value >= bands.get(i).lowerBound()) {
                return bands.get(i);
            }
        }
        return bands.get(0);
    }

    public List<String> labels() {
        return bands.stream().map(Band::label).toList();
    }
}
