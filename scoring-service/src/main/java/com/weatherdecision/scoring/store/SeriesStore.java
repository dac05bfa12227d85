package com.weatherdecision.scoring.store;

import com.weatherdecision.common.model.NormalizedSeries;

import java.util.Optional;
import java.util.Set;

/**
 * Normalized series per location. Synchronous, key-based; the evaluation path only reads.
 */
public interface SeriesStore {

    Optional<NormalizedSeries> get(String locationId);

    void put(String locationId, NormalizedSeries series);

    Set<String> locations();
}
