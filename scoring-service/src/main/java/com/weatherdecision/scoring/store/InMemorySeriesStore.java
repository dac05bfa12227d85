package com.weatherdecision.scoring.store;

import com.weatherdecision.common.model.NormalizedSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SeriesStore} backed by a {@link ConcurrentHashMap}. Series are immutable, so a
 * reader always sees either the old or the new series for a location, never a mix.
 */
@Component
public class InMemorySeriesStore implements SeriesStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySeriesStore.class);

    private final ConcurrentHashMap<String, NormalizedSeries> store = new ConcurrentHashMap<>();

    @Override
    public Optional<NormalizedSeries> get(String locationId) {
        return Optional.ofNullable(store.get(locationId));
    }

    @Override
    public void put(String locationId, NormalizedSeries series) {
        store.put(locationId, series);
        log.info("SERIES_STORED location={} slots={} start={} coverageEnd={}",
                 locationId, series.samples().size(), series.start(), series.coverageEnd());
    }

    @Override
    public Set<String> locations() {
        return Set.copyOf(store.keySet());
    }
}
