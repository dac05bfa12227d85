package com.weatherdecision.scoring.ingest;

import com.weatherdecision.common.model.WeatherSample;
import reactor.core.publisher.Flux;

/**
 * Source of raw samples for a location. No implementation ships with this service;
 * when a bean is present, {@link IngestionService#refresh} uses it.
 *
 * <p>Implementations signal {@link TransientNetworkException} on connectivity failures
 * and do not retry on their own.
 */
public interface SampleIngestionClient {

    Flux<WeatherSample> fetchSamples(String locationId, TimeRange range);
}
