package com.weatherdecision.scoring.ingest;

import com.weatherdecision.common.exception.WeatherScoringException;

/**
 * No {@link SampleIngestionClient} is configured, so samples cannot be pulled for the location.
 */
public class IngestionUnavailableException extends WeatherScoringException {

    public IngestionUnavailableException(String locationId, String message) {
        super(locationId, message);
    }
}
