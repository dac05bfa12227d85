package com.weatherdecision.scoring.ingest;

import com.weatherdecision.common.exception.WeatherScoringException;

/**
 * The sample source could not be reached. Retrying is the caller's decision.
 */
public class TransientNetworkException extends WeatherScoringException {

    public TransientNetworkException(String locationId, String message, Throwable cause) {
        super(locationId, message, cause);
    }
}
