package com.weatherdecision.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Non-fatal: the requested window reaches outside the range the stored series covers.
 * Attached to a selection or report, never thrown.
 *
 * @param coveredFrom {@code null} when the series holds no data at all
 * @param coveredTo   exclusive; {@code null} when the series holds no data at all
 */
public record DataCoverageWarning(
    @JsonProperty("requestedFrom") Instant requestedFrom,
    @JsonProperty("requestedTo") Instant requestedTo,
    @JsonProperty("coveredFrom") Instant coveredFrom,
    @JsonProperty("coveredTo") Instant coveredTo,
    @JsonProperty("message") String message
) {

    public static DataCoverageWarning of(Instant requestedFrom, Instant requestedTo,
                                         Instant coveredFrom, Instant coveredTo) {
        String message;
        if (coveredFrom == null) {
            message = "No data stored for this location";
        } else if (!requestedFrom.isBefore(coveredTo) || !requestedTo.isAfter(coveredFrom)) {
            message = "Requested window lies entirely outside stored data";
        } else {
            message = "Requested window partially exceeds stored data";
        }
        return new DataCoverageWarning(requestedFrom, requestedTo, coveredFrom, coveredTo, message);
    }
}
