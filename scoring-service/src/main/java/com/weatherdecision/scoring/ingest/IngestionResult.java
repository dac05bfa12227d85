package com.weatherdecision.scoring.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param unchanged {@code true} when the merged series equalled the stored one and the write was skipped
 */
public record IngestionResult(
    @JsonProperty("locationId")       String locationId,
    @JsonProperty("samplesReceived")  int samplesReceived,
    @JsonProperty("slotsStored")      int slotsStored,
    @JsonProperty("unchanged")        boolean unchanged
) {}
