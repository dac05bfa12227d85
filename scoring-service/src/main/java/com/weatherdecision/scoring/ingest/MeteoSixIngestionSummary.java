package com.weatherdecision.scoring.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param skippedFeatures features the upstream flagged with an {@code exception}
 */
public record MeteoSixIngestionSummary(
    @JsonProperty("locations")       List<IngestionResult> locations,
    @JsonProperty("skippedFeatures") int skippedFeatures
) {}
