package com.weatherdecision.scoring.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.weatherdecision.common.model.WeatherSample;
import com.weatherdecision.scoring.ingest.IngestionResult;
import com.weatherdecision.scoring.ingest.IngestionService;
import com.weatherdecision.scoring.ingest.MeteoSixIngestionSummary;
import com.weatherdecision.scoring.ingest.TimeRange;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class IngestionController {

    private final IngestionService ingestionService;

    public IngestionController(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping("/locations/{locationId}/samples")
    public Mono<IngestionResult> ingest(@PathVariable String locationId,
                                        @RequestBody List<WeatherSample> samples) {
        return Mono.fromCallable(() -> ingestionService.ingest(locationId, samples));
    }

    @PostMapping("/locations/{locationId}/refresh")
    public Mono<IngestionResult> refresh(@PathVariable String locationId, @RequestBody TimeRange range) {
        return ingestionService.refresh(locationId, range);
    }

    @PostMapping("/ingest/meteosix")
    public Mono<MeteoSixIngestionSummary> ingestMeteoSix(@RequestBody JsonNode payload) {
        return Mono.fromCallable(() -> ingestionService.ingestMeteoSix(payload));
    }
}
