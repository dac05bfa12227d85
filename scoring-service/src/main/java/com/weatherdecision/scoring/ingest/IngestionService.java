package com.weatherdecision.scoring.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.weatherdecision.common.model.NormalizedSeries;
import com.weatherdecision.common.model.WeatherSample;
import com.weatherdecision.common.normalize.TimeSeriesNormalizer;
import com.weatherdecision.scoring.store.SeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Normalizes incoming samples and writes them to the {@link SeriesStore}.
 *
 * <p>New samples are merged over the stored series for the location (a new sample wins
 * over a stored one at the same timestamp). When the merged result equals what is already
 * stored, the write is skipped.
 *
 * <p>Runs once, before evaluation; the evaluation path never calls into this class.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final TimeSeriesNormalizer normalizer;
    private final SeriesStore seriesStore;
    private final MeteoSixForecastParser meteoSixParser;
    private final ObjectProvider<SampleIngestionClient> ingestionClient;

    public IngestionService(TimeSeriesNormalizer normalizer,
                            SeriesStore seriesStore,
                            MeteoSixForecastParser meteoSixParser,
                            ObjectProvider<SampleIngestionClient> ingestionClient) {
        this.normalizer      = normalizer;
        this.seriesStore     = seriesStore;
        this.meteoSixParser  = meteoSixParser;
        this.ingestionClient = ingestionClient;
    }

    /**
     * @throws com.weatherdecision.common.exception.ValidationException when any sample is
     *         physically invalid; nothing is stored in that case
     */
    public IngestionResult ingest(String locationId, Collection<WeatherSample> samples) {
        return store(prepare(locationId, samples));
    }

    /**
     * Every place is normalized before anything is written, so a rejected sample in any
     * place leaves the store untouched.
     */
    public MeteoSixIngestionSummary ingestMeteoSix(JsonNode payload) {
        MeteoSixForecastParser.MeteoSixForecast forecast = meteoSixParser.parse(payload);
        List<PreparedSeries> prepared = new ArrayList<>();
        forecast.samplesByPlace().forEach((placeId, samples) -> prepared.add(prepare(placeId, samples)));

        List<IngestionResult> results = new ArrayList<>();
        for (PreparedSeries series : prepared) {
            results.add(store(series));
        }
        log.info("MeteoSIX batch ingested places={} skippedFeatures={}",
                 results.size(), forecast.skippedFeatures());
        return new MeteoSixIngestionSummary(results, forecast.skippedFeatures());
    }

    /**
     * Pulls {@code range} through the configured {@link SampleIngestionClient} and ingests it.
     * Errors from the client, {@link TransientNetworkException} included, propagate unchanged.
     */
    public Mono<IngestionResult> refresh(String locationId, TimeRange range) {
        SampleIngestionClient client = ingestionClient.getIfAvailable();
        if (client == null) {
            return Mono.error(new IngestionUnavailableException(locationId, "No sample ingestion client configured"));
        }
        log.info("Refreshing location={} range=[{}, {})", locationId, range.from(), range.to());
        return client.fetchSamples(locationId, range)
            .collectList()
            .map(samples -> ingest(locationId, samples))
            .doOnError(e -> log.error("Refresh failed for location={}", locationId, e));
    }

    private PreparedSeries prepare(String locationId, Collection<WeatherSample> samples) {
        NormalizedSeries stored = seriesStore.get(locationId).orElse(null);
        List<WeatherSample> merged = new ArrayList<>();
        if (stored != null) {
            merged.addAll(stored.samples());
        }
        merged.addAll(samples);
        return new PreparedSeries(locationId, samples.size(), stored, normalizer.normalize(merged));
    }

    private IngestionResult store(PreparedSeries prepared) {
        String locationId = prepared.locationId();
        NormalizedSeries series = prepared.series();
        if (series.equals(prepared.stored())) {
            log.info("INGEST_UNCHANGED location={} samples={}, store write skipped", locationId, prepared.received());
            return new IngestionResult(locationId, prepared.received(), series.samples().size(), true);
        }
        seriesStore.put(locationId, series);
        log.info("INGEST_STORED location={} samples={} slots={}", locationId, prepared.received(), series.samples().size());
        return new IngestionResult(locationId, prepared.received(), series.samples().size(), false);
    }

    private record PreparedSeries(String locationId, int received, NormalizedSeries stored, NormalizedSeries series) {}
}
