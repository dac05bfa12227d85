package com.weatherdecision.scoring.evaluation;

import com.weatherdecision.common.catalog.IndexCatalog;
import com.weatherdecision.common.catalog.IndexDefinition;
import com.weatherdecision.common.model.IndexId;
import com.weatherdecision.common.model.NormalizedSeries;
import com.weatherdecision.common.model.ScoreResult;
import com.weatherdecision.common.model.WeatherSample;
import com.weatherdecision.common.normalize.TimeSeriesNormalizer;
import com.weatherdecision.common.profile.ResolvedProfile;
import com.weatherdecision.common.profile.UserProfile;
import com.weatherdecision.common.profile.UserProfileResolver;
import com.weatherdecision.common.recommendation.RecommendationMapper;
import com.weatherdecision.common.trace.TraceContextUtil;
import com.weatherdecision.common.window.ForecastWindow;
import com.weatherdecision.common.window.WindowSelection;
import com.weatherdecision.common.window.WindowSelector;
import com.weatherdecision.scoring.engine.ScoringEngine;
import com.weatherdecision.scoring.logger.EvaluationFlowLogger;
import com.weatherdecision.scoring.store.SeriesStore;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Presentation boundary: {@code evaluate(locationId, window, profile, indexIds)}.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>resolve the profile for the requested indices (a {@code ConfigurationException}
 *       ends the evaluation here, before any scoring)</li>
 *   <li>select the window from the stored series; an unknown location is an empty series</li>
 *   <li>score all pairs on the scoring scheduler</li>
 *   <li>map recommendations and assemble the report</li>
 * </ol>
 *
 * <p>A newer call for the same (user, location) session supersedes this one, which then
 * completes empty.
 */
@Service
public class EvaluationService {

    private final IndexCatalog catalog;
    private final UserProfileResolver resolver;
    private final TimeSeriesNormalizer normalizer;
    private final RecommendationMapper mapper;
    private final ScoringEngine engine;
    private final SeriesStore seriesStore;
    private final InFlightEvaluations inFlight;
    private final EvaluationFlowLogger flowLogger;
    private final Clock clock;

    public EvaluationService(IndexCatalog catalog,
                             UserProfileResolver resolver,
                             TimeSeriesNormalizer normalizer,
                             RecommendationMapper mapper,
                             ScoringEngine engine,
                             SeriesStore seriesStore,
                             InFlightEvaluations inFlight,
                             EvaluationFlowLogger flowLogger,
                             Clock clock) {
        this.catalog     = catalog;
        this.resolver    = resolver;
        this.normalizer  = normalizer;
        this.mapper      = mapper;
        this.engine      = engine;
        this.seriesStore = seriesStore;
        this.inFlight    = inFlight;
        this.flowLogger  = flowLogger;
        this.clock       = clock;
    }

    /**
     * @param indexIds empty or {@code null} means every catalog index
     * @return the report, or an empty Mono when a newer request for the same session took over
     */
    public Mono<EvaluationReport> evaluate(String locationId, ForecastWindow window,
                                           UserProfile profile, List<IndexId> indexIds) {
        Objects.requireNonNull(locationId, "locationId");
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(profile, "profile");

        String traceId = TraceContextUtil.newTraceId();
        String sessionKey = sessionKey(profile.userId(), locationId);
        List<IndexId> requested = indexIds == null || indexIds.isEmpty()
            ? List.copyOf(catalog.ids())
            : indexIds.stream().distinct().toList();
        flowLogger.logRequest(locationId, sessionKey, requested.size(), traceId);

        Mono<EvaluationReport> pipeline = Mono.fromCallable(() -> resolver.resolve(profile, requested))
            .doOnEach(flowLogger.stage(EvaluationFlowLogger.PROFILE_RESOLVED))
            .map(resolved -> prepare(locationId, window, resolved, requested))
            .doOnEach(flowLogger.stage(EvaluationFlowLogger.WINDOW_SELECTED))
            .flatMap(prepared -> engine.score(prepared.samples(), prepared.definitions(), prepared.profile())
                .doOnEach(flowLogger.stage(EvaluationFlowLogger.SCORES_COMPUTED))
                .map(results -> report(locationId, traceId, prepared, results, requested)))
            .doOnNext(flowLogger::logReport);

        return TraceContextUtil.withTraceId(
            inFlight.runExclusive(sessionKey, pipeline,
                () -> flowLogger.logWithTraceId(EvaluationFlowLogger.SUPERSEDED, traceId)),
            traceId);
    }

    static String sessionKey(String userId, String locationId) {
        return (userId == null ? "anonymous" : userId) + "@" + locationId;
    }

    private Prepared prepare(String locationId, ForecastWindow window,
                             ResolvedProfile resolved, List<IndexId> requested) {
        NormalizedSeries series = seriesStore.get(locationId)
            .orElseGet(() -> NormalizedSeries.empty(normalizer.interval()));
        WindowSelection selection = WindowSelector.select(series, window, clock.instant());
        return new Prepared(catalog.definitions(requested), resolved, selection, selection.toList());
    }

    private EvaluationReport report(String locationId, String traceId, Prepared prepared,
                                    List<ScoreResult> results, List<IndexId> requested) {
        return new EvaluationReport(locationId, traceId,
            prepared.selection().from(), prepared.selection().to(),
            results, mapper.summarizeAll(results, requested),
            prepared.selection().coverageWarning().orElse(null));
    }

    private record Prepared(List<IndexDefinition> definitions,
                            ResolvedProfile profile,
                            WindowSelection selection,
                            List<WeatherSample> samples) {}
}
