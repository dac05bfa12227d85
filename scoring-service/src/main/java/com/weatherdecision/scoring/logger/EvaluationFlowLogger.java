package com.weatherdecision.scoring.logger;

import com.weatherdecision.common.trace.TraceContextUtil;
import com.weatherdecision.scoring.evaluation.EvaluationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of an evaluation inside the reactive pipeline. Side effects only.
 *
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}: evaluate() called</li>
 *   <li>{@link #PROFILE_RESOLVED}: profile validated and normalized</li>
 *   <li>{@link #WINDOW_SELECTED}: forecast window extracted from the stored series</li>
 *   <li>{@link #SCORES_COMPUTED}: every (timestamp, index) pair evaluated</li>
 *   <li>{@link #RECOMMENDATIONS_MAPPED}: report assembled</li>
 *   <li>{@link #SUPERSEDED}: a newer request for the same session took over</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(EvaluationFlowLogger.WINDOW_SELECTED))
 * </pre>
 */
@Component
public class EvaluationFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(EvaluationFlowLogger.class);

    public static final String REQUEST_RECEIVED       = "REQUEST_RECEIVED";
    public static final String PROFILE_RESOLVED       = "PROFILE_RESOLVED";
    public static final String WINDOW_SELECTED        = "WINDOW_SELECTED";
    public static final String SCORES_COMPUTED        = "SCORES_COMPUTED";
    public static final String RECOMMENDATIONS_MAPPED = "RECOMMENDATIONS_MAPPED";
    public static final String SUPERSEDED             = "SUPERSEDED";

    /**
     * {@code doOnEach} consumer; fires on {@code onNext} only and reads the traceId from
     * the signal's Reactor Context.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[EvaluationFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[EvaluationFlow] stage={} traceId={}", stageName, traceId)
        );
    }

    public void logRequest(String locationId, String sessionKey, int indexCount, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[EvaluationFlow] stage={} location={} session={} indices={} traceId={}",
                REQUEST_RECEIVED, locationId, sessionKey, indexCount, traceId)
        );
    }

    /** One-line summary once the report is assembled. */
    public void logReport(EvaluationReport report) {
        TraceContextUtil.withMdc(report.traceId(), () ->
            log.info("[EvaluationFlow] stage={} location={} results={} degraded={} recommendations={} "
                     + "coverageWarning={} traceId={}",
                     RECOMMENDATIONS_MAPPED,
                     report.locationId(), report.results().size(), report.degradedCount(),
                     report.recommendations().size(),
                     report.coverageWarning() != null ? report.coverageWarning().message() : "none",
                     report.traceId())
        );
    }
}
