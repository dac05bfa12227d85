package com.weatherdecision.scoring.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.weatherdecision.common.model.DataCoverageWarning;
import com.weatherdecision.common.model.Recommendation;
import com.weatherdecision.common.model.ScoreResult;

import java.time.Instant;
import java.util.List;

/**
 * Everything the dashboard needs for one evaluation.
 *
 * @param results         ordered by timestamp, then by requested index order
 * @param recommendations one per requested index with at least one computed result
 * @param coverageWarning {@code null} when the window lies inside the stored data
 */
public record EvaluationReport(
    @JsonProperty("locationId")      String locationId,
    @JsonProperty("traceId")         String traceId,
    @JsonProperty("from")            Instant from,
    @JsonProperty("to")              Instant to,
    @JsonProperty("results")         List<ScoreResult> results,
    @JsonProperty("recommendations") List<Recommendation> recommendations,
    @JsonProperty("coverageWarning") DataCoverageWarning coverageWarning
) {

    public EvaluationReport {
        results = List.copyOf(results);
        recommendations = List.copyOf(recommendations);
    }

    public long degradedCount() {
        return results.stream().filter(r -> r.warning() != null).count();
    }
}
