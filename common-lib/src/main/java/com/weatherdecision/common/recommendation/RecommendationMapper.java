package com.weatherdecision.common.recommendation;

import com.weatherdecision.common.catalog.IndexCatalog;
import com.weatherdecision.common.catalog.IndexDefinition;
import com.weatherdecision.common.model.IndexId;
import com.weatherdecision.common.model.OutputDomain;
import com.weatherdecision.common.model.Polarity;
import com.weatherdecision.common.model.Recommendation;
import com.weatherdecision.common.model.ScoreResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Turns score results into discrete recommendations.
 *
 * <p>Continuous indices go through their {@code BandScale}, so the mapping is monotonic
 * in the value and a boundary value lands in the upper band. Categorical indices keep the
 * category their formula chose.
 *
 * <p>Summaries over several timestamps take the least favorable outcome:
 * <ul>
 *   <li>QUALITY: minimum value</li>
 *   <li>RISK: maximum value</li>
 *   <li>categorical: maximum rank</li>
 * </ul>
 * Confidence is the mean over the computed results; degraded results are ignored and an
 * index with no computed result yields no recommendation.
 */
public final class RecommendationMapper {

    private final IndexCatalog catalog;

    public RecommendationMapper(IndexCatalog catalog) {
        this.catalog = catalog;
    }

    /** Category label for a continuous value of {@code id}. */
    public String categoryFor(IndexId id, double value) {
        IndexDefinition definition = catalog.definition(id);
        if (definition.outputDomain() != OutputDomain.CONTINUOUS) {
            throw new IllegalArgumentException(id.key() + " has no band scale");
        }
        return definition.bands().bandFor(value).label();
    }

    public Optional<Recommendation> map(ScoreResult result) {
        return summarize(result.indexId(), List.of(result));
    }

    public Optional<Recommendation> summarize(IndexId id, Collection<ScoreResult> results) {
        IndexDefinition definition = catalog.definition(id);
        List<ScoreResult> computed = results.stream()
            .filter(r -> r.indexId() == id && r.hasValue())
            .toList();
        if (computed.isEmpty()) {
            return Optional.empty();
        }

        String category;
        if (definition.outputDomain() == OutputDomain.CATEGORICAL) {
            int rank = computed.stream().mapToInt(r -> rankOf(definition, r.band())).max().orElseThrow();
            category = definition.categories().get(rank);
        } else {
            double value = definition.polarity() == Polarity.QUALITY
                ? computed.stream().mapToDouble(ScoreResult::value).min().orElseThrow()
                : computed.stream().mapToDouble(ScoreResult::value).max().orElseThrow();
            category = definition.bands().bandFor(value).label();
        }

        Instant from = computed.stream().map(ScoreResult::timestamp).min(Comparator.naturalOrder()).orElseThrow();
        Instant to = computed.stream().map(ScoreResult::timestamp).max(Comparator.naturalOrder()).orElseThrow();
        double confidence = computed.stream().mapToDouble(ScoreResult::confidence).average().orElse(0.0);

        return Optional.of(new Recommendation(id, category, rankOf(definition, category),
            definition.polarity(), from, to, confidence, computed.size()));
    }

    /** One recommendation per index in {@code order} that has at least one computed result. */
    public List<Recommendation> summarizeAll(Collection<ScoreResult> results, Collection<IndexId> order) {
        List<Recommendation> recommendations = new ArrayList<>();
        for (IndexId id : new LinkedHashSet<>(order)) {
            summarize(id, results).ifPresent(recommendations::add);
        }
        return recommendations;
    }

    private static int rankOf(IndexDefinition definition, String category) {
        int rank = definition.rankOf(category);
        if (rank < 0) {
            throw new IllegalStateException("Category '" + category + "' not defined for " + definition.id().key());
        }
        return rank;
    }
}
