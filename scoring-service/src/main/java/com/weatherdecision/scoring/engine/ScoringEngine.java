package com.weatherdecision.scoring.engine;

import com.weatherdecision.common.catalog.IndexDefinition;
import com.weatherdecision.common.model.ScoreResult;
import com.weatherdecision.common.model.WeatherSample;
import com.weatherdecision.common.profile.ResolvedProfile;
import com.weatherdecision.common.scoring.IndexEvaluator;
import com.weatherdecision.scoring.config.ScoringProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Evaluates every (sample, index) pair of a batch in parallel.
 *
 * <p>Pairs fan out onto the bounded scoring scheduler; {@code flatMapSequential} restores
 * the submission order on fan-in, so results come back ordered by timestamp, then by the
 * requested index order. A formula that throws degrades its own pair only.
 *
 * <p>The result list is emitted once, after the whole batch is collected.
 */
@Service
public class ScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    private final Scheduler scheduler;
    private final int concurrency;

    public ScoringEngine(@Qualifier("scoringScheduler") Scheduler scheduler, ScoringProperties properties) {
        this.scheduler = scheduler;
        this.concurrency = properties.getEngine().effectiveParallelism();
    }

    public Mono<List<ScoreResult>> score(List<WeatherSample> samples,
                                         List<IndexDefinition> definitions,
                                         ResolvedProfile profile) {
        List<Pair> pairs = new ArrayList<>(samples.size() * definitions.size());
        for (WeatherSample sample : samples) {
            for (IndexDefinition definition : definitions) {
                pairs.add(new Pair(sample, definition));
            }
        }
        log.debug("Scoring {} pairs ({} samples x {} indices) concurrency={}",
            pairs.size(), samples.size(), definitions.size(), concurrency);

        return Flux.fromIterable(pairs)
            .flatMapSequential(pair -> Mono.fromCallable(() ->
                        IndexEvaluator.evaluate(pair.sample(), pair.definition(), profile))
                    .subscribeOn(scheduler)
                    .onErrorResume(e -> {
                        log.error("Formula failed index={} timestamp={}",
                            pair.definition().id().key(), pair.sample().timestamp(), e);
                        return Mono.just(ScoreResult.degraded(
                            pair.sample().timestamp(), pair.definition().id(), Set.of()));
                    }),
                concurrency)
            .collectList();
    }

    private record Pair(WeatherSample sample, IndexDefinition definition) {}
}
