package com.weatherdecision.scoring.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.weatherdecision.common.catalog.IndexCatalog;
import com.weatherdecision.common.normalize.TimeSeriesNormalizer;
import com.weatherdecision.common.profile.UserProfileResolver;
import com.weatherdecision.common.recommendation.RecommendationMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

@Configuration
public class ScoringConfig {

    private static final Logger log = LoggerFactory.getLogger(ScoringConfig.class);

    @Value("${scoring.engine.scheduler-name:scoring}")
    private String schedulerName;

    @Bean
    public IndexCatalog indexCatalog(ScoringProperties properties) {
        IndexCatalog catalog = IndexCatalog.build(properties.toCatalogParameters());
        log.info("Index catalog built with {} indices: {}", catalog.ids().size(), catalog.ids());
        return catalog;
    }

    @Bean
    public UserProfileResolver userProfileResolver(IndexCatalog catalog) {
        return new UserProfileResolver(catalog.parameters().profileDefaults());
    }

    @Bean
    public TimeSeriesNormalizer timeSeriesNormalizer(ScoringProperties properties) {
        return new TimeSeriesNormalizer(properties.toNormalizerSettings());
    }

    @Bean
    public RecommendationMapper recommendationMapper(IndexCatalog catalog) {
        return new RecommendationMapper(catalog);
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler scoringScheduler(ScoringProperties properties) {
        int parallelism = properties.getEngine().effectiveParallelism();
        log.info("Scoring scheduler '{}' sized to {} workers", schedulerName, parallelism);
        return Schedulers.newParallel(schedulerName, parallelism);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
