package com.weatherdecision.scoring.controller;

import com.weatherdecision.common.catalog.IndexCatalog;
import com.weatherdecision.common.model.WeatherSample;
import com.weatherdecision.common.normalize.TimeSeriesNormalizer;
import com.weatherdecision.common.profile.ProfileDefaults;
import com.weatherdecision.common.profile.UserProfile;
import com.weatherdecision.common.profile.UserProfileResolver;
import com.weatherdecision.common.recommendation.RecommendationMapper;
import com.weatherdecision.scoring.config.ScoringProperties;
import com.weatherdecision.scoring.engine.ScoringEngine;
import com.weatherdecision.scoring.evaluation.EvaluationService;
import com.weatherdecision.scoring.evaluation.InFlightEvaluations;
import com.weatherdecision.scoring.ingest.IngestionService;
import com.weatherdecision.scoring.ingest.MeteoSixForecastParser;
import com.weatherdecision.scoring.logger.EvaluationFlowLogger;
import com.weatherdecision.scoring.store.InMemoryProfileStore;
import com.weatherdecision.scoring.store.InMemorySeriesStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ScoringApiTest {

    private static final Instant NOW = Instant.parse("2024-06-01T06:00:00Z");

    private final IndexCatalog catalog = IndexCatalog.standard();
    private final TimeSeriesNormalizer normalizer = new TimeSeriesNormalizer();
    private final InMemorySeriesStore seriesStore = new InMemorySeriesStore();
    private final InMemoryProfileStore profileStore = new InMemoryProfileStore();
    private final UserProfileResolver resolver = new UserProfileResolver(ProfileDefaults.defaults());

    private Scheduler scheduler;
    private WebTestClient client;

    @SuppressWarnings("unchecked")
    @BeforeEach
    void setUp() {
        scheduler = Schedulers.newParallel("api-test", 2);
        EvaluationService evaluationService = new EvaluationService(catalog, resolver, normalizer,
            new RecommendationMapper(catalog), new ScoringEngine(scheduler, new ScoringProperties()),
            seriesStore, new InFlightEvaluations(), new EvaluationFlowLogger(), Clock.fixed(NOW, ZoneOffset.UTC));
        IngestionService ingestionService = new IngestionService(normalizer, seriesStore,
            new MeteoSixForecastParser(), mock(ObjectProvider.class));

        client = WebTestClient.bindToController(
                new EvaluationController(evaluationService, profileStore),
                new CatalogController(catalog),
                new ProfileController(profileStore, resolver),
                new IngestionController(ingestionService))
            .controllerAdvice(new ScoringExceptionHandler())
            .build();

        List<WeatherSample> raw = new ArrayList<>();
        for (int h = 0; h < 6; h++) {
            raw.add(WeatherSample.builder(NOW.plus(Duration.ofHours(h)))
                .temperature(18 + h).windSpeed(8).precipitationRate(0).fogDensity(0)
                .cloudCover(30).relativeHumidity(65).waterTemperature(17).build());
        }
        seriesStore.put("vigo", normalizer.normalize(raw));
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private static Map<String, Object> evaluateBody(Map<String, Object> profile) {
        return Map.of(
            "locationId", "vigo",
            "window", Map.of("startOffset", "PT0S", "duration", "PT3H"),
            "profile", profile,
            "indexIds", List.of("day-quality", "cold-shock"));
    }

    // ── Evaluate ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("POST /api/v1/evaluate")
    class Evaluate {

        @Test
        @DisplayName("inline profile → 200 with results and recommendations")
        void ok() {
            client.post().uri("/api/v1/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(evaluateBody(Map.of("userId", "ana",
                    "thresholds", Map.of("comfort.temp.min", 16, "comfort.temp.max", 26))))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.locationId").isEqualTo("vigo")
                .jsonPath("$.results.length()").isEqualTo(6)
                .jsonPath("$.results[0].indexId").isEqualTo("day-quality")
                .jsonPath("$.results[1].indexId").isEqualTo("cold-shock")
                .jsonPath("$.recommendations.length()").isEqualTo(2);
        }

        @Test
        @DisplayName("negative weight → 400 naming the key")
        void negativeWeight() {
            client.post().uri("/api/v1/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(evaluateBody(Map.of("userId", "ana",
                    "weights", Map.of("wind", -1),
                    "thresholds", Map.of("comfort.temp.min", 16, "comfort.temp.max", 26))))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("CONFIGURATION_ERROR")
                .jsonPath("$.subject").isEqualTo("wind");
        }

        @Test
        @DisplayName("stored profile is used when only userId is given")
        void storedProfile() {
            profileStore.put(new UserProfile("ana", Map.of(),
                Map.of("comfort.temp.min", 16.0, "comfort.temp.max", 26.0)));

            client.post().uri("/api/v1/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("locationId", "vigo", "userId", "ana",
                    "window", Map.of("duration", "PT2H")))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.results.length()").isEqualTo(2 * catalog.ids().size());
        }

        @Test
        @DisplayName("no profile at all → 400")
        void noProfile() {
            client.post().uri("/api/v1/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("locationId", "vigo", "window", Map.of("duration", "PT2H")))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.subject").isEqualTo("profile");
        }

        @Test
        @DisplayName("missing window → 400")
        void missingWindow() {
            client.post().uri("/api/v1/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("locationId", "vigo", "userId", "ana"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("BAD_REQUEST");
        }

        @Test
        @DisplayName("GET /health → OK")
        void health() {
            client.get().uri("/api/v1/evaluate/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class).isEqualTo("OK");
        }
    }

    // ── Catalog and profiles ──────────────────────────────────────────────────

    @Test
    @DisplayName("GET /api/v1/catalog lists every index")
    void catalog() {
        client.get().uri("/api/v1/catalog")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(4)
            .jsonPath("$[?(@.id == 'clothing')].outputDomain").isEqualTo("CATEGORICAL");
    }

    @Nested
    @DisplayName("/api/v1/profiles")
    class Profiles {

        @Test
        @DisplayName("PUT stores under the path user id, GET returns it")
        void putThenGet() {
            client.put().uri("/api/v1/profiles/ana")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("userId", "someone-else", "weights", Map.of("temp", 0.7)))
                .exchange()
                .expectStatus().isOk();

            client.get().uri("/api/v1/profiles/ana")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.userId").isEqualTo("ana")
                .jsonPath("$.weights.temp").isEqualTo(0.7);
            assertTrue(profileStore.get("ana").isPresent());
        }

        @Test
        @DisplayName("unknown key → 400 and nothing stored")
        void unknownKey() {
            client.put().uri("/api/v1/profiles/ana")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("weights", Map.of("humidity", 0.5)))
                .exchange()
                .expectStatus().isBadRequest();
            assertFalse(profileStore.get("ana").isPresent());
        }

        @Test
        @DisplayName("GET of an unknown user → 404")
        void notFound() {
            client.get().uri("/api/v1/profiles/nobody")
                .exchange()
                .expectStatus().isNotFound();
        }
    }

    // ── Ingestion ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("ingestion")
    class Ingestion {

        @Test
        @DisplayName("valid samples are stored")
        void samples() {
            client.post().uri("/api/v1/locations/lugo/samples")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(List.of(
                    Map.of("timestamp", "2024-06-01T06:00:00Z", "temperature", 12.0),
                    Map.of("timestamp", "2024-06-01T07:00:00Z", "temperature", 13.0)))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.slotsStored").isEqualTo(2)
                .jsonPath("$.unchanged").isEqualTo(false);
            assertTrue(seriesStore.get("lugo").isPresent());
        }

        @Test
        @DisplayName("physically impossible value → 400 VALIDATION_ERROR")
        void invalidSample() {
            client.post().uri("/api/v1/locations/lugo/samples")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(List.of(Map.of("timestamp", "2024-06-01T06:00:00Z", "windSpeed", -4.0)))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("VALIDATION_ERROR");
            assertFalse(seriesStore.get("lugo").isPresent());
        }

        @Test
        @DisplayName("refresh without a configured client → 503")
        void refreshWithoutClient() {
            client.post().uri("/api/v1/locations/lugo/refresh")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("from", "2024-06-01T06:00:00Z", "to", "2024-06-01T12:00:00Z"))
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error").isEqualTo("UNAVAILABLE")
                .jsonPath("$.subject").isEqualTo("lugo");
        }
    }

    // ── Error mapping ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("an internal IllegalStateException is a 500, not a 503")
    void illegalStateIsServerError() {
        WebTestClient failing = WebTestClient.bindToController(new FailingController())
            .controllerAdvice(new ScoringExceptionHandler())
            .build();

        failing.get().uri("/fail")
            .exchange()
            .expectStatus().is5xxServerError()
            .expectStatus().value(status -> assertNotEquals(503, status));
    }

    @RestController
    static class FailingController {

        @GetMapping("/fail")
        public Mono<String> fail() {
            return Mono.error(new IllegalStateException("threshold not resolved"));
        }
    }
}
