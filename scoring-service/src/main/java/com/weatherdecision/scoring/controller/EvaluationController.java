package com.weatherdecision.scoring.controller;

import com.weatherdecision.common.exception.ConfigurationException;
import com.weatherdecision.common.profile.UserProfile;
import com.weatherdecision.scoring.evaluation.EvaluationReport;
import com.weatherdecision.scoring.evaluation.EvaluationService;
import com.weatherdecision.scoring.store.ProfileStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/evaluate")
public class EvaluationController {

    private final EvaluationService evaluationService;
    private final ProfileStore profileStore;

    public EvaluationController(EvaluationService evaluationService, ProfileStore profileStore) {
        this.evaluationService = evaluationService;
        this.profileStore = profileStore;
    }

    /** 409 with an empty body when a newer request for the same user and location superseded this one. */
    @PostMapping
    public Mono<ResponseEntity<EvaluationReport>> evaluate(@RequestBody EvaluationRequest request) {
        return Mono.defer(() -> {
            if (request.locationId() == null || request.locationId().isBlank()) {
                return Mono.error(new IllegalArgumentException("locationId is required"));
            }
            if (request.window() == null) {
                return Mono.error(new IllegalArgumentException("window is required"));
            }
            return evaluationService.evaluate(request.locationId(), request.window(),
                    profileFor(request), request.indexIds())
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.status(HttpStatus.CONFLICT).build());
        });
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private UserProfile profileFor(EvaluationRequest request) {
        if (request.profile() != null) {
            UserProfile inline = request.profile();
            return inline.userId() != null || request.userId() == null
                ? inline
                : new UserProfile(request.userId(), inline.weights(), inline.thresholds());
        }
        if (request.userId() == null) {
            throw new ConfigurationException("profile", "Either an inline profile or a userId is required");
        }
        return profileStore.get(request.userId()).orElseThrow(() ->
            new ConfigurationException("profile", "No stored profile for user " + request.userId()));
    }
}
