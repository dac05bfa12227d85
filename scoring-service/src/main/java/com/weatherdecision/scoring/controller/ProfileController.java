package com.weatherdecision.scoring.controller;

import com.weatherdecision.common.profile.UserProfile;
import com.weatherdecision.common.profile.UserProfileResolver;
import com.weatherdecision.scoring.store.ProfileStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/profiles")
public class ProfileController {

    private final ProfileStore profileStore;
    private final UserProfileResolver resolver;

    public ProfileController(ProfileStore profileStore, UserProfileResolver resolver) {
        this.profileStore = profileStore;
        this.resolver = resolver;
    }

    /** Keys and ranges are checked on write; index-specific requirements are checked at evaluation time. */
    @PutMapping("/{userId}")
    public Mono<UserProfile> put(@PathVariable String userId, @RequestBody UserProfile body) {
        return Mono.fromCallable(() -> {
            UserProfile profile = new UserProfile(userId, body.weights(), body.thresholds());
            resolver.validate(profile);
            profileStore.put(profile);
            return profile;
        });
    }

    @GetMapping("/{userId}")
    public Mono<ResponseEntity<UserProfile>> get(@PathVariable String userId) {
        return Mono.justOrEmpty(profileStore.get(userId))
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }
}
