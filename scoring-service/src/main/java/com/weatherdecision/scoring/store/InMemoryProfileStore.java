package com.weatherdecision.scoring.store;

import com.weatherdecision.common.profile.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryProfileStore implements ProfileStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryProfileStore.class);

    private final ConcurrentHashMap<String, UserProfile> store = new ConcurrentHashMap<>();

    @Override
    public Optional<UserProfile> get(String userId) {
        return Optional.ofNullable(store.get(userId));
    }

    @Override
    public void put(UserProfile profile) {
        Objects.requireNonNull(profile.userId(), "userId");
        store.put(profile.userId(), profile);
        log.info("PROFILE_STORED userId={} weights={} thresholds={}",
                 profile.userId(), profile.weights().size(), profile.thresholds().size());
    }
}
