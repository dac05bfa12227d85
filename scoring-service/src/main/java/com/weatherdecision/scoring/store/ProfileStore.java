package com.weatherdecision.scoring.store;

import com.weatherdecision.common.profile.UserProfile;

import java.util.Optional;

public interface ProfileStore {

    Optional<UserProfile> get(String userId);

    void put(UserProfile profile);
}
