package com.weatherdecision.scoring.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.weatherdecision.common.model.IndexId;
import com.weatherdecision.common.profile.UserProfile;
import com.weatherdecision.common.window.ForecastWindow;

import java.util.List;

/**
 * Body of {@code POST /api/v1/evaluate}.
 *
 * @param profile  inline profile; when {@code null}, the stored profile of {@code userId} is used
 * @param indexIds empty or absent means every index
 */
public record EvaluationRequest(
    @JsonProperty("locationId") String locationId,
    @JsonProperty("userId")     String userId,
    @JsonProperty("window")     ForecastWindow window,
    @JsonProperty("profile")    UserProfile profile,
    @JsonProperty("indexIds")   List<IndexId> indexIds
) {}
