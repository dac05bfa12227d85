package com.weatherdecision.scoring.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * @param subject offending key, sample field or location; {@code null} when not applicable
 */
public record ErrorResponse(
    @JsonProperty("error")     String error,
    @JsonProperty("subject")   String subject,
    @JsonProperty("message")   String message,
    @JsonProperty("timestamp") Instant timestamp
) {}
