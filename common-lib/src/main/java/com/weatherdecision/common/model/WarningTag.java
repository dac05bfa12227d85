package com.weatherdecision.common.model;

/**
 * Non-fatal condition attached to a single {@link ScoreResult}.
 */
public enum WarningTag {
    /** A required input was missing for this (timestamp, index) pair; value is null or partial. */
    COMPUTATION_DEGRADED
}
