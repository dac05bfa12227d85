package com.weatherdecision.common.model;

/**
 * Direction in which an index score should be read.
 *
 * <ul>
 *   <li>{@link #QUALITY}: higher is better (day quality, visibility)</li>
 *   <li>{@link #RISK}: higher is worse (cold shock, clothing exposure)</li>
 * </ul>
 */
public enum Polarity {
    QUALITY,
    RISK
}
