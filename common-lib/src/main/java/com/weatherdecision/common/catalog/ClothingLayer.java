package com.weatherdecision.common.catalog;

import java.util.Arrays;
import java.util.List;

/**
 * Recommended outer layer, ordered from lightest to heaviest. The ordinal is the rank.
 */
public enum ClothingLayer {
    NONE("none"),
    LIGHT_LAYER("light-layer"),
    WINDPROOF("windproof"),
    WATERPROOF("waterproof"),
    INSULATED("insulated");

    private final String label;

    ClothingLayer(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(ClothingLayer::label).toList();
    }
}
