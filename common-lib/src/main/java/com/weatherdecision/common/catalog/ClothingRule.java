package com.weatherdecision.common.catalog;

import java.util.function.Predicate;

/**
 * One guarded clothing rule. Rules are checked top to bottom; the first whose guard holds wins.
 */
public record ClothingRule(String name, ClothingLayer layer, Predicate<ClothingConditions> guard) {

    public boolean matches(ClothingConditions conditions) {
        return guard.test(conditions);
    }
}
