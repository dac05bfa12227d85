package com.weatherdecision.scoring.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.weatherdecision.common.catalog.BandScale;
import com.weatherdecision.common.catalog.IndexDefinition;
import com.weatherdecision.common.model.IndexId;
import com.weatherdecision.common.model.OutputDomain;
import com.weatherdecision.common.model.Polarity;
import com.weatherdecision.common.model.WeatherField;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Public view of an {@link IndexDefinition}, without the formula.
 */
public record IndexDescriptor(
    @JsonProperty("id")             IndexId id,
    @JsonProperty("requiredFields") Set<WeatherField> requiredFields,
    @JsonProperty("outputDomain")   OutputDomain outputDomain,
    @JsonProperty("polarity")       Polarity polarity,
    @JsonProperty("categories")     List<String> categories,
    @JsonProperty("bands")          Map<String, Double> bands,
    @JsonProperty("partialInputs")  boolean partialInputs
) {

    public static IndexDescriptor from(IndexDefinition definition) {
        Map<String, Double> bands = new LinkedHashMap<>();
        if (definition.bands() != null) {
            for (BandScale.Band band : definition.bands().bands()) {
                bands.put(band.label(), band.lowerBound());
            }
        }
        return new IndexDescriptor(definition.id(), definition.requiredFields(), definition.outputDomain(),
            definition.polarity(), definition.categories(), bands, definition.partialInputs());
    }
}
