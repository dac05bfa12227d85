package com.weatherdecision.common.catalog;

import com.weatherdecision.common.exception.ConfigurationException;
import com.weatherdecision.common.model.IndexId;
import com.weatherdecision.common.model.OutputDomain;
import com.weatherdecision.common.model.Polarity;
import com.weatherdecision.common.model.WeatherField;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only registry of index definitions, built once from {@link CatalogParameters}.
 */
public final class IndexCatalog {

    private final CatalogParameters parameters;
    private final Map<IndexId, IndexDefinition> definitions;

    private IndexCatalog(CatalogParameters parameters, Map<IndexId, IndexDefinition> definitions) {
        this.parameters = parameters;
        this.definitions = Collections.unmodifiableMap(definitions);
    }

    public static IndexCatalog build(CatalogParameters parameters) {
        Objects.requireNonNull(parameters, "parameters");
        Map<IndexId, IndexDefinition> defs = new EnumMap<>(IndexId.class);

        defs.put(IndexId.DAY_QUALITY, new IndexDefinition(
            IndexId.DAY_QUALITY,
            EnumSet.of(WeatherField.TEMPERATURE, WeatherField.WIND_SPEED,
                WeatherField.PRECIPITATION_RATE, WeatherField.FOG_DENSITY),
            OutputDomain.CONTINUOUS, Polarity.QUALITY,
            parameters.dayQuality().bands(), parameters.dayQuality().bands().labels(),
            true, new DayQualityFormula(parameters.dayQuality())));

        defs.put(IndexId.CLOTHING, new IndexDefinition(
            IndexId.CLOTHING,
            EnumSet.of(WeatherField.TEMPERATURE, WeatherField.WIND_SPEED, WeatherField.PRECIPITATION_RATE),
            OutputDomain.CATEGORICAL, Polarity.RISK,
            null, ClothingLayer.labels(),
            false, new ClothingFormula(parameters.clothing())));

        defs.put(IndexId.COLD_SHOCK, new IndexDefinition(
            IndexId.COLD_SHOCK,
            EnumSet.of(WeatherField.WATER_TEMPERATURE, WeatherField.WIND_SPEED, WeatherField.RELATIVE_HUMIDITY),
            OutputDomain.CONTINUOUS, Polarity.RISK,
            parameters.coldShock().bands(), parameters.coldShock().bands().labels(),
            true, new ColdShockFormula(parameters.coldShock())));

        defs.put(IndexId.MARITIME_VISIBILITY, new IndexDefinition(
            IndexId.MARITIME_VISIBILITY,
            EnumSet.of(WeatherField.FOG_DENSITY, WeatherField.CLOUD_COVER, WeatherField.PRECIPITATION_RATE),
            OutputDomain.CONTINUOUS, Polarity.QUALITY,
            parameters.visibility().bands(), parameters.visibility().bands().labels(),
            false, new MaritimeVisibilityFormula(parameters.visibility())));

        return new IndexCatalog(parameters, defs);
    }

    public static IndexCatalog standard() {
        return build(CatalogParameters.defaults());
    }

    /** @throws ConfigurationException for an index the catalog does not define */
    public IndexDefinition definition(IndexId id) {
        IndexDefinition def = definitions.get(id);
        if (def == null) {
            throw new ConfigurationException(String.valueOf(id), "Index not in catalog");
        }
        return def;
    }

    /** Definitions in request order, duplicates dropped; empty request means all. */
    public List<IndexDefinition> definitions(Collection<IndexId> requested) {
        if (requested == null || requested.isEmpty()) {
            return new ArrayList<>(definitions.values());
        }
        List<IndexDefinition> result = new ArrayList<>();
        for (IndexId id : new LinkedHashSet<>(requested)) {
            result.add(definition(id));
        }
        return result;
    }

    public Collection<IndexDefinition> all() {
        return definitions.values();
    }

    public Set<IndexId> ids() {
        return definitions.keySet();
    }

    public CatalogParameters parameters() {
        return parameters;
    }
}
