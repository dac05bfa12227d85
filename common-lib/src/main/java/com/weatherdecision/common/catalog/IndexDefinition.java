package com.weatherdecision.common.catalog;

import com.weatherdecision.common.model.IndexId;
import com.weatherdecision.common.model.OutputDomain;
import com.weatherdecision.common.model.Polarity;
import com.weatherdecision.common.model.WeatherField;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Catalog entry for one index.
 *
 * @param requiredFields fixed when the catalog is built; exposed as an unmodifiable copy
 * @param bands          band scale for continuous outputs, {@code null} for categorical ones
 * @param categories     ordered category labels, lowest band first
 * @param partialInputs  whether the formula is called even when some required fields are
 *                       missing (it then reports a confidence below 1)
 */
public record IndexDefinition(
    IndexId id,
    Set<WeatherField> requiredFields,
    OutputDomain outputDomain,
    Polarity polarity,
    BandScale bands,
    List<String> categories,
    boolean partialInputs,
    IndexFormula formula
) {

    public IndexDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(formula, "formula");
        requiredFields = Collections.unmodifiableSet(EnumSet.copyOf(requiredFields));
        categories = List.copyOf(categories);
        if (outputDomain == OutputDomain.CONTINUOUS && bands == null) {
            throw new IllegalArgumentException("Continuous index " + id.key() + " needs a band scale");
        }
    }

    /** Position of {@code category} in {@link #categories()}, -1 when unknown. */
    public int rankOf(String category) {
        return categories.indexOf(category);
    }
}
