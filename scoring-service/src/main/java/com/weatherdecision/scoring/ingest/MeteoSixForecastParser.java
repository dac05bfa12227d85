package com.weatherdecision.scoring.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.weatherdecision.common.model.WeatherField;
import com.weatherdecision.common.model.WeatherSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads a MeteoSIX {@code getNumericForecastInfo} GeoJSON payload.
 *
 * <pre>
 *   features[].properties.{id, name, days[].variables[].{name, units, values[]}}
 *   values[] = {timeInstant, value | moduleValue + directionValue, modelRun}
 * </pre>
 *
 * <p>A feature carrying an {@code exception} member is skipped and counted. Unknown
 * variables are ignored. Missing, non-numeric and no-data ({@value #NO_DATA} or below)
 * values leave the field missing.
 */
@Component
public class MeteoSixForecastParser {

    private static final Logger log = LoggerFactory.getLogger(MeteoSixForecastParser.class);

    static final double NO_DATA = -9999.0;

    /** {@code yyyy-MM-ddTHH:mm:ss} followed by an offset written as {@code +02:00}, {@code +0200} or {@code Z}. */
    private static final DateTimeFormatter TIME_INSTANT = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
        .optionalStart().appendPattern("XXX").optionalEnd()
        .optionalStart().appendPattern("XX").optionalEnd()
        .toFormatter();

    /**
     * @param samplesByPlace ordered by place id as first seen; each list ordered by time
     * @param placeNames     place id → human-readable name
     */
    public record MeteoSixForecast(
        Map<String, List<WeatherSample>> samplesByPlace,
        Map<String, String> placeNames,
        int skippedFeatures
    ) {}

    public MeteoSixForecast parse(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new IllegalArgumentException("MeteoSIX payload must be a JSON object");
        }
        if (payload.hasNonNull("exception")) {
            throw new IllegalArgumentException("MeteoSIX request failed: " + payload.get("exception"));
        }

        Map<String, Map<Instant, Map<WeatherField, Double>>> byPlace = new LinkedHashMap<>();
        Map<String, String> names = new LinkedHashMap<>();
        int skipped = 0;

        for (JsonNode feature : payload.path("features")) {
            if (feature.hasNonNull("exception")) {
                skipped++;
                log.warn("Skipping MeteoSIX feature with exception: {}", feature.get("exception"));
                continue;
            }
            JsonNode props = feature.path("properties");
            String placeId = props.path("id").asText("").trim();
            if (placeId.isEmpty()) {
                skipped++;
                log.warn("Skipping MeteoSIX feature without place id");
                continue;
            }
            names.putIfAbsent(placeId, props.path("name").asText(placeId));
            Map<Instant, Map<WeatherField, Double>> slots = byPlace.computeIfAbsent(placeId, k -> new TreeMap<>());
            for (JsonNode day : props.path("days")) {
                for (JsonNode variable : day.path("variables")) {
                    readVariable(placeId, variable, slots);
                }
            }
        }

        Map<String, List<WeatherSample>> samplesByPlace = new LinkedHashMap<>();
        byPlace.forEach((placeId, slots) -> {
            List<WeatherSample> samples = new ArrayList<>(slots.size());
            slots.forEach((ts, values) -> samples.add(WeatherSample.of(ts, values)));
            samplesByPlace.put(placeId, samples);
        });
        return new MeteoSixForecast(samplesByPlace, names, skipped);
    }

    private void readVariable(String placeId, JsonNode variable, Map<Instant, Map<WeatherField, Double>> slots) {
        String name = variable.path("name").asText("");
        MeteoSixVariable known = MeteoSixVariable.fromApiName(name).orElse(null);
        if (known == null) {
            log.debug("Ignoring MeteoSIX variable '{}' for place={}", name, placeId);
            return;
        }
        String units = variable.path("units").asText("");
        for (JsonNode point : variable.path("values")) {
            Instant ts = parseInstant(point.path("timeInstant").asText(""));
            if (ts == null) {
                continue;
            }
            if (known == MeteoSixVariable.WIND) {
                Double module = number(point.get("moduleValue"));
                Double direction = number(point.get("directionValue"));
                if (module != null) {
                    slot(slots, ts).put(WeatherField.WIND_SPEED, known.toSampleUnits(module, units));
                }
                if (direction != null) {
                    slot(slots, ts).put(WeatherField.WIND_DIRECTION, direction);
                }
            } else {
                Double value = number(point.get("value"));
                if (value != null) {
                    slot(slots, ts).put(known.field(), known.toSampleUnits(value, units));
                }
            }
        }
    }

    private static Map<WeatherField, Double> slot(Map<Instant, Map<WeatherField, Double>> slots, Instant ts) {
        return slots.computeIfAbsent(ts, k -> new EnumMap<>(WeatherField.class));
    }

    static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw.trim(), TIME_INSTANT).toInstant();
        } catch (DateTimeParseException e) {
            log.warn("Unparseable MeteoSIX timeInstant '{}': {}", raw, e.getMessage());
            return null;
        }
    }

    private static Double number(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return value <= NO_DATA || !Double.isFinite(value) ? null : value;
    }
}
