package com.weatherdecision.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.weatherdecision.common.exception.ConfigurationException;

/**
 * Identifiers of the derived indices the catalog knows about.
 */
public enum IndexId {
    DAY_QUALITY("day-quality"),
    CLOTHING("clothing"),
    COLD_SHOCK("cold-shock"),
    MARITIME_VISIBILITY("maritime-visibility");

    private final String key;

    IndexId(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Accepts the wire key ({@code "cold-shock"}) or the enum name ({@code "COLD_SHOCK"}).
     *
     * @throws ConfigurationException for an unrecognized identifier
     */
    @JsonCreator
    public static IndexId fromKey(String raw) {
        if (raw != null) {
            String trimmed = raw.trim();
            for (IndexId id : values()) {
                if (id.key.equalsIgnoreCase(trimmed) || id.name().equalsIgnoreCase(trimmed)) {
                    return id;
                }
            }
        }
        throw new ConfigurationException(String.valueOf(raw), "Unknown index identifier");
    }
}
