package com.company.fermentation.domain.enums;

import com.fasterxml.jackson.annotation.JsonKey;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Process variables tracked for every sample.
 */
public enum Parameter {
    PH("ph", "pH", "ph"),
    TEMPERATURE("temperature", "Temperature", "temp"),
    CO2("co2", "CO2", "co2");

    private final String key;
    private final String displayName;
    private final String tag;

    Parameter(String key, String displayName, String tag) {
        this.key = key;
        this.displayName = displayName;
        this.tag = tag;
    }

    @JsonKey
    @JsonValue
    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Short form used in anomaly type tags, e.g. {@code critical_temp_deviation}
     */
    public String getTag() {
        return tag;
    }

    public static Parameter fromKey(String key) {
        for (Parameter parameter : values()) {
            if (parameter.key.equalsIgnoreCase(key)) {
                return parameter;
            }
        }
        throw new IllegalArgumentException("Unknown parameter: " + key);
    }
}
