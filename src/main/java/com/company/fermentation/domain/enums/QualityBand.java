package com.company.fermentation.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Banding of the per-tick quality score. Also the status tracked for alerting.
 */
public enum QualityBand {
    PERFECT("Matches the reference trajectory"),
    ACCEPTABLE("Minor drift from the reference"),
    CONCERNING("Moderate drift, needs attention"),
    FAILED("Out of tolerance");

    private final String description;

    QualityBand(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    @JsonValue
    public String getLabel() {
        return name().toLowerCase();
    }

    public boolean isDegraded() {
        return this != PERFECT;
    }

    public boolean needsAttention() {
        return this == CONCERNING || this == FAILED;
    }

    public static QualityBand fromString(String band) {
        if (band == null) {
            return FAILED;
        }
        try {
            return QualityBand.valueOf(band.toUpperCase());
        } catch (IllegalArgumentException e) {
            return FAILED;
        }
    }
}
