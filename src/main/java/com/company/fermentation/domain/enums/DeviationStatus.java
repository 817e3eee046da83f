package com.company.fermentation.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Threshold-rule classification of a deviation.
 */
public enum DeviationStatus {
    NORMAL(0, "Within warning threshold"),
    WARNING(1, "Warning threshold reached"),
    CRITICAL(2, "Critical threshold reached");

    private final int level;
    private final String description;

    DeviationStatus(int level, String description) {
        this.level = level;
        this.description = description;
    }

    public int getLevel() {
        return level;
    }

    public String getDescription() {
        return description;
    }

    @JsonValue
    public String getLabel() {
        return name().toLowerCase();
    }

    public boolean isHigherThan(DeviationStatus other) {
        return this.level > other.level;
    }

    public static DeviationStatus worst(Iterable<DeviationStatus> statuses) {
        DeviationStatus worst = NORMAL;
        for (DeviationStatus status : statuses) {
            if (status.isHigherThan(worst)) {
                worst = status;
            }
        }
        return worst;
    }
}
