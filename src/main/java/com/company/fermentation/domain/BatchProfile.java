package com.company.fermentation.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Pre-materialized trajectory of one batch plus the metadata describing it.
 */
@Value
@Builder
@AllArgsConstructor
public class BatchProfile {
    int batchNumber;

    // Label the profile was generated for, e.g. "acceptable"
    String batchStatus;
    int expectedQualityScore;
    String description;

    Series series;
    int durationHours;
    int samplingIntervalMinutes;

    public int totalSamples() {
        return series.size();
    }
}
