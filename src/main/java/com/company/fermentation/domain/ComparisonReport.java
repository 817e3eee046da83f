package com.company.fermentation.domain;

import com.company.fermentation.domain.enums.DeviationStatus;
import com.company.fermentation.domain.enums.QualityBand;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Per-tick comparison of one batch sample against the reference.
 *
 * <p>Carries two classifications of the same numbers: {@code deviationStatus} follows the
 * warning/critical threshold rules, {@code overallStatus} bands the quality score.
 * Alerting follows {@code overallStatus}.
 */
@Value
@Builder
@AllArgsConstructor
public class ComparisonReport {
    int batchNumber;
    int sampleIndex;
    double timestamp;

    ParameterReadings actual;
    ParameterReadings ideal;
    ParameterReadings deviations;

    ParameterStatuses status;
    DeviationStatus deviationStatus;
    QualityBand overallStatus;

    // 0..100
    double qualityScore;

    // Fused similarity of the samples so far against the reference prefix, 0..1
    double trajectorySimilarity;

    double noveltyScore;
    boolean outlier;

    String batchStatus;
    int expectedQuality;
}
