package com.company.fermentation.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Novelty detection over a whole series.
 */
@Value
@Builder
@AllArgsConstructor
public class AnomalyReport {
    boolean hasAnomalies;
    int anomalyCount;
    double anomalyPercentage;
    List<Integer> anomalyIndices;
    List<Double> anomalyTimestamps;

    // One score per compared point, higher is more anomalous
    List<Double> anomalyScores;
    List<AnomalyDetail> anomalyDetails;

    public static AnomalyReport none(int points) {
        return AnomalyReport.builder()
                .hasAnomalies(false)
                .anomalyCount(0)
                .anomalyPercentage(0.0)
                .anomalyIndices(List.of())
                .anomalyTimestamps(List.of())
                .anomalyScores(Collections.nCopies(points, 0.0))
                .anomalyDetails(List.of())
                .build();
    }
}
