package com.company.fermentation.domain;

import com.company.fermentation.domain.enums.Parameter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Full-series comparison of a generated trajectory against a reference.
 */
@Value
@Builder
@AllArgsConstructor
public class SeriesComparison {
    int comparedPoints;
    Map<Parameter, DeviationMetrics> deviations;
    AnomalyReport anomalies;
    SimilarityResult similarity;
    Assessment assessment;
    Instant comparisonTimestamp;
}
