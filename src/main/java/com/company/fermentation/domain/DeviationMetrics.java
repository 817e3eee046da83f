package com.company.fermentation.domain;

import com.company.fermentation.domain.enums.DeviationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@AllArgsConstructor
public class DeviationMetrics {
    double mae;
    double rmse;
    double maxDeviation;
    double correlation;
    double correlationPValue;

    // generated - reference, signed
    List<Double> pointDeviations;
    DeviationStatus status;
}
