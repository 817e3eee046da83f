package com.company.fermentation.domain;

import com.company.fermentation.domain.enums.Parameter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
@AllArgsConstructor
public class SimilarityResult {
    Map<Parameter, SimilarityMetrics> parameters;

    // Unweighted mean of the per-parameter averages, 0..1
    double overall;

    public SimilarityMetrics get(Parameter parameter) {
        return parameters.get(parameter);
    }
}
