package com.company.fermentation.domain;

import com.company.fermentation.domain.enums.DeviationStatus;
import com.company.fermentation.domain.enums.Parameter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@AllArgsConstructor
public class Assessment {
    DeviationStatus overallStatus;
    String message;
    List<Parameter> criticalParameters;
    List<Parameter> warningParameters;

    // similarity.overall * 100
    double qualityScore;
    List<String> recommendations;
}
