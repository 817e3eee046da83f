package com.company.fermentation.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
public class ParameterStatistics {
    double mean;
    double std;
    double min;
    double max;
}
