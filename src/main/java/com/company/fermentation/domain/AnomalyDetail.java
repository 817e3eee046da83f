package com.company.fermentation.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@AllArgsConstructor
public class AnomalyDetail {
    int index;
    double timestamp;

    // e.g. critical_ph_deviation, warning_temp_deviation
    List<String> types;

    // absolute
    ParameterReadings deviations;
}
