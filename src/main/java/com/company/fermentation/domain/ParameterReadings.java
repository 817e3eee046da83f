package com.company.fermentation.domain;

import com.company.fermentation.domain.enums.Parameter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * A value per process variable (actual, ideal or deviation).
 */
@Value
@Builder
@AllArgsConstructor
public class ParameterReadings {
    double ph;
    double temperature;
    double co2;

    public static ParameterReadings of(SamplePoint point) {
        return new ParameterReadings(point.getPh(), point.getTemperature(), point.getCo2());
    }

    public double get(Parameter parameter) {
        switch (parameter) {
            case PH:
                return ph;
            case TEMPERATURE:
                return temperature;
            case CO2:
                return co2;
            default:
                throw new IllegalArgumentException("Unsupported parameter: " + parameter);
        }
    }
}
