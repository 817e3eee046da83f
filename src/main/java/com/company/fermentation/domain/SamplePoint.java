package com.company.fermentation.domain;

import com.company.fermentation.domain.enums.Parameter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * One reading of all process variables at a point in time.
 */
@Value
@Builder
@AllArgsConstructor
public class SamplePoint {
    double timestamp;
    double ph;
    double temperature;
    double co2;

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

    public double[] toVector() {
        return new double[]{ph, temperature, co2};
    }
}
